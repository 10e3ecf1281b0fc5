package de.jwiegmann.distribution.control.exception;

import de.jwiegmann.distribution.boundary.dto.error.UploadError;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Abbruch einer Pipeline-Stufe mit typisiertem Fehler.
 * Wird vom UploadExceptionHandler in eine {@link UploadError}-Response übersetzt.
 */
@Getter
public class UploadValidationException extends RuntimeException {

    private final HttpStatus status;
    private final UploadError error;

    public UploadValidationException(HttpStatus status, UploadError error) {
        super(error.getMessage());
        this.status = status;
        this.error = error;
    }

    public UploadValidationException(UploadError error) {
        this(HttpStatus.BAD_REQUEST, error);
    }

    public String getErrorCode() {
        return error.getCode();
    }
}
