package de.jwiegmann.distribution.boundary;

import de.jwiegmann.distribution.boundary.dto.error.UploadError;
import de.jwiegmann.distribution.control.UploadErrorFactory;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Übersetzt alle Fehler der Upload- und Verteilungs-Endpunkte in {@link UploadError}.
 */
@Slf4j
@RestControllerAdvice
public class UploadExceptionHandler {

    private final long maxFileSize;
    private final int maxTargetAgents;

    public UploadExceptionHandler(@Value("${upload.max-file-size:5242880}") long maxFileSize,
                                  @Value("${distribution.max-target-agents:10}") int maxTargetAgents) {
        this.maxFileSize = maxFileSize;
        this.maxTargetAgents = maxTargetAgents;
    }

    @ExceptionHandler(UploadValidationException.class)
    public ResponseEntity<UploadError> handleUploadValidation(UploadValidationException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Upload failed: {} - {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("Upload rejected: {} - {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(ex.getError());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<UploadError> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected by multipart limit: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(UploadErrorFactory.fileTooLarge(maxFileSize));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<UploadError> handleMissingPart(MissingServletRequestPartException ex) {
        return ResponseEntity.badRequest().body(UploadErrorFactory.noFile());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<UploadError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String value = String.valueOf(ex.getValue());
        UploadError error = "targetAgentCount".equals(ex.getName())
                ? UploadErrorFactory.invalidTargetAgentCount(value, maxTargetAgents)
                : UploadErrorFactory.invalidParameter(ex.getName(), value);
        log.warn("Invalid request parameter {}: {}", ex.getName(), value);
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<UploadError> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(UploadErrorFactory.internalError("An unexpected error occurred"));
    }
}
