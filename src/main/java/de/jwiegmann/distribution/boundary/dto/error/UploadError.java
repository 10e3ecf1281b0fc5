package de.jwiegmann.distribution.boundary.dto.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Maschinenlesbarer Fehler für alle Upload- und Verteilungs-Endpunkte.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadError {
    private String code;
    private String message;
    private Object details;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
