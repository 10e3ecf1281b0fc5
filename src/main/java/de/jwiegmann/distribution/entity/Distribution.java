package de.jwiegmann.distribution.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ein Upload-Vorgang und seine Aufteilung auf die Agenten.
 * Lebenszyklus: PROCESSING -> COMPLETED | FAILED, wird nie gelöscht.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Distribution {

    private String id;
    private String filename;          // eindeutiger Ablagename
    private String originalName;      // bereinigter Name aus dem Upload
    private int totalItems;

    @Builder.Default
    private Status status = Status.PROCESSING;

    private String processingError;   // nur bei FAILED
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String uploadedBy;
    private DistributionSummary distributionSummary; // nur bei COMPLETED

    public enum Status {
        @JsonProperty("processing") PROCESSING,
        @JsonProperty("completed") COMPLETED,
        @JsonProperty("failed") FAILED
    }
}
