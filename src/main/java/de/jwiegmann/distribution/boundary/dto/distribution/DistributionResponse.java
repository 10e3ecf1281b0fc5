package de.jwiegmann.distribution.boundary.dto.distribution;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.distribution.entity.Distribution;
import de.jwiegmann.distribution.entity.DistributionSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DistributionResponse {
    private String id;
    private String filename;
    private String originalName;
    private int totalItems;
    private Distribution.Status status;
    private String processingError;
    private LocalDateTime createdAt;
    private String uploadedBy;
    private DistributionSummary distributionSummary;

    public static DistributionResponse from(Distribution d) {
        return DistributionResponse.builder()
                .id(d.getId())
                .filename(d.getFilename())
                .originalName(d.getOriginalName())
                .totalItems(d.getTotalItems())
                .status(d.getStatus())
                .processingError(d.getProcessingError())
                .createdAt(d.getCreatedAt())
                .uploadedBy(d.getUploadedBy())
                .distributionSummary(d.getDistributionSummary())
                .build();
    }
}
