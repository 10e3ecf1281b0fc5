package de.jwiegmann.distribution.boundary.dto.upload;

import de.jwiegmann.distribution.boundary.dto.distribution.DistributionSummaryResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response für POST /api/upload nach erfolgreicher Verteilung.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadCommitResponse {
    private String distributionId;
    private String filename;
    private int totalItems;
    private DistributionSummaryResponse summary;
}
