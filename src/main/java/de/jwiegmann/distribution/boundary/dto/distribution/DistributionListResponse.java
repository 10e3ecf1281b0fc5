package de.jwiegmann.distribution.boundary.dto.distribution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionListResponse {
    private int total;                          // Anzahl gefundener Distributions
    private List<DistributionResponse> items;   // neueste zuerst
}
