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
public class DistributionDetailResponse {
    private DistributionResponse distribution;
    private List<AgentTasks> agents;   // in Reihenfolge der Zuteilung
}
