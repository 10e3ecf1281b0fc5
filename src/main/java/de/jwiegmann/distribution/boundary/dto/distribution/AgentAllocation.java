package de.jwiegmann.distribution.boundary.dto.distribution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentAllocation {
    private String agentId;
    private String agentName;
    private String agentEmail;
    private int itemCount;
}
