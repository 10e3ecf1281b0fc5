package de.jwiegmann.distribution.boundary.dto.distribution;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.distribution.control.dto.DistributionPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aufteilung je Agent, für Vorschau (ohne tasksCreated) und Commit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DistributionSummaryResponse {
    private int totalItems;
    private int totalAgents;
    private int itemsPerAgent;
    private int remainderItems;
    private Integer tasksCreated;
    private List<AgentAllocation> agents;

    public static DistributionSummaryResponse from(DistributionPlan plan, Integer tasksCreated) {
        return DistributionSummaryResponse.builder()
                .totalItems(plan.getTotalItems())
                .totalAgents(plan.getTotalAgents())
                .itemsPerAgent(plan.getItemsPerAgent())
                .remainderItems(plan.getRemainderItems())
                .tasksCreated(tasksCreated)
                .agents(plan.getAssignments().stream()
                        .map(a -> AgentAllocation.builder()
                                .agentId(a.getAgentId())
                                .agentName(a.getAgentName())
                                .agentEmail(a.getAgentEmail())
                                .itemCount(a.getItemCount())
                                .build())
                        .toList())
                .build();
    }
}
