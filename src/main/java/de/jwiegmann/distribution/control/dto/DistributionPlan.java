package de.jwiegmann.distribution.control.dto;

import de.jwiegmann.distribution.entity.DistributionSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Berechnete Aufteilung der Items auf die teilnehmenden Agenten (Roster-Reihenfolge).
 */
@Value
@Builder
public class DistributionPlan {
    int totalItems;
    int totalAgents;
    int itemsPerAgent;
    int remainderItems;
    List<AgentAssignment> assignments;

    public DistributionSummary toSummary() {
        return DistributionSummary.builder()
                .totalAgents(totalAgents)
                .itemsPerAgent(itemsPerAgent)
                .remainderItems(remainderItems)
                .build();
    }
}
