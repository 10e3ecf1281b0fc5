package de.jwiegmann.distribution.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionSummary {
    private int totalAgents;
    private int itemsPerAgent;
    private int remainderItems;

    /**
     * Anzahl Items, die sich aus der Zusammenfassung ergibt.
     */
    public int coveredItems() {
        return totalAgents * itemsPerAgent + remainderItems;
    }
}
