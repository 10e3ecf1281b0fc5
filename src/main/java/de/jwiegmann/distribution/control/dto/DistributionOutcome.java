package de.jwiegmann.distribution.control.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Ergebnis eines Verteilungslaufs: entweder alle Tasks angelegt oder keiner.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DistributionOutcome {

    private final DistributionPlan plan;
    private final int tasksCreated;
    private final String failureReason;

    public static DistributionOutcome completed(DistributionPlan plan, int tasksCreated) {
        return new DistributionOutcome(plan, tasksCreated, null);
    }

    public static DistributionOutcome failed(String reason) {
        return new DistributionOutcome(null, 0, reason != null ? reason : "unknown error");
    }

    public boolean isCompleted() {
        return failureReason == null;
    }
}
