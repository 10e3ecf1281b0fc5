package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.AgentAssignment;
import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.DistributionPlan;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.entity.Agent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Teilt Items gleichmäßig auf die Agenten auf. Seiteneffektfrei, der Roster wird
 * als fertiger Snapshot übergeben.
 *
 * <p>Jeder Agent erhält {@code N / A} oder {@code N / A + 1} Items; die ersten
 * {@code N % A} Agenten in Roster-Reihenfolge bekommen das zusätzliche Item. Die Items
 * werden in Dateireihenfolge zusammenhängend geschnitten, gleiche Eingabe ergibt
 * immer die gleiche Aufteilung.
 */
@Component
public class DistributionEngine {

    private final int defaultTargetAgents;
    private final int maxTargetAgents;

    public DistributionEngine(@Value("${distribution.default-target-agents:5}") int defaultTargetAgents,
                              @Value("${distribution.max-target-agents:10}") int maxTargetAgents) {
        this.defaultTargetAgents = defaultTargetAgents;
        this.maxTargetAgents = maxTargetAgents;
    }

    /**
     * Löst die Zielanzahl auf und prüft sie gegen [1, max].
     *
     * @param targetAgentCount vom Aufrufer angefordert, {@code null} für den Default
     * @throws UploadValidationException INVALID_TARGET_AGENT_COUNT
     */
    public int resolveTargetAgentCount(Integer targetAgentCount) {
        int target = targetAgentCount != null ? targetAgentCount : defaultTargetAgents;
        if (target < 1 || target > maxTargetAgents) {
            throw new UploadValidationException(
                    UploadErrorFactory.invalidTargetAgentCount(targetAgentCount, maxTargetAgents));
        }
        return target;
    }

    /**
     * @param items            validierte Items in Dateireihenfolge
     * @param roster           aktive Agenten, älteste zuerst
     * @param targetAgentCount gewünschte Anzahl Agenten oder {@code null}
     * @return vollständige Zuordnung jedes Items zu genau einem Agenten
     * @throws UploadValidationException INVALID_TARGET_AGENT_COUNT, NO_ACTIVE_AGENTS oder EMPTY_FILE
     */
    public DistributionPlan plan(List<ContactItem> items, List<Agent> roster, Integer targetAgentCount) {
        int target = resolveTargetAgentCount(targetAgentCount);

        if (roster == null || roster.isEmpty()) {
            throw new UploadValidationException(HttpStatus.CONFLICT, UploadErrorFactory.noActiveAgents());
        }
        if (items == null || items.isEmpty()) {
            throw new UploadValidationException(UploadErrorFactory.emptyFile());
        }

        List<Agent> participants = roster.subList(0, Math.min(target, roster.size()));
        int totalAgents = participants.size();
        int totalItems = items.size();
        int itemsPerAgent = totalItems / totalAgents;
        int remainderItems = totalItems % totalAgents;

        List<AgentAssignment> assignments = new ArrayList<>(totalAgents);
        int currentIndex = 0;
        for (int agentIndex = 0; agentIndex < totalAgents; agentIndex++) {
            Agent agent = participants.get(agentIndex);
            int count = itemsPerAgent + (agentIndex < remainderItems ? 1 : 0);

            assignments.add(AgentAssignment.builder()
                    .agentId(agent.getId())
                    .agentName(agent.getName())
                    .agentEmail(agent.getEmail())
                    .items(List.copyOf(items.subList(currentIndex, currentIndex + count)))
                    .build());

            currentIndex += count;
        }

        return DistributionPlan.builder()
                .totalItems(totalItems)
                .totalAgents(totalAgents)
                .itemsPerAgent(itemsPerAgent)
                .remainderItems(remainderItems)
                .assignments(List.copyOf(assignments))
                .build();
    }
}
