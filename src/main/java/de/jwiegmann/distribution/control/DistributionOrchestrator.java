package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.AgentAssignment;
import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.DistributionOutcome;
import de.jwiegmann.distribution.control.dto.DistributionPlan;
import de.jwiegmann.distribution.control.repository.TaskRepository;
import de.jwiegmann.distribution.entity.Agent;
import de.jwiegmann.distribution.entity.Distribution;
import de.jwiegmann.distribution.entity.Task;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Führt eine Verteilung für eine bereits angelegte Distribution (PROCESSING) aus:
 * Aufteilung berechnen, einen Task pro Item erzeugen und alle Tasks in einem einzigen
 * Bulk-Insert speichern. Der Statuswechsel der Distribution liegt beim Aufrufer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributionOrchestrator {

    private final DistributionEngine distributionEngine;
    private final TaskRepository taskRepository;

    /**
     * @param distribution     Distribution im Status PROCESSING
     * @param items            validierte Items in Dateireihenfolge
     * @param roster           Snapshot der aktiven Agenten, älteste zuerst
     * @param targetAgentCount gewünschte Anzahl Agenten oder {@code null}
     * @return COMPLETED mit Plan und Anzahl Tasks, oder FAILED mit Grund; es werden nie nur
     * einzelne Tasks angelegt
     */
    public DistributionOutcome distribute(Distribution distribution,
                                          List<ContactItem> items,
                                          List<Agent> roster,
                                          Integer targetAgentCount) {
        try {
            DistributionPlan plan = distributionEngine.plan(items, roster, targetAgentCount);
            List<Task> tasks = toTasks(distribution.getId(), plan, LocalDateTime.now());

            List<Task> created = taskRepository.insertAll(tasks);

            log.info("Distribution {}: {} tasks created for {} agents ({} per agent, {} remainder)",
                    distribution.getId(), created.size(), plan.getTotalAgents(),
                    plan.getItemsPerAgent(), plan.getRemainderItems());
            return DistributionOutcome.completed(plan, created.size());

        } catch (RuntimeException e) {
            log.warn("Distribution {} failed: {}", distribution.getId(), e.getMessage());
            return DistributionOutcome.failed("Distribution failed: " + e.getMessage());
        }
    }

    static List<Task> toTasks(String distributionId, DistributionPlan plan, LocalDateTime assignedAt) {
        List<Task> tasks = new ArrayList<>(plan.getTotalItems());
        for (AgentAssignment assignment : plan.getAssignments()) {
            for (ContactItem item : assignment.getItems()) {
                tasks.add(Task.builder()
                        .distributionId(distributionId)
                        .agentId(assignment.getAgentId())
                        .firstName(item.getFirstName())
                        .phone(item.getPhone())
                        .notes(item.getNotes() != null ? item.getNotes() : "")
                        .status(Task.Status.ASSIGNED)
                        .assignedAt(assignedAt)
                        .build());
            }
        }
        return tasks;
    }
}
