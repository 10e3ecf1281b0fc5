package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.boundary.dto.distribution.AgentResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.AgentTasks;
import de.jwiegmann.distribution.boundary.dto.distribution.AgentTasksResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionDetailResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionListResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.TaskResponse;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.control.repository.AgentRepository;
import de.jwiegmann.distribution.control.repository.DistributionRepository;
import de.jwiegmann.distribution.control.repository.TaskRepository;
import de.jwiegmann.distribution.entity.Agent;
import de.jwiegmann.distribution.entity.Distribution;
import de.jwiegmann.distribution.entity.Task;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lesezugriffe auf Distributions und die daraus entstandenen Tasks.
 */
@Service
@RequiredArgsConstructor
public class DistributionQueryService {

    private final DistributionRepository distributionRepository;
    private final TaskRepository taskRepository;
    private final AgentRepository agentRepository;

    public DistributionListResponse getDistributions(String uploadedBy) {
        List<DistributionResponse> items = distributionRepository.findByUploader(uploadedBy).stream()
                .map(DistributionResponse::from)
                .toList();
        return DistributionListResponse.builder()
                .total(items.size())
                .items(items)
                .build();
    }

    /**
     * Distribution mit ihren Tasks, gruppiert nach Agent in Reihenfolge der Zuteilung.
     *
     * @throws UploadValidationException NOT_FOUND oder FORBIDDEN, wenn die Distribution
     *                                   einem anderen Benutzer gehört
     */
    public DistributionDetailResponse getDistribution(String distributionId, String requestedBy) {
        Distribution distribution = distributionRepository.find(distributionId)
                .orElseThrow(() -> new UploadValidationException(HttpStatus.NOT_FOUND,
                        UploadErrorFactory.notFound("Distribution")));

        if (!distribution.getUploadedBy().equals(requestedBy)) {
            throw new UploadValidationException(HttpStatus.FORBIDDEN, UploadErrorFactory.forbidden(distributionId));
        }

        Map<String, List<TaskResponse>> tasksByAgent = new LinkedHashMap<>();
        for (Task task : taskRepository.findByDistribution(distributionId)) {
            tasksByAgent.computeIfAbsent(task.getAgentId(), k -> new ArrayList<>()).add(TaskResponse.from(task));
        }

        List<AgentTasks> agents = tasksByAgent.entrySet().stream()
                .map(entry -> AgentTasks.builder()
                        .agent(agentRepository.find(entry.getKey())
                                .map(AgentResponse::from)
                                // Agent wurde inzwischen entfernt
                                .orElseGet(() -> AgentResponse.builder().id(entry.getKey()).build()))
                        .tasks(entry.getValue())
                        .build())
                .toList();

        return DistributionDetailResponse.builder()
                .distribution(DistributionResponse.from(distribution))
                .agents(agents)
                .build();
    }

    /**
     * @param status optionaler Filter ("assigned" oder "completed")
     * @throws UploadValidationException NOT_FOUND
     */
    public AgentTasksResponse getAgentTasks(String agentId, Task.Status status) {
        Agent agent = agentRepository.find(agentId)
                .orElseThrow(() -> new UploadValidationException(HttpStatus.NOT_FOUND,
                        UploadErrorFactory.notFound("Agent")));

        List<Task> tasks = taskRepository.findByAgent(agentId, status);
        int completed = (int) tasks.stream().filter(t -> t.getStatus() == Task.Status.COMPLETED).count();
        int pending = (int) tasks.stream().filter(t -> t.getStatus() == Task.Status.ASSIGNED).count();

        return AgentTasksResponse.builder()
                .agent(AgentResponse.from(agent))
                .tasks(tasks.stream().map(TaskResponse::from).toList())
                .totalTasks(tasks.size())
                .completedTasks(completed)
                .pendingTasks(pending)
                .build();
    }
}
