package de.jwiegmann.distribution.boundary.dto.distribution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response für GET /api/agents/{id}/tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTasksResponse {
    private AgentResponse agent;
    private List<TaskResponse> tasks;   // neueste zuerst
    private int totalTasks;
    private int completedTasks;
    private int pendingTasks;
}
