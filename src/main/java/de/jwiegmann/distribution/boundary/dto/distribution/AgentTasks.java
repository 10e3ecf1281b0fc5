package de.jwiegmann.distribution.boundary.dto.distribution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tasks eines Agenten innerhalb einer Distribution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTasks {
    private AgentResponse agent;
    private List<TaskResponse> tasks;
}
