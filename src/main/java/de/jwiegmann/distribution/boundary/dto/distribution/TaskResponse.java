package de.jwiegmann.distribution.boundary.dto.distribution;

import de.jwiegmann.distribution.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {
    private String id;
    private String distributionId;
    private String firstName;
    private String phone;
    private String notes;
    private Task.Status status;
    private LocalDateTime assignedAt;
    private LocalDateTime completedAt;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(task.getId())
                .distributionId(task.getDistributionId())
                .firstName(task.getFirstName())
                .phone(task.getPhone())
                .notes(task.getNotes())
                .status(task.getStatus())
                .assignedAt(task.getAssignedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
