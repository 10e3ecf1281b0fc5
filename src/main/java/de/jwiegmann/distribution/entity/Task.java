package de.jwiegmann.distribution.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ein einzelner Kontakt, der genau einem Agenten zugewiesen ist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    public static final int MAX_FIRST_NAME_LENGTH = 100;
    public static final int MAX_PHONE_LENGTH = 20;
    public static final int MAX_NOTES_LENGTH = 1000;

    private String id;
    private String distributionId;
    private String agentId;
    private String firstName;
    private String phone;

    @Builder.Default
    private String notes = "";

    @Builder.Default
    private Status status = Status.ASSIGNED;

    private LocalDateTime assignedAt;
    private LocalDateTime completedAt;

    public enum Status {
        @JsonProperty("assigned") ASSIGNED,
        @JsonProperty("completed") COMPLETED
    }
}
