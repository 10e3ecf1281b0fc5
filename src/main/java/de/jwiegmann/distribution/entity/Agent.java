package de.jwiegmann.distribution.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent, dem Kontakte zugewiesen werden können.
 * Wird außerhalb der Verteilung gepflegt und hier nur gelesen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    private String id;
    private String name;
    private String email;

    @Builder.Default
    private boolean active = true;

    private LocalDateTime createdAt;
}
