package de.jwiegmann.distribution.boundary.dto.distribution;

import de.jwiegmann.distribution.entity.Agent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {
    private String id;
    private String name;
    private String email;

    public static AgentResponse from(Agent agent) {
        return new AgentResponse(agent.getId(), agent.getName(), agent.getEmail());
    }
}
