package de.jwiegmann.distribution.control.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Zusammenhängender Ausschnitt der Items, der einem Agenten zugeteilt wird.
 */
@Value
@Builder
public class AgentAssignment {
    String agentId;
    String agentName;
    String agentEmail;
    List<ContactItem> items;

    public int getItemCount() {
        return items.size();
    }
}
