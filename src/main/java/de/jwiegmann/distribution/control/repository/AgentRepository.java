package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Agent;

import java.util.List;
import java.util.Optional;

public interface AgentRepository {

    Agent save(Agent agent);

    Optional<Agent> find(String agentId);

    /**
     * Aktive Agenten, älteste zuerst (createdAt aufsteigend, bei Gleichstand nach id).
     */
    List<Agent> findActiveAgents();
}
