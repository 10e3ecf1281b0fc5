package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Agent;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAgentRepository implements AgentRepository {

    private static final Comparator<Agent> OLDEST_FIRST = Comparator
            .comparing(Agent::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Agent::getId);

    private final Map<String, Agent> store = new ConcurrentHashMap<>();

    @Override
    public Agent save(Agent agent) {
        if (agent.getId() == null) {
            agent.setId(UUID.randomUUID().toString());
        }
        if (agent.getCreatedAt() == null) {
            agent.setCreatedAt(LocalDateTime.now());
        }
        store.put(agent.getId(), agent);
        return agent;
    }

    @Override
    public Optional<Agent> find(String agentId) {
        return Optional.ofNullable(store.get(agentId));
    }

    @Override
    public List<Agent> findActiveAgents() {
        return store.values().stream()
                .filter(Agent::isActive)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    public void deleteAll() {
        store.clear();
    }
}
