package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Task;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryTaskRepository implements TaskRepository {

    // Map<distributionId, Tasks in Einfügereihenfolge>
    private final Map<String, List<Task>> store = new ConcurrentHashMap<>();

    @Override
    public synchronized List<Task> insertAll(List<Task> tasks) {

        // Erst alles prüfen, dann schreiben
        for (int i = 0; i < tasks.size(); i++) {
            checkSchema(tasks.get(i), i);
        }

        LocalDateTime now = LocalDateTime.now();
        List<Task> created = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            task.setId(UUID.randomUUID().toString());
            if (task.getAssignedAt() == null) {
                task.setAssignedAt(now);
            }
            store.computeIfAbsent(task.getDistributionId(), k -> new ArrayList<>()).add(task);
            created.add(task);
        }
        return created;
    }

    @Override
    public synchronized List<Task> findByDistribution(String distributionId) {
        return List.copyOf(store.getOrDefault(distributionId, List.of()));
    }

    @Override
    public synchronized List<Task> findByAgent(String agentId, Task.Status status) {
        return store.values().stream()
                .flatMap(List::stream)
                .filter(t -> t.getAgentId().equals(agentId))
                .filter(t -> status == null || t.getStatus() == status)
                .sorted(Comparator.comparing(Task::getAssignedAt).reversed())
                .toList();
    }

    @Override
    public synchronized int deleteByDistribution(String distributionId) {
        List<Task> removed = store.remove(distributionId);
        return removed == null ? 0 : removed.size();
    }

    public synchronized void deleteAll() {
        store.clear();
    }

    private static void checkSchema(Task task, int index) {
        String prefix = "Task " + index + ": ";
        if (task.getDistributionId() == null) {
            throw new IllegalArgumentException(prefix + "Distribution reference is required");
        }
        if (task.getAgentId() == null) {
            throw new IllegalArgumentException(prefix + "Agent reference is required");
        }
        if (task.getFirstName() == null || task.getFirstName().isBlank()) {
            throw new IllegalArgumentException(prefix + "First name is required");
        }
        if (task.getFirstName().length() > Task.MAX_FIRST_NAME_LENGTH) {
            throw new IllegalArgumentException(prefix + "First name cannot exceed " + Task.MAX_FIRST_NAME_LENGTH + " characters");
        }
        if (task.getPhone() == null || task.getPhone().isBlank()) {
            throw new IllegalArgumentException(prefix + "Phone number is required");
        }
        if (task.getPhone().length() > Task.MAX_PHONE_LENGTH) {
            throw new IllegalArgumentException(prefix + "Phone number cannot exceed " + Task.MAX_PHONE_LENGTH + " characters");
        }
        if (task.getNotes() != null && task.getNotes().length() > Task.MAX_NOTES_LENGTH) {
            throw new IllegalArgumentException(prefix + "Notes cannot exceed " + Task.MAX_NOTES_LENGTH + " characters");
        }
    }
}
