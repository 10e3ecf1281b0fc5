package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Task;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTaskRepositoryTest {

    private final InMemoryTaskRepository repository = new InMemoryTaskRepository();

    @Test
    void insert_assigns_ids() {
        List<Task> created = repository.insertAll(List.of(task("dist-1", "agent-1", "Alice"), task("dist-1", "agent-2", "Bob")));

        assertThat(created).hasSize(2).allSatisfy(t -> assertThat(t.getId()).isNotBlank());
        assertThat(created.get(0).getId()).isNotEqualTo(created.get(1).getId());
        assertThat(repository.findByDistribution("dist-1")).extracting(Task::getFirstName).containsExactly("Alice", "Bob");
    }

    @Test
    void one_invalid_task_stores_nothing() {
        Task tooLongPhone = task("dist-1", "agent-2", "Bob");
        tooLongPhone.setPhone("1".repeat(Task.MAX_PHONE_LENGTH + 1));

        assertThatThrownBy(() -> repository.insertAll(List.of(task("dist-1", "agent-1", "Alice"), tooLongPhone)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Task 1");

        assertThat(repository.findByDistribution("dist-1")).isEmpty();
        assertThat(repository.findByAgent("agent-1", null)).isEmpty();
    }

    @Test
    void rejects_missing_references() {
        Task orphan = task(null, "agent-1", "Alice");

        assertThatThrownBy(() -> repository.insertAll(List.of(orphan)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Distribution reference");
    }

    @Test
    void find_by_agent_filters_status_and_sorts_newest_first() {
        Task older = task("dist-1", "agent-1", "Alice");
        older.setAssignedAt(LocalDateTime.of(2025, 1, 1, 8, 0));
        Task newer = task("dist-2", "agent-1", "Bob");
        newer.setAssignedAt(LocalDateTime.of(2025, 1, 2, 8, 0));
        Task done = task("dist-2", "agent-1", "Carol");
        done.setStatus(Task.Status.COMPLETED);
        done.setAssignedAt(LocalDateTime.of(2025, 1, 3, 8, 0));
        repository.insertAll(List.of(older));
        repository.insertAll(List.of(newer, done, task("dist-2", "agent-2", "Dave")));

        assertThat(repository.findByAgent("agent-1", null)).extracting(Task::getFirstName)
                .containsExactly("Carol", "Bob", "Alice");
        assertThat(repository.findByAgent("agent-1", Task.Status.ASSIGNED)).extracting(Task::getFirstName)
                .containsExactly("Bob", "Alice");
    }

    @Test
    void delete_by_distribution_removes_only_that_distribution() {
        repository.insertAll(List.of(task("dist-1", "agent-1", "Alice"), task("dist-1", "agent-1", "Bob")));
        repository.insertAll(List.of(task("dist-2", "agent-1", "Carol")));

        assertThat(repository.deleteByDistribution("dist-1")).isEqualTo(2);
        assertThat(repository.deleteByDistribution("unknown")).isZero();
        assertThat(repository.findByAgent("agent-1", null)).extracting(Task::getFirstName).containsExactly("Carol");
    }

    private static Task task(String distributionId, String agentId, String firstName) {
        return Task.builder()
                .distributionId(distributionId)
                .agentId(agentId)
                .firstName(firstName)
                .phone("555-123-4567")
                .build();
    }
}
