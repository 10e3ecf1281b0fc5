package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Task;

import java.util.List;

public interface TaskRepository {

    /**
     * Bulk insert: entweder werden alle Tasks gespeichert oder keiner.
     *
     * @return gespeicherte Tasks mit vergebener id
     * @throws IllegalArgumentException wenn ein Task das Schema verletzt
     */
    List<Task> insertAll(List<Task> tasks);

    List<Task> findByDistribution(String distributionId);

    /**
     * @param status optionaler Filter, {@code null} für alle
     */
    List<Task> findByAgent(String agentId, Task.Status status);

    int deleteByDistribution(String distributionId);
}
