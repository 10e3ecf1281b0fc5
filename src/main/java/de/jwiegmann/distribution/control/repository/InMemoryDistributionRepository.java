package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Distribution;
import de.jwiegmann.distribution.entity.DistributionSummary;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDistributionRepository implements DistributionRepository {

    private final Map<String, Distribution> store = new ConcurrentHashMap<>();

    @Override
    public Distribution save(Distribution distribution) {
        if (distribution.getId() == null) {
            distribution.setId(UUID.randomUUID().toString());
        }
        LocalDateTime now = LocalDateTime.now();
        if (distribution.getCreatedAt() == null) {
            distribution.setCreatedAt(now);
        }
        distribution.setUpdatedAt(now);
        store.put(distribution.getId(), distribution);
        return distribution;
    }

    @Override
    public Optional<Distribution> find(String distributionId) {
        return Optional.ofNullable(store.get(distributionId));
    }

    @Override
    public List<Distribution> findByUploader(String uploadedBy) {
        return store.values().stream()
                .filter(d -> d.getUploadedBy().equals(uploadedBy))
                .sorted(Comparator.comparing(Distribution::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public Distribution markCompleted(String distributionId, DistributionSummary summary) {
        Distribution distribution = require(distributionId);
        if (summary.coveredItems() != distribution.getTotalItems()) {
            throw new IllegalStateException("Distribution summary does not match total items");
        }
        distribution.setStatus(Distribution.Status.COMPLETED);
        distribution.setDistributionSummary(summary);
        return save(distribution);
    }

    @Override
    public Distribution markFailed(String distributionId, String error) {
        Distribution distribution = require(distributionId);
        distribution.setStatus(Distribution.Status.FAILED);
        distribution.setProcessingError(error);
        return save(distribution);
    }

    public void deleteAll() {
        store.clear();
    }

    private Distribution require(String distributionId) {
        Distribution distribution = store.get(distributionId);
        if (distribution == null) {
            throw new NoSuchElementException("Distribution " + distributionId + " not found");
        }
        return distribution;
    }
}
