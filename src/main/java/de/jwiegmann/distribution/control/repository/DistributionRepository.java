package de.jwiegmann.distribution.control.repository;

import de.jwiegmann.distribution.entity.Distribution;
import de.jwiegmann.distribution.entity.DistributionSummary;

import java.util.List;
import java.util.Optional;

public interface DistributionRepository {

    Distribution save(Distribution distribution);

    Optional<Distribution> find(String distributionId);

    /**
     * Neueste zuerst.
     */
    List<Distribution> findByUploader(String uploadedBy);

    /**
     * PROCESSING -> COMPLETED mit Zusammenfassung.
     *
     * @throws IllegalStateException wenn die Zusammenfassung nicht zu totalItems passt
     */
    Distribution markCompleted(String distributionId, DistributionSummary summary);

    /**
     * PROCESSING -> FAILED mit Fehlermeldung.
     */
    Distribution markFailed(String distributionId, String error);
}
