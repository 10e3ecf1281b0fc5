package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.boundary.dto.distribution.DistributionSummaryResponse;
import de.jwiegmann.distribution.boundary.dto.upload.FileInfo;
import de.jwiegmann.distribution.boundary.dto.upload.UploadCommitResponse;
import de.jwiegmann.distribution.boundary.dto.upload.UploadPreviewResponse;
import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.DistributionOutcome;
import de.jwiegmann.distribution.control.dto.DistributionPlan;
import de.jwiegmann.distribution.control.dto.ParsedFile;
import de.jwiegmann.distribution.control.dto.RawUpload;
import de.jwiegmann.distribution.control.dto.ValidatedUpload;
import de.jwiegmann.distribution.control.dto.ValidationProfile;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.control.repository.AgentRepository;
import de.jwiegmann.distribution.control.repository.DistributionRepository;
import de.jwiegmann.distribution.control.repository.TaskRepository;
import de.jwiegmann.distribution.entity.Agent;
import de.jwiegmann.distribution.entity.Distribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hauptservice für Upload und Verteilung von Kontaktlisten.
 * Führt die Stufen UploadGate -> Parser -> Zeilenvalidierung -> Verteilung strikt
 * nacheinander aus; jede Stufe arbeitet auf dem vollständigen Ergebnis der vorherigen.
 */
@Slf4j
@Service
public class UploadService {

    private final UploadGate uploadGate;
    private final ContactFileParser contactFileParser;
    private final ContactRowValidator contactRowValidator;
    private final DistributionEngine distributionEngine;
    private final DistributionOrchestrator distributionOrchestrator;
    private final AgentRepository agentRepository;
    private final DistributionRepository distributionRepository;
    private final TaskRepository taskRepository;
    private final int previewRows;

    public UploadService(UploadGate uploadGate,
                         ContactFileParser contactFileParser,
                         ContactRowValidator contactRowValidator,
                         DistributionEngine distributionEngine,
                         DistributionOrchestrator distributionOrchestrator,
                         AgentRepository agentRepository,
                         DistributionRepository distributionRepository,
                         TaskRepository taskRepository,
                         @Value("${upload.preview-rows:5}") int previewRows) {
        this.uploadGate = uploadGate;
        this.contactFileParser = contactFileParser;
        this.contactRowValidator = contactRowValidator;
        this.distributionEngine = distributionEngine;
        this.distributionOrchestrator = distributionOrchestrator;
        this.agentRepository = agentRepository;
        this.distributionRepository = distributionRepository;
        this.taskRepository = taskRepository;
        this.previewRows = previewRows;
    }

    /**
     * Prüft eine Datei und liefert eine Vorschau, ohne etwas zu speichern.
     *
     * @param upload              hochgeladene Datei
     * @param targetAgentCount    gewünschte Anzahl Agenten oder {@code null}
     * @param includeDistribution ob die Aufteilung auf die aktiven Agenten mitberechnet werden soll
     * @return bereinigter Dateiname, Zeilenanzahl, erste Zeilen und ggf. Verteilungsvorschau
     * @throws UploadValidationException bei jedem Fehler einer Pipeline-Stufe
     */
    public UploadPreviewResponse preview(RawUpload upload, Integer targetAgentCount, boolean includeDistribution) {

        ValidatedUpload accepted = uploadGate.accept(upload);
        List<ContactItem> items = parseAndValidate(accepted, ValidationProfile.PREVIEW);
        int target = distributionEngine.resolveTargetAgentCount(targetAgentCount);

        DistributionSummaryResponse distribution = null;
        if (includeDistribution) {
            DistributionPlan plan = distributionEngine.plan(items, agentRepository.findActiveAgents(), target);
            distribution = DistributionSummaryResponse.from(plan, null);
        }

        return UploadPreviewResponse.builder()
                .filename(accepted.getFilename())
                .totalRows(items.size())
                .preview(items.subList(0, Math.min(previewRows, items.size())))
                .columns(ContactColumn.canonicalNames())
                .fileInfo(fileInfo(accepted))
                .distribution(distribution)
                .build();
    }

    /**
     * Prüft eine Datei, legt eine Distribution an und verteilt alle Zeilen als Tasks.
     * Entweder existieren danach alle Tasks und die Distribution ist COMPLETED, oder es
     * existiert kein Task und die Distribution ist FAILED.
     *
     * @param upload           hochgeladene Datei
     * @param targetAgentCount gewünschte Anzahl Agenten oder {@code null}
     * @param uploadedBy       Identität des Aufrufers
     * @return id der Distribution und Zusammenfassung der Verteilung
     * @throws UploadValidationException bei Fehlern vor der Anlage der Distribution,
     *                                   INTERNAL_ERROR wenn die Verteilung selbst fehlschlägt
     */
    public UploadCommitResponse commit(RawUpload upload, Integer targetAgentCount, String uploadedBy) {

        // 1. Datei prüfen, parsen, validieren
        ValidatedUpload accepted = uploadGate.accept(upload);
        List<ContactItem> items = parseAndValidate(accepted, ValidationProfile.COMMIT);

        // 2. Vorbedingungen der Verteilung, noch ohne Persistenz
        int target = distributionEngine.resolveTargetAgentCount(targetAgentCount);
        List<Agent> roster = agentRepository.findActiveAgents();
        if (roster.isEmpty()) {
            log.warn("Upload {} rejected: no active agents", accepted.getFilename());
            throw new UploadValidationException(HttpStatus.CONFLICT, UploadErrorFactory.noActiveAgents());
        }

        // 3. Distribution anlegen
        Distribution distribution = distributionRepository.save(Distribution.builder()
                .filename(accepted.getUniqueFilename())
                .originalName(accepted.getFilename())
                .totalItems(items.size())
                .uploadedBy(uploadedBy)
                .status(Distribution.Status.PROCESSING)
                .build());

        // 4. Verteilen und Status setzen
        DistributionOutcome outcome = distributionOrchestrator.distribute(distribution, items, roster, target);
        if (!outcome.isCompleted()) {
            distributionRepository.markFailed(distribution.getId(), outcome.getFailureReason());
            throw new UploadValidationException(HttpStatus.INTERNAL_SERVER_ERROR,
                    UploadErrorFactory.distributionFailed(distribution.getId()));
        }

        try {
            distributionRepository.markCompleted(distribution.getId(), outcome.getPlan().toSummary());
        } catch (RuntimeException e) {
            // Tasks existieren bereits, daher zurücknehmen
            int removed = taskRepository.deleteByDistribution(distribution.getId());
            log.error("Completing distribution {} failed, removed {} tasks", distribution.getId(), removed, e);
            distributionRepository.markFailed(distribution.getId(), e.getMessage());
            throw new UploadValidationException(HttpStatus.INTERNAL_SERVER_ERROR,
                    UploadErrorFactory.distributionFailed(distribution.getId()));
        }

        log.info("Upload {} distributed as {}: {} items, {} agents",
                accepted.getFilename(), distribution.getId(), items.size(), outcome.getPlan().getTotalAgents());

        return UploadCommitResponse.builder()
                .distributionId(distribution.getId())
                .filename(accepted.getFilename())
                .totalItems(items.size())
                .summary(DistributionSummaryResponse.from(outcome.getPlan(), outcome.getTasksCreated()))
                .build();
    }

    private List<ContactItem> parseAndValidate(ValidatedUpload accepted, ValidationProfile profile) {
        ParsedFile parsed = contactFileParser.parse(accepted);
        return contactRowValidator.validateAll(parsed.getRows(), profile);
    }

    private static FileInfo fileInfo(ValidatedUpload accepted) {
        return FileInfo.builder()
                .size(accepted.getSize())
                .type(accepted.getContentType())
                .uniqueFilename(accepted.getUniqueFilename())
                .receivedAt(accepted.getReceivedAt())
                .build();
    }
}
