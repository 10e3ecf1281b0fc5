package de.jwiegmann.distribution.boundary;

import de.jwiegmann.distribution.boundary.dto.distribution.AgentTasksResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionDetailResponse;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionListResponse;
import de.jwiegmann.distribution.control.DistributionQueryService;
import de.jwiegmann.distribution.control.UploadErrorFactory;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.entity.Task;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.Locale;

@RestController
@RequestMapping("/api")
public class DistributionRestController {

    private final DistributionQueryService service;

    public DistributionRestController(DistributionQueryService service) {
        this.service = service;
    }

    /**
     * GET /api/distributions: Distributions des aktuellen Benutzers, neueste zuerst
     */
    @GetMapping("/distributions")
    public ResponseEntity<DistributionListResponse> getDistributions(Principal principal) {
        return ResponseEntity.ok(service.getDistributions(UploadRestController.uploaderOf(principal)));
    }

    /**
     * GET /api/distributions/{id}: Distribution mit Tasks je Agent
     */
    @GetMapping("/distributions/{id}")
    public ResponseEntity<DistributionDetailResponse> getDistribution(@PathVariable String id, Principal principal) {
        return ResponseEntity.ok(service.getDistribution(id, UploadRestController.uploaderOf(principal)));
    }

    /**
     * GET /api/agents/{id}/tasks: Tasks eines Agenten, optional nach Status gefiltert
     */
    @GetMapping("/agents/{id}/tasks")
    public ResponseEntity<AgentTasksResponse> getAgentTasks(@PathVariable String id,
                                                            @RequestParam(value = "status", required = false) String status) {
        return ResponseEntity.ok(service.getAgentTasks(id, parseStatus(status)));
    }

    private static Task.Status parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return Task.Status.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UploadValidationException(UploadErrorFactory.invalidParameter("status", status));
        }
    }
}
