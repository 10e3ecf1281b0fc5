package de.jwiegmann.distribution.boundary;

import de.jwiegmann.distribution.boundary.dto.upload.UploadCommitResponse;
import de.jwiegmann.distribution.boundary.dto.upload.UploadPreviewResponse;
import de.jwiegmann.distribution.control.UploadErrorFactory;
import de.jwiegmann.distribution.control.UploadService;
import de.jwiegmann.distribution.control.dto.RawUpload;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.security.Principal;

@RestController
@RequestMapping("/api/upload")
public class UploadRestController {

    static final String ANONYMOUS = "anonymous";

    private final UploadService service;

    public UploadRestController(UploadService service) {
        this.service = service;
    }

    /**
     * POST /api/upload: Datei prüfen und auf die aktiven Agenten verteilen
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadCommitResponse> upload(
            @RequestPart(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "targetAgentCount", required = false) Integer targetAgentCount,
            Principal principal) throws IOException {

        UploadCommitResponse result = service.commit(toRawUpload(file), targetAgentCount, uploaderOf(principal));

        return ResponseEntity
                .created(URI.create("/api/distributions/" + result.getDistributionId()))
                .body(result);
    }

    /**
     * POST /api/upload/validate: Datei prüfen und Vorschau liefern, ohne zu speichern
     */
    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadPreviewResponse> validate(
            @RequestPart(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "targetAgentCount", required = false) Integer targetAgentCount,
            @RequestParam(value = "includeDistribution", defaultValue = "false") boolean includeDistribution)
            throws IOException {

        return ResponseEntity.ok(service.preview(toRawUpload(file), targetAgentCount, includeDistribution));
    }

    static String uploaderOf(Principal principal) {
        return principal != null && principal.getName() != null ? principal.getName() : ANONYMOUS;
    }

    private static RawUpload toRawUpload(MultipartFile file) throws IOException {
        if (file == null) {
            throw new UploadValidationException(UploadErrorFactory.noFile());
        }
        return RawUpload.builder()
                .content(file.getBytes())
                .contentType(file.getContentType())
                .filename(file.getOriginalFilename())
                .size(file.getSize())
                .build();
    }
}
