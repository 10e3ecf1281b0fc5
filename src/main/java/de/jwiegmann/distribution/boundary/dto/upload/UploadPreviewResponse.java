package de.jwiegmann.distribution.boundary.dto.upload;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.distribution.boundary.dto.distribution.DistributionSummaryResponse;
import de.jwiegmann.distribution.control.dto.ContactItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response für POST /api/upload/validate. Es wird nichts gespeichert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadPreviewResponse {
    private String filename;
    private int totalRows;
    private List<ContactItem> preview;                  // erste Zeilen, normalisiert
    private List<String> columns;                       // kanonische Spalten
    private FileInfo fileInfo;
    private DistributionSummaryResponse distribution;   // nur wenn angefordert
}
