package de.jwiegmann.distribution.boundary.dto.upload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileInfo {
    private long size;
    private String type;
    private String uniqueFilename;
    private LocalDateTime receivedAt;
}
