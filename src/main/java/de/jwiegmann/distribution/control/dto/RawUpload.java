package de.jwiegmann.distribution.control.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unvalidierter Datei-Upload, so wie er vom Client kommt.
 * Lebt nur für die Dauer eines Requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawUpload {
    private byte[] content;
    private String contentType;   // vom Client deklariert
    private String filename;      // vom Client deklariert, nicht vertrauenswürdig
    private long size;
}
