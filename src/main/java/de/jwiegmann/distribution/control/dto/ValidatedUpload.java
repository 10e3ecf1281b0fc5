package de.jwiegmann.distribution.control.dto;

import de.jwiegmann.distribution.control.FileFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Upload, der alle Prüfungen des UploadGate bestanden hat.
 */
@Value
@Builder
public class ValidatedUpload {
    byte[] content;
    FileFormat format;
    String contentType;
    String filename;          // bereinigt
    String uniqueFilename;    // Zeitstempel + Zufallsanteil, für Ablage und Logs
    long size;
    LocalDateTime receivedAt;
}
