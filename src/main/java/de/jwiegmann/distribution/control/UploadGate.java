package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.RawUpload;
import de.jwiegmann.distribution.control.dto.ValidatedUpload;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Erste Stufe der Pipeline: prüft Größe, deklarierten Typ, tatsächlichen Inhalt
 * und Dateinamen eines Uploads, bevor irgendetwas anderes die Bytes anfasst.
 * Die Prüfungen laufen in fester Reihenfolge, der erste Fehler bricht ab.
 */
@Slf4j
@Component
public class UploadGate {

    static final int TEXT_SAMPLE_SIZE = 1024;

    private final FilenameSanitizer filenameSanitizer;
    private final long maxFileSize;

    public UploadGate(FilenameSanitizer filenameSanitizer,
                      @Value("${upload.max-file-size:5242880}") long maxFileSize) {
        this.filenameSanitizer = filenameSanitizer;
        this.maxFileSize = maxFileSize;
    }

    /**
     * @param upload Upload wie vom Client geliefert
     * @return vollständig geprüfter Upload mit bereinigtem und eindeutigem Dateinamen
     * @throws UploadValidationException EMPTY_FILE, FILE_TOO_LARGE, INVALID_FILE_TYPE,
     *                                   INVALID_FILE_SIGNATURE oder INVALID_FILENAME
     */
    public ValidatedUpload accept(RawUpload upload) {

        // 1. Größe
        byte[] content = upload.getContent() != null ? upload.getContent() : new byte[0];
        long size = Math.max(upload.getSize(), content.length);
        if (size == 0) {
            throw new UploadValidationException(UploadErrorFactory.emptyFile());
        }
        if (size > maxFileSize) {
            log.warn("Upload rejected, {} bytes exceed limit of {}", size, maxFileSize);
            throw new UploadValidationException(UploadErrorFactory.fileTooLarge(maxFileSize));
        }

        // 2. Deklarierter Typ (Endung vor MIME-Typ)
        FileFormat format = FileFormat.fromFilename(upload.getFilename())
                .or(() -> FileFormat.fromContentType(upload.getContentType()))
                .orElseThrow(() -> new UploadValidationException(
                        UploadErrorFactory.invalidFileType(upload.getContentType(), upload.getFilename())));

        // 3. Inhalt passt zum Typ
        if (!hasValidSignature(content, format)) {
            log.warn("Upload rejected, content does not match declared format {}", format);
            throw new UploadValidationException(UploadErrorFactory.invalidFileSignature(format.name()));
        }

        // 4. Dateiname
        String filename = filenameSanitizer.sanitize(upload.getFilename());

        // 5. Eindeutiger Ablagename
        String uniqueFilename = filenameSanitizer.uniqueName(filename);

        log.debug("Upload accepted: {} ({}, {} bytes) as {}", filename, format, size, uniqueFilename);

        return ValidatedUpload.builder()
                .content(content)
                .format(format)
                .contentType(upload.getContentType())
                .filename(filename)
                .uniqueFilename(uniqueFilename)
                .size(size)
                .receivedAt(LocalDateTime.now())
                .build();
    }

    static boolean hasValidSignature(byte[] content, FileFormat format) {
        if (format.isBinary()) {
            return format.matchesSignature(content);
        }
        return isPlainText(content);
    }

    /**
     * Nur druckbares ASCII sowie TAB, LF und CR in den ersten {@value #TEXT_SAMPLE_SIZE} Bytes.
     */
    static boolean isPlainText(byte[] content) {
        int limit = Math.min(TEXT_SAMPLE_SIZE, content.length);
        for (int i = 0; i < limit; i++) {
            int b = content[i] & 0xFF;
            boolean printable = b >= 32 && b <= 126;
            if (!printable && b != 9 && b != 10 && b != 13) {
                return false;
            }
        }
        return true;
    }
}
