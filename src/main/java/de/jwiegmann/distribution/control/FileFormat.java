package de.jwiegmann.distribution.control;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Unterstützte Dateiformate mit Endung, MIME-Typen und Magic Numbers.
 */
public enum FileFormat {

    CSV(".csv",
            Set.of("text/csv", "application/csv", "text/plain"),
            List.of()),

    XLS(".xls",
            Set.of("application/vnd.ms-excel"),
            List.of(new byte[]{(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1})),

    XLSX(".xlsx",
            Set.of("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            List.of(
                    new byte[]{0x50, 0x4B, 0x03, 0x04},   // ZIP
                    new byte[]{0x50, 0x4B, 0x05, 0x06},   // leeres ZIP
                    new byte[]{0x50, 0x4B, 0x07, 0x08})); // gesplittetes ZIP

    private final String extension;
    private final Set<String> mimeTypes;
    private final List<byte[]> signatures;

    FileFormat(String extension, Set<String> mimeTypes, List<byte[]> signatures) {
        this.extension = extension;
        this.mimeTypes = mimeTypes;
        this.signatures = signatures;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Binäre Container haben Magic Numbers, CSV nicht.
     */
    public boolean isBinary() {
        return !signatures.isEmpty();
    }

    public boolean matchesSignature(byte[] content) {
        return signatures.stream().anyMatch(signature -> startsWith(content, signature));
    }

    public static Optional<FileFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        // .xlsx vor .xls prüfen
        return Arrays.stream(new FileFormat[]{XLSX, XLS, CSV})
                .filter(f -> lower.endsWith(f.extension))
                .findFirst();
    }

    public static Optional<FileFormat> fromContentType(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        String mime = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.mimeTypes.contains(mime))
                .findFirst();
    }

    private static boolean startsWith(byte[] content, byte[] signature) {
        if (content == null || content.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (content[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
