package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.exception.UploadValidationException;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bereinigt vom Client gelieferte Dateinamen und erzeugt eindeutige Ablagenamen.
 */
@Component
public class FilenameSanitizer {

    static final int MAX_FILENAME_LENGTH = 255;

    private static final Pattern RESERVED_NAMES = Pattern.compile("^(CON|PRN|AUX|NUL|COM[1-9]|LPT[1-9])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INVALID_CHARS = Pattern.compile("[<>:\"|?*\\x00-\\x1F\\x7F]");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public FilenameSanitizer() {
        this(Clock.systemUTC());
    }

    FilenameSanitizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Entfernt Pfadanteile, lehnt verdächtige Namen ab und ersetzt übrige Sonderzeichen durch '_'.
     *
     * @param filename Dateiname wie vom Client deklariert
     * @return bereinigter Dateiname
     * @throws UploadValidationException INVALID_FILENAME
     */
    public String sanitize(String filename) {
        if (filename != null && filename.contains("..")) {
            throw reject("Contains suspicious characters.");
        }

        String name = baseName(filename);
        if (name.isBlank()) {
            throw reject("Filename is missing.");
        }
        if (INVALID_CHARS.matcher(name).find()) {
            throw reject("Contains suspicious characters.");
        }
        if (name.length() > MAX_FILENAME_LENGTH) {
            throw reject("Filename too long. Maximum " + MAX_FILENAME_LENGTH + " characters allowed.");
        }
        if (isReserved(name)) {
            throw reject("Reserved device name.");
        }

        return UNSAFE_CHARS.matcher(name).replaceAll("_");
    }

    /**
     * Eindeutiger Name für Ablage und Logs: {@code <epochMillis>_<16 hex><.ext>}.
     */
    public String uniqueName(String sanitizedFilename) {
        byte[] suffix = new byte[8];
        random.nextBytes(suffix);
        return clock.millis() + "_" + HexFormat.of().formatHex(suffix) + extensionOf(sanitizedFilename);
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private static boolean isReserved(String name) {
        int dot = name.indexOf('.');
        String stem = dot >= 0 ? name.substring(0, dot) : name;
        return RESERVED_NAMES.matcher(name).matches() || RESERVED_NAMES.matcher(stem).matches();
    }

    private static UploadValidationException reject(String reason) {
        return new UploadValidationException(UploadErrorFactory.invalidFilename(reason));
    }
}
