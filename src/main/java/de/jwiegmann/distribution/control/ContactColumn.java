package de.jwiegmann.distribution.control;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kanonische Spalten einer Kontaktliste und die akzeptierten Schreibweisen der Kopfzeile.
 * Vergleich erfolgt nach trim() und Kleinschreibung, d.h. "firstname", "FIRSTNAME" und
 * " FirstName " treffen alle FIRST_NAME.
 */
public enum ContactColumn {

    FIRST_NAME("FirstName", Set.of("firstname")),
    PHONE("Phone", Set.of("phone")),
    NOTES("Notes", Set.of("notes"));

    private final String canonicalName;
    private final Set<String> aliases;

    ContactColumn(String canonicalName, Set<String> aliases) {
        this.canonicalName = canonicalName;
        this.aliases = aliases;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public boolean matches(String header) {
        return header != null && aliases.contains(header.trim().toLowerCase(Locale.ROOT));
    }

    public static Optional<ContactColumn> forHeader(String header) {
        return Arrays.stream(values()).filter(c -> c.matches(header)).findFirst();
    }

    public static List<String> canonicalNames() {
        return Arrays.stream(values()).map(ContactColumn::getCanonicalName).toList();
    }
}
