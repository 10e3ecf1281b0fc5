package de.jwiegmann.distribution.control.dto;

/**
 * Aufrufpfad der Zeilenvalidierung. Bestimmt u.a. die maximale Länge von Notes.
 */
public enum ValidationProfile {
    /** Vorschau ohne Persistenz (POST /api/upload/validate). */
    PREVIEW,
    /** Upload mit Verteilung und Task-Anlage (POST /api/upload). */
    COMMIT
}
