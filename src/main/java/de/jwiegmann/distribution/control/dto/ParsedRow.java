package de.jwiegmann.distribution.control.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Eine Datenzeile der Quelldatei: Spaltenname (wie in der Datei) auf Zellwert.
 */
public class ParsedRow {

    private final Map<String, String> values;

    public ParsedRow(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, String> getValues() {
        return values;
    }

    public String get(String column) {
        return values.get(column);
    }

    @Override
    public String toString() {
        return "ParsedRow" + values;
    }
}
