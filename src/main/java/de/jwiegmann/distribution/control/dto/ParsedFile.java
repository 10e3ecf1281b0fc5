package de.jwiegmann.distribution.control.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ergebnis des Parsers: Kopfzeile und Datenzeilen in Dateireihenfolge.
 */
@Value
@Builder
public class ParsedFile {
    List<String> headers;
    List<ParsedRow> rows;
}
