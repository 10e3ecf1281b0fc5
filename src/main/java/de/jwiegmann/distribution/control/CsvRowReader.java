package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ParsedFile;
import de.jwiegmann.distribution.control.dto.ParsedRow;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;
import org.supercsv.prefs.CsvPreference;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liest CSV-Dateien mit Super CSV. Die erste Zeile ist die Kopfzeile,
 * jede weitere nicht-leere Zeile wird zu einer {@link ParsedRow}.
 */
@Component
public class CsvRowReader {

    public ParsedFile read(byte[] content) {
        try (ICsvListReader reader = new CsvListReader(
                new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8),
                CsvPreference.STANDARD_PREFERENCE)) {

            String[] header = reader.getHeader(true);
            if (header == null) {
                return ParsedFile.builder().headers(List.of()).rows(List.of()).build();
            }

            List<ParsedRow> rows = new ArrayList<>();
            List<String> cells;
            while ((cells = reader.read()) != null) {
                rows.add(toRow(header, cells));
            }

            List<String> headers = Arrays.stream(header)
                    .map(h -> h == null ? "" : h)
                    .toList();
            return ParsedFile.builder().headers(headers).rows(rows).build();

        } catch (SuperCsvException | IOException e) {
            throw new UploadValidationException(UploadErrorFactory.csvParseError(e.getMessage()));
        }
    }

    /**
     * Kurze Zeilen liefern fehlende Schlüssel, überzählige Zellen werden ignoriert.
     */
    private static ParsedRow toRow(String[] header, List<String> cells) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < header.length && i < cells.size(); i++) {
            if (header[i] == null) {
                continue;
            }
            String cell = cells.get(i);
            values.put(header[i], cell == null ? "" : cell);
        }
        return new ParsedRow(values);
    }
}
