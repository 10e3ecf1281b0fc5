package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ParsedFile;
import de.jwiegmann.distribution.control.dto.ValidatedUpload;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Zerlegt einen geprüften Upload in Zeilen und stellt sicher, dass die
 * Pflichtspalten vorhanden sind. Reine Transformation ohne Persistenz.
 */
@Component
@RequiredArgsConstructor
public class ContactFileParser {

    private final CsvRowReader csvRowReader;
    private final ExcelRowReader excelRowReader;

    public ParsedFile parse(ValidatedUpload upload) {
        return parse(upload.getContent(), upload.getFormat());
    }

    /**
     * @param content Dateiinhalt
     * @param format  aufgelöstes Format aus dem UploadGate
     * @return Kopfzeile und Datenzeilen in Dateireihenfolge
     * @throws UploadValidationException UNSUPPORTED_FORMAT, CSV_PARSE_ERROR, EXCEL_PARSE_ERROR,
     *                                   NO_WORKSHEETS, EMPTY_WORKSHEET, EMPTY_FILE oder MISSING_COLUMNS
     */
    public ParsedFile parse(byte[] content, FileFormat format) {
        if (format == null) {
            throw new UploadValidationException(UploadErrorFactory.unsupportedFormat());
        }

        ParsedFile parsed = switch (format) {
            case CSV -> csvRowReader.read(content);
            case XLS, XLSX -> excelRowReader.read(content);
        };

        if (parsed.getRows().isEmpty()) {
            throw new UploadValidationException(UploadErrorFactory.emptyFile());
        }

        checkRequiredColumns(parsed.getHeaders());
        return parsed;
    }

    static void checkRequiredColumns(List<String> headers) {
        List<String> missing = Arrays.stream(ContactColumn.values())
                .filter(column -> headers.stream().noneMatch(column::matches))
                .map(ContactColumn::getCanonicalName)
                .toList();

        if (!missing.isEmpty()) {
            throw new UploadValidationException(
                    UploadErrorFactory.missingColumns(missing, headers, ContactColumn.canonicalNames()));
        }
    }
}
