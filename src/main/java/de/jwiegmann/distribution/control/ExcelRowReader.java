package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ParsedFile;
import de.jwiegmann.distribution.control.dto.ParsedRow;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Liest XLS- und XLSX-Dateien mit Apache POI. Es wird nur das erste Arbeitsblatt
 * gelesen, dessen erste Zeile die Kopfzeile ist.
 */
@Component
public class ExcelRowReader {

    public ParsedFile read(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new UploadValidationException(UploadErrorFactory.noWorksheets());
            }

            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getPhysicalNumberOfRows() > 0 ? sheet.getRow(sheet.getFirstRowNum()) : null;
            if (headerRow == null) {
                throw new UploadValidationException(UploadErrorFactory.emptyWorksheet());
            }

            // Spaltenindex -> Kopfzeilentext, leere Kopfzellen werden ignoriert
            Map<Integer, String> header = new LinkedHashMap<>();
            for (Cell cell : headerRow) {
                String text = cellText(cell, formatter, evaluator);
                if (!text.isBlank()) {
                    header.put(cell.getColumnIndex(), text);
                }
            }

            List<ParsedRow> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (Map.Entry<Integer, String> column : header.entrySet()) {
                    Cell cell = row.getCell(column.getKey(), Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                    String value = cell == null ? "" : cellText(cell, formatter, evaluator);
                    blank &= value.isBlank();
                    values.put(column.getValue(), value);
                }
                if (!blank) {
                    rows.add(new ParsedRow(values));
                }
            }

            if (rows.isEmpty()) {
                throw new UploadValidationException(UploadErrorFactory.emptyWorksheet());
            }

            return ParsedFile.builder()
                    .headers(List.copyOf(header.values()))
                    .rows(rows)
                    .build();

        } catch (UploadValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new UploadValidationException(UploadErrorFactory.excelParseError(e.getMessage()));
        }
    }

    /**
     * Formeln liefern ihr Ergebnis, Zahlen (außer Datumswerten) ihren exakten Wert ohne
     * Zahlenformat: 491701234567 bleibt 491701234567, nicht 4.91701E+11.
     */
    static String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = evaluator.evaluateFormulaCell(cell);
        }
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return NumberToTextConverter.toText(cell.getNumericCellValue());
        }
        return formatter.formatCellValue(cell, evaluator);
    }
}
