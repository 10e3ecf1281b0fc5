package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ParsedFile;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.fixture.ContactFixtures;
import org.apache.poi.ss.usermodel.Row;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactFileParserTest {

    private final ContactFileParser parser = new ContactFileParser(new CsvRowReader(), new ExcelRowReader());

    @Nested
    class Csv {

        @Test
        void keeps_header_text_as_written() {
            ParsedFile parsed = parser.parse(ContactFixtures.csv("""
                    firstname, PHONE ,Notes
                    Alice,555-123-4567,call after 5
                    """), FileFormat.CSV);

            assertThat(parsed.getHeaders()).containsExactly("firstname", " PHONE ", "Notes");
            assertThat(parsed.getRows()).hasSize(1);
            assertThat(parsed.getRows().get(0).get("firstname")).isEqualTo("Alice");
            assertThat(parsed.getRows().get(0).get(" PHONE ")).isEqualTo("555-123-4567");
        }

        @Test
        void handles_quoted_values_and_blank_lines() {
            ParsedFile parsed = parser.parse(ContactFixtures.csv("""
                    FirstName,Phone,Notes
                    "Smith, John",5551234567,"line one, line two"

                    Bob,5559876543,
                    """), FileFormat.CSV);

            assertThat(parsed.getRows()).hasSize(2);
            assertThat(parsed.getRows().get(0).get("FirstName")).isEqualTo("Smith, John");
            assertThat(parsed.getRows().get(0).get("Notes")).isEqualTo("line one, line two");
            assertThat(parsed.getRows().get(1).get("Notes")).isEmpty();
        }

        @Test
        void short_rows_miss_trailing_columns() {
            ParsedFile parsed = parser.parse(ContactFixtures.csv("FirstName,Phone,Notes\nAlice,5551234567\n"), FileFormat.CSV);

            assertThat(parsed.getRows().get(0).getValues()).containsOnlyKeys("FirstName", "Phone");
        }

        @Test
        void header_without_rows_is_an_empty_file() {
            assertRejected(ContactFixtures.csv("FirstName,Phone,Notes\n"), FileFormat.CSV, "EMPTY_FILE");
        }

        @Test
        void empty_file_wins_over_missing_columns() {
            assertRejected(ContactFixtures.csv("Name,PhoneNumber,Comment\n"), FileFormat.CSV, "EMPTY_FILE");
        }

        @Test
        void reports_missing_and_available_columns() {
            byte[] content = ContactFixtures.csv("Name,PhoneNumber,Comment\nAlice,5551234567,hi\n");

            assertThatThrownBy(() -> parser.parse(content, FileFormat.CSV))
                    .isInstanceOfSatisfying(UploadValidationException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo("MISSING_COLUMNS");
                        assertThat(e.getError().getDetails())
                                .asInstanceOf(InstanceOfAssertFactories.MAP)
                                .containsEntry("missingColumns", List.of("FirstName", "Phone", "Notes"))
                                .containsEntry("availableColumns", List.of("Name", "PhoneNumber", "Comment"))
                                .containsEntry("requiredColumns", List.of("FirstName", "Phone", "Notes"));
                    });
        }

        @Test
        void required_columns_match_case_insensitively() {
            for (String header : new String[]{"firstname", "FIRSTNAME", "FirstName"}) {
                byte[] content = ContactFixtures.csv(header + ",phone,NOTES\nAlice,5551234567,\n");

                assertThat(parser.parse(content, FileFormat.CSV).getRows()).hasSize(1);
            }
        }
    }

    @Nested
    class Spreadsheet {

        @Test
        void reads_first_sheet_of_xlsx() {
            byte[] content = ContactFixtures.xlsx(
                    new String[]{"FirstName", "Phone", "Notes"},
                    new String[]{"Alice", "5551234567", "vip"},
                    new String[]{"Bob", "5559876543", ""});

            ParsedFile parsed = parser.parse(content, FileFormat.XLSX);

            assertThat(parsed.getHeaders()).containsExactly("FirstName", "Phone", "Notes");
            assertThat(parsed.getRows()).hasSize(2);
            assertThat(parsed.getRows().get(0).get("Phone")).isEqualTo("5551234567");
            assertThat(parsed.getRows().get(1).get("Notes")).isEmpty();
        }

        @Test
        void reads_legacy_xls() {
            byte[] content = ContactFixtures.xls(
                    new String[]{"firstname", "phone", "notes"},
                    new String[]{"Alice", "5551234567", "vip"});

            ParsedFile parsed = parser.parse(content, FileFormat.XLS);

            assertThat(parsed.getRows()).hasSize(1);
            assertThat(parsed.getRows().get(0).get("firstname")).isEqualTo("Alice");
        }

        @Test
        void numeric_phone_keeps_all_digits() {
            byte[] content = ContactFixtures.xlsxSheet(sheet -> {
                header(sheet.createRow(0));
                Row row = sheet.createRow(1);
                row.createCell(0).setCellValue("Alice");
                row.createCell(1).setCellValue(491701234567d);
                row.createCell(2).setCellValue(42d);
            });

            ParsedFile parsed = parser.parse(content, FileFormat.XLSX);

            assertThat(parsed.getRows().get(0).get("Phone")).isEqualTo("491701234567");
            assertThat(parsed.getRows().get(0).get("Notes")).isEqualTo("42");
        }

        @Test
        void formula_cells_yield_their_result() {
            byte[] content = ContactFixtures.xlsxSheet(sheet -> {
                header(sheet.createRow(0));
                Row row = sheet.createRow(1);
                row.createCell(0).setCellFormula("\"Bo\"&\"b\"");
                row.createCell(1).setCellFormula("491701234560+7");
                row.createCell(2).setCellValue("");
            });

            ParsedFile parsed = parser.parse(content, FileFormat.XLSX);

            assertThat(parsed.getRows().get(0).get("FirstName")).isEqualTo("Bob");
            assertThat(parsed.getRows().get(0).get("Phone")).isEqualTo("491701234567");
        }

        @Test
        void header_only_sheet_is_empty() {
            byte[] content = ContactFixtures.xlsx(new String[]{"FirstName", "Phone", "Notes"});

            assertRejected(content, FileFormat.XLSX, "EMPTY_WORKSHEET");
        }

        @Test
        void workbook_without_sheets_is_rejected() {
            assertRejected(ContactFixtures.xlsxWithoutSheets(), FileFormat.XLSX, "NO_WORKSHEETS");
        }

        @Test
        void broken_container_is_a_parse_error() {
            byte[] content = {0x50, 0x4B, 0x03, 0x04, 'b', 'r', 'o', 'k', 'e', 'n'};

            assertRejected(content, FileFormat.XLSX, "EXCEL_PARSE_ERROR");
        }

        @Test
        void missing_columns_are_checked_for_spreadsheets_too() {
            byte[] content = ContactFixtures.xlsx(
                    new String[]{"FirstName", "Phone"},
                    new String[]{"Alice", "5551234567"});

            assertRejected(content, FileFormat.XLSX, "MISSING_COLUMNS");
        }
    }

    @Test
    void unresolved_format_is_unsupported() {
        assertRejected(ContactFixtures.validCsv(1), null, "UNSUPPORTED_FORMAT");
    }

    private static void header(Row row) {
        row.createCell(0).setCellValue("FirstName");
        row.createCell(1).setCellValue("Phone");
        row.createCell(2).setCellValue("Notes");
    }

    private void assertRejected(byte[] content, FileFormat format, String expectedCode) {
        assertThatThrownBy(() -> parser.parse(content, format))
                .isInstanceOfSatisfying(UploadValidationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(expectedCode));
    }
}
