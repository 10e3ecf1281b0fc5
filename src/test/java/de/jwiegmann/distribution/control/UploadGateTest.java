package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.RawUpload;
import de.jwiegmann.distribution.control.dto.ValidatedUpload;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.fixture.ContactFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadGateTest {

    private static final long MAX_SIZE = 5L * 1024 * 1024;

    private final UploadGate gate = new UploadGate(new FilenameSanitizer(), MAX_SIZE);

    @Test
    void accepts_plain_csv() {
        byte[] content = ContactFixtures.validCsv(3);

        ValidatedUpload accepted = gate.accept(upload(content, "text/csv", "contacts.csv"));

        assertThat(accepted.getFormat()).isEqualTo(FileFormat.CSV);
        assertThat(accepted.getFilename()).isEqualTo("contacts.csv");
        assertThat(accepted.getUniqueFilename()).endsWith(".csv").isNotEqualTo("contacts.csv");
        assertThat(accepted.getContent()).isEqualTo(content);
        assertThat(accepted.getSize()).isEqualTo(content.length);
    }

    @Test
    void rejects_empty_file() {
        assertRejected(upload(new byte[0], "text/csv", "contacts.csv"), "EMPTY_FILE");
    }

    @Test
    void rejects_file_over_size_limit_before_anything_else() {
        byte[] content = new byte[6 * 1024 * 1024];
        Arrays.fill(content, (byte) 'a');

        // falscher Typ wird gar nicht mehr geprüft
        assertRejected(upload(content, "application/pdf", "contacts.pdf"), "FILE_TOO_LARGE");
    }

    @Test
    void rejects_unsupported_type() {
        assertRejected(upload(ContactFixtures.csv("%PDF-1.4"), "application/pdf", "contacts.pdf"), "INVALID_FILE_TYPE");
    }

    @Test
    void resolves_format_from_mime_type_when_extension_is_unknown() {
        ValidatedUpload accepted = gate.accept(upload(ContactFixtures.validCsv(1), "text/csv", "contacts"));

        assertThat(accepted.getFormat()).isEqualTo(FileFormat.CSV);
    }

    @Test
    void extension_wins_over_mime_type() {
        // Browser unter Windows melden CSV häufig als application/vnd.ms-excel
        ValidatedUpload accepted = gate.accept(
                upload(ContactFixtures.validCsv(1), "application/vnd.ms-excel", "contacts.csv"));

        assertThat(accepted.getFormat()).isEqualTo(FileFormat.CSV);
    }

    @Test
    void rejects_text_disguised_as_xlsx() {
        assertRejected(upload(ContactFixtures.validCsv(2),
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "contacts.xlsx"),
                "INVALID_FILE_SIGNATURE");
    }

    @Test
    void rejects_zip_disguised_as_xls() {
        byte[] xlsx = ContactFixtures.xlsx(new String[]{"FirstName", "Phone", "Notes"});

        assertRejected(upload(xlsx, "application/vnd.ms-excel", "contacts.xls"), "INVALID_FILE_SIGNATURE");
    }

    @Test
    void rejects_binary_bytes_in_csv() {
        byte[] content = {'F', 'i', 'r', 's', 't', 0x00, 0x01, '\n'};

        assertRejected(upload(content, "text/csv", "contacts.csv"), "INVALID_FILE_SIGNATURE");
    }

    @Test
    void only_first_kilobyte_of_csv_is_sniffed() {
        byte[] content = new byte[2048];
        Arrays.fill(content, (byte) 'a');
        content[1500] = (byte) 0xC3;

        assertThat(gate.accept(upload(content, "text/csv", "contacts.csv")).getFormat()).isEqualTo(FileFormat.CSV);
    }

    @Test
    void accepts_real_spreadsheets() {
        byte[] xlsx = ContactFixtures.xlsx(new String[]{"FirstName", "Phone", "Notes"});
        byte[] xls = ContactFixtures.xls(new String[]{"FirstName", "Phone", "Notes"});

        assertThat(gate.accept(upload(xlsx, null, "contacts.xlsx")).getFormat()).isEqualTo(FileFormat.XLSX);
        assertThat(gate.accept(upload(xls, null, "contacts.xls")).getFormat()).isEqualTo(FileFormat.XLS);
    }

    @Test
    void rejects_path_traversal_after_content_checks() {
        assertRejected(upload(ContactFixtures.validCsv(1), "text/csv", "../../etc/contacts.csv"), "INVALID_FILENAME");
    }

    private void assertRejected(RawUpload upload, String expectedCode) {
        assertThatThrownBy(() -> gate.accept(upload))
                .isInstanceOfSatisfying(UploadValidationException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(expectedCode));
    }

    private static RawUpload upload(byte[] content, String contentType, String filename) {
        return RawUpload.builder()
                .content(content)
                .contentType(contentType)
                .filename(filename)
                .size(content.length)
                .build();
    }
}
