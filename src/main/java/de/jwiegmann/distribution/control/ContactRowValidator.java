package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.ParsedRow;
import de.jwiegmann.distribution.control.dto.RowValidationResult;
import de.jwiegmann.distribution.control.dto.ValidationProfile;
import de.jwiegmann.distribution.control.exception.UploadValidationException;
import de.jwiegmann.distribution.entity.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalisiert und validiert alle Zeilen einer Datei.
 * Fehler werden über die ganze Datei gesammelt; ist eine Zeile ungültig,
 * wird die komplette Datei abgelehnt.
 */
@Slf4j
@Component
public class ContactRowValidator {

    static final int MIN_PHONE_DIGITS = 7;

    private final ContactRowNormalizer normalizer;
    private final int previewNotesMaxLength;
    private final int commitNotesMaxLength;

    public ContactRowValidator(ContactRowNormalizer normalizer,
                               @Value("${upload.notes.max-length.preview:500}") int previewNotesMaxLength,
                               @Value("${upload.notes.max-length.commit:1000}") int commitNotesMaxLength) {
        this.normalizer = normalizer;
        this.previewNotesMaxLength = previewNotesMaxLength;
        this.commitNotesMaxLength = commitNotesMaxLength;
    }

    /**
     * @param rows    Datenzeilen in Dateireihenfolge
     * @param profile Aufrufpfad, bestimmt die maximale Länge von Notes
     * @return alle Kontakte in Dateireihenfolge
     * @throws UploadValidationException INVALID_DATA mit allen Zeilenfehlern
     */
    public List<ContactItem> validateAll(List<ParsedRow> rows, ValidationProfile profile) {
        List<ContactItem> contacts = new ArrayList<>(rows.size());
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            RowValidationResult result = validate(rows.get(i), i, profile);
            if (result.isValid()) {
                contacts.add(result.getContact());
            } else {
                errors.addAll(result.getErrors());
            }
        }

        if (!errors.isEmpty()) {
            log.warn("File rejected: {} of {} rows invalid", rows.size() - contacts.size(), rows.size());
            throw new UploadValidationException(
                    UploadErrorFactory.invalidData(errors, rows.size(), contacts.size()));
        }
        return contacts;
    }

    /**
     * Prüft eine einzelne Zeile.
     *
     * @param row      Zeile aus dem Parser
     * @param rowIndex 0-basierte Position, Meldungen verwenden die 1-basierte Zeilennummer
     * @param profile  Aufrufpfad
     */
    public RowValidationResult validate(ParsedRow row, int rowIndex, ValidationProfile profile) {
        ContactItem contact = normalizer.normalize(row);
        String prefix = "Row " + (rowIndex + 1) + ": ";
        List<String> errors = new ArrayList<>();

        String firstName = contact.getFirstName();
        if (firstName.isEmpty()) {
            errors.add(prefix + "FirstName is required");
        } else if (firstName.length() > Task.MAX_FIRST_NAME_LENGTH) {
            errors.add(prefix + "FirstName is too long (max " + Task.MAX_FIRST_NAME_LENGTH + " characters)");
        }

        String phone = contact.getPhone();
        if (phone.isEmpty()) {
            errors.add(prefix + "Phone is required");
        } else if (phone.replaceAll("\\D", "").length() < MIN_PHONE_DIGITS) {
            errors.add(prefix + "Phone number appears to be invalid");
        } else if (phone.length() > Task.MAX_PHONE_LENGTH) {
            errors.add(prefix + "Phone number is too long (max " + Task.MAX_PHONE_LENGTH + " characters)");
        }

        int notesMaxLength = notesMaxLength(profile);
        if (contact.getNotes().length() > notesMaxLength) {
            errors.add(prefix + "Notes field is too long (max " + notesMaxLength + " characters)");
        }

        return errors.isEmpty() ? RowValidationResult.valid(contact) : RowValidationResult.invalid(errors);
    }

    int notesMaxLength(ValidationProfile profile) {
        return profile == ValidationProfile.PREVIEW ? previewNotesMaxLength : commitNotesMaxLength;
    }
}
