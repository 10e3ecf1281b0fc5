package de.jwiegmann.distribution.control.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RowValidationResult {

    private ContactItem contact;
    private List<String> errors;

    public static RowValidationResult valid(ContactItem contact) {
        return new RowValidationResult(contact, List.of());
    }

    public static RowValidationResult invalid(List<String> errors) {
        return new RowValidationResult(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
