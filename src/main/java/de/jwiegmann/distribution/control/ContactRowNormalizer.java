package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.control.dto.ContactItem;
import de.jwiegmann.distribution.control.dto.ParsedRow;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Bildet beliebig geschriebene Spaltennamen auf {@link ContactColumn} ab und trimmt die Werte.
 * Fehlende Spalten werden zu leeren Strings.
 */
@Component
public class ContactRowNormalizer {

    public ContactItem normalize(ParsedRow row) {
        Map<ContactColumn, String> values = new EnumMap<>(ContactColumn.class);

        for (Map.Entry<String, String> entry : row.getValues().entrySet()) {
            ContactColumn.forHeader(entry.getKey()).ifPresent(column -> {
                // erste passende Spalte gewinnt
                if (!values.containsKey(column) && entry.getValue() != null) {
                    values.put(column, entry.getValue().trim());
                }
            });
        }

        return ContactItem.builder()
                .firstName(values.getOrDefault(ContactColumn.FIRST_NAME, ""))
                .phone(values.getOrDefault(ContactColumn.PHONE, ""))
                .notes(values.getOrDefault(ContactColumn.NOTES, ""))
                .build();
    }
}
