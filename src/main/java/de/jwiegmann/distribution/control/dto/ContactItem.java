package de.jwiegmann.distribution.control.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalisierter Kontakt mit den kanonischen Spalten FirstName, Phone und Notes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"FirstName", "Phone", "Notes"})
public class ContactItem {

    @JsonProperty("FirstName")
    private String firstName;

    @JsonProperty("Phone")
    private String phone;

    @JsonProperty("Notes")
    private String notes;
}
