package org.example.reporting.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Spalten-Definition fuer die Projektion einer Report-Sektion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnSpec {

    /** Dotted path into the row, e.g. {@code details.status}. */
    @NotBlank(message = "Spalten-Key darf nicht leer sein")
    private String key;

    private String header;

    @JsonProperty("default")
    private Object defaultValue;

    public String effectiveHeader() {
        return header != null && !header.isBlank() ? header : key;
    }
}
