package org.example.reporting.report.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Ergebnis eines Report-Laufs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a report run")
public class ReportResult {

    @Schema(description = "Absolute output directory")
    private String outputDirectory;

    @Schema(description = "Files written, in format order")
    private List<String> files;

    @Schema(description = "Rows per section after filtering", example = "{\"overview\":5,\"builds\":2}")
    private Map<String, Integer> rowCounts;

    @Schema(description = "Non-fatal discovery failures")
    private List<String> warnings;

    private String generatedAt;
}
