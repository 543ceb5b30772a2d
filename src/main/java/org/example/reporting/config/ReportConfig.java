package org.example.reporting.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Report-Konfiguration. Als Eingabe duerfen beliebige Felder fehlen; nach
 * {@link ReportConfigResolver#resolve(ReportConfig)} ist jedes Feld belegt
 * (einzige Ausnahme: {@code filters.days}, {@code null} bedeutet "kein Zeitfenster").
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "BrowserStack report configuration (all fields optional)")
public class ReportConfig {

    private Credentials credentials;
    private Inputs inputs;
    private TestReporting testReporting;
    private AppAutomate appAutomate;
    private Outputs outputs;
    private Filters filters;
    @Valid
    private Columns columns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Credentials {
        @Schema(description = "Name der Umgebungsvariable mit dem Benutzernamen", example = "BROWSERSTACK_USERNAME")
        private String usernameEnv;
        @Schema(description = "Name der Umgebungsvariable mit dem Access Key", example = "BROWSERSTACK_ACCESS_KEY")
        private String accessKeyEnv;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Inputs {
        private List<String> testReportingBuildIds;
        private List<String> appAutomateBuildIds;
        private List<String> appCustomIds;
        private Discovery discoverRecentBuilds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Discovery {
        private Boolean enabled;
        private Integer maxBuildsPerSource;
        private List<Long> testReportingProjectIds;
        @Schema(description = "Lookback window for build discovery in days", defaultValue = "7")
        private Double days;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TestReporting {
        private Boolean enabled;
        private Boolean fetchAllPages;
        private Boolean includeHooks;
        private Map<String, String> testRunQuery;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AppAutomate {
        private Boolean enabled;
        private Integer sessionLimit;
        private Boolean includeSessionDetails;
        private String sessionStatusFilter;
        private Integer appListLimit;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Outputs {
        private String directory;
        private String baseName;
        private List<OutputFormat> formats;
        @Schema(description = "Maximale Zeilen pro Markdown-Tabelle (0 = unbegrenzt)", defaultValue = "0")
        private Integer markdownMaxRows;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Filters {
        private Double days;
        private List<String> projects;
        private List<String> teams;
        private List<String> people;
        private Boolean caseSensitive;
        private Boolean applyDaysToApps;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Columns {
        private List<@Valid ColumnSpec> overview;
        private List<@Valid ColumnSpec> builds;
        private List<@Valid ColumnSpec> tests;
        private List<@Valid ColumnSpec> sessions;
        private List<@Valid ColumnSpec> apps;

        /** Column specs of a section id; empty (pass-through) when none are configured. */
        public List<ColumnSpec> forSection(String section) {
            List<ColumnSpec> specs = switch (section) {
                case "overview" -> overview;
                case "builds" -> builds;
                case "tests" -> tests;
                case "sessions" -> sessions;
                case "apps" -> apps;
                default -> null;
            };
            return specs != null ? specs : List.of();
        }
    }
}
