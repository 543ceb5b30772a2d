package org.example.reporting.report.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Eine Zeile pro Test-Reporting-Build.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildRow {

    public static final String SOURCE = "test-reporting";

    @Builder.Default
    private String source = SOURCE;
    private String buildId;
    private String buildName;
    private String originalBuildName;
    private Object buildNumber;
    private String buildStatus;
    private Long durationMs;
    private String user;
    private String tags;
    private String startedAt;
    private String finishedAt;
    private int passed;
    private int failed;
    private int skipped;
    private int pending;
    private int unknown;
    private int flakyCount;
    private int alwaysFailingCount;
    private int performanceAnomalyCount;
    private int newFailureCount;
    private String observabilityUrl;
    private String tcmTestRunIdentifier;
}
