package org.example.reporting.report.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row per leaf test (or hook), self-contained: root build metadata is copied onto every row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestRow {

    private String sourceBuildId;
    private String sourceBuildName;
    private Object sourceBuildNumber;
    private String rootScope;
    private String scopePath;
    private String testType;
    private String testName;
    private String testStatus;
    private Long testDurationMs;
    private String testTags;
    private int retriesCount;
    private Integer runCount;
    private Boolean isFlaky;
    private Boolean isAlwaysFailing;
    private Boolean isNewFailure;
    private Boolean isPerformanceAnomaly;
    private Boolean isMuted;
    private String observabilityUrl;
    private String firstFailureLog;
    private String rootFilePath;
    private String rootOsName;
    private String rootOsVersion;
    private String rootBrowserName;
    private String rootBrowserVersion;
    private String rootDevice;
    private String finishedAt;
    private String buildStartedAt;
    private String buildFinishedAt;
}
