package org.example.reporting.report.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Eine Zeile pro App-Automate-Session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionRow {

    public static final String SOURCE = "app-automate";

    @Builder.Default
    private String source = SOURCE;
    private String buildId;
    private String sessionId;
    private String sessionName;
    private String sessionCreatedAt;
    private String sessionStartedAt;
    private String sessionFinishedAt;
    private String sessionStatus;
    private Long sessionDurationSec;
    private String os;
    private String osVersion;
    private String device;
    private String reason;
    private String buildName;
    private String projectName;
    private String logsUrl;
    private String appiumLogsUrl;
    private String videoUrl;
    private String publicUrl;

    // filled by session detail enrichment
    private String appUrl;
    private String appName;
    private String appVersion;
    private String appCustomId;
    private String appUploadedAt;
}
