package org.example.reporting.integration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * App Automate session, as listed per build and as returned by the session detail endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AutomationSession {

    private String hashedId;
    private String name;
    private Long duration;
    private String createdAt;
    private String startedAt;
    private String finishedAt;
    private String os;
    private String osVersion;
    private String device;
    private String status;
    private String reason;
    private String buildName;
    private String projectName;
    private String logs;
    private String appiumLogsUrl;
    private String videoUrl;
    private String publicUrl;
    private AppDetails appDetails;

    /** Wrapper object {@code {"automation_session": {...}}} used by the App Automate API. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Envelope {
        private AutomationSession automationSession;
    }
}
