package org.example.reporting.integration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeDetails {

    private String status;
    private Long duration;
    private List<String> tags;
    private List<Retry> retries;
    private Integer runCount;
    private Boolean isFlaky;
    private Boolean isAlwaysFailing;
    private Boolean isNewFailure;
    private Boolean isPerformanceAnomaly;
    private Boolean isMuted;
    private String observabilityUrl;

    // populated on root nodes only
    private String filePath;
    private Platform os;
    private Platform browser;
    private String device;
    private String finishedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Platform {
        private String name;
        private String version;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retry {
        /** Log entries keyed by category, e.g. {@code TEST_FAILURE}. */
        private Map<String, List<JsonNode>> logs;
    }
}
