package org.example.reporting.integration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Test Reporting: GET /ext/v1/builds/{buildId}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildDetails {

    private String name;
    private String originalName;
    private Object buildNumber;
    private String buildUuid;
    private String status;
    private Long duration;
    private String user;
    private List<String> tags;
    private String startedAt;
    private String finishedAt;
    private Map<String, Integer> statusStats;
    private Map<String, Integer> failureCategories;
    private Map<String, Integer> smartTags;
    private String observabilityUrl;

    @JsonProperty("tcmTestRunIdentifier")
    private String tcmTestRunIdentifier;
}
