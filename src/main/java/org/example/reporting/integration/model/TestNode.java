package org.example.reporting.integration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Knoten im Test-Run-Baum (Projekt, Build, Suite, Test oder Hook).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestNode {

    public static final String TYPE_TEST = "TEST";
    public static final String TYPE_HOOK = "HOOK";

    private String displayName;
    private String type;
    private NodeDetails details;
    private List<TestNode> children;
}
