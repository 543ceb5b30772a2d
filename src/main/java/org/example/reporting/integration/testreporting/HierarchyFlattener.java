package org.example.reporting.integration.testreporting;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.reporting.integration.model.NodeDetails;
import org.example.reporting.integration.model.TestNode;
import org.example.reporting.report.model.TestRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flattens the test-run tree (project, build, suite, test/hook) into one {@link TestRow} per leaf.
 * <p>
 * Depth-first pre-order walk. The scope path of a row is the list of its strict ancestors' display
 * names. Root metadata is read once per root node and copied onto every descendant row.
 * Failure log and flakiness data come from the first retry attempt only.
 */
public class HierarchyFlattener {

    public static final String SCOPE_SEPARATOR = " > ";

    /** Build-level values copied onto every row of that build. */
    public record BuildContext(String buildId, String buildName, Object buildNumber,
                               String buildStartedAt, String buildFinishedAt) {
    }

    record RootMetadata(String displayName, String filePath, String osName, String osVersion,
                        String browserName, String browserVersion, String device, String finishedAt) {

        static RootMetadata of(TestNode root) {
            NodeDetails details = root.getDetails() != null ? root.getDetails() : new NodeDetails();
            NodeDetails.Platform os = details.getOs() != null ? details.getOs() : new NodeDetails.Platform();
            NodeDetails.Platform browser = details.getBrowser() != null ? details.getBrowser() : new NodeDetails.Platform();
            return new RootMetadata(
                    nz(root.getDisplayName()),
                    nz(details.getFilePath()),
                    nz(os.getName()),
                    nz(os.getVersion()),
                    nz(browser.getName()),
                    nz(browser.getVersion()),
                    nz(details.getDevice()),
                    nz(details.getFinishedAt()));
        }
    }

    public List<TestRow> flatten(BuildContext build, List<TestNode> hierarchy, boolean includeHooks) {
        if (hierarchy == null || hierarchy.isEmpty()) {
            return List.of();
        }
        List<TestRow> rows = new ArrayList<>();
        for (TestNode root : hierarchy) {
            if (root == null) {
                continue;
            }
            rows.addAll(walk(root, build, RootMetadata.of(root), List.of(), includeHooks));
        }
        return rows;
    }

    private List<TestRow> walk(TestNode node, BuildContext build, RootMetadata root,
                               List<String> parentPath, boolean includeHooks) {
        String displayName = nz(node.getDisplayName());
        List<String> nextPath = parentPath;
        if (!displayName.isEmpty()) {
            List<String> extended = new ArrayList<>(parentPath);
            extended.add(displayName);
            nextPath = Collections.unmodifiableList(extended);
        }

        List<TestRow> rows = new ArrayList<>();
        if (qualifies(node.getType(), includeHooks) && !displayName.isEmpty()) {
            rows.add(toRow(node, build, root, parentPath));
        }
        if (node.getChildren() != null) {
            for (TestNode child : node.getChildren()) {
                if (child != null) {
                    rows.addAll(walk(child, build, root, nextPath, includeHooks));
                }
            }
        }
        return rows;
    }

    private static boolean qualifies(String type, boolean includeHooks) {
        return TestNode.TYPE_TEST.equals(type) || (includeHooks && TestNode.TYPE_HOOK.equals(type));
    }

    private TestRow toRow(TestNode node, BuildContext build, RootMetadata root, List<String> parentPath) {
        NodeDetails details = node.getDetails() != null ? node.getDetails() : new NodeDetails();
        List<NodeDetails.Retry> retries = details.getRetries() != null ? details.getRetries() : List.of();

        return TestRow.builder()
                .sourceBuildId(build.buildId())
                .sourceBuildName(nz(build.buildName()))
                .sourceBuildNumber(build.buildNumber() != null ? build.buildNumber() : "")
                .rootScope(root.displayName())
                .scopePath(String.join(SCOPE_SEPARATOR, parentPath))
                .testType(node.getType())
                .testName(node.getDisplayName())
                .testStatus(nz(details.getStatus()))
                .testDurationMs(details.getDuration())
                .testTags(joinNonEmpty(details.getTags()))
                .retriesCount(retries.size())
                .runCount(details.getRunCount())
                .isFlaky(details.getIsFlaky())
                .isAlwaysFailing(details.getIsAlwaysFailing())
                .isNewFailure(details.getIsNewFailure())
                .isPerformanceAnomaly(details.getIsPerformanceAnomaly())
                .isMuted(details.getIsMuted())
                .observabilityUrl(nz(details.getObservabilityUrl()))
                .firstFailureLog(firstFailureLog(retries))
                .rootFilePath(root.filePath())
                .rootOsName(root.osName())
                .rootOsVersion(root.osVersion())
                .rootBrowserName(root.browserName())
                .rootBrowserVersion(root.browserVersion())
                .rootDevice(root.device())
                .finishedAt(root.finishedAt())
                .buildStartedAt(nz(build.buildStartedAt()))
                .buildFinishedAt(nz(build.buildFinishedAt()))
                .build();
    }

    // TODO: surface logs of later retries once the report consumers agree on a column layout for them
    private static String firstFailureLog(List<NodeDetails.Retry> retries) {
        if (retries.isEmpty() || retries.get(0) == null || retries.get(0).getLogs() == null) {
            return "";
        }
        List<JsonNode> failures = retries.get(0).getLogs().get("TEST_FAILURE");
        if (failures == null || failures.isEmpty() || failures.get(0) == null || failures.get(0).isNull()) {
            return "";
        }
        JsonNode first = failures.get(0);
        return first.isValueNode() ? first.asText() : first.toString();
    }

    static String joinNonEmpty(List<?> values) {
        if (values == null) {
            return "";
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> value.toString().trim())
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(", "));
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
