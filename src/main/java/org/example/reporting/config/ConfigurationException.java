package org.example.reporting.config;

import org.example.reporting.ReportException;

import java.util.List;

/**
 * Raised when a resolved report configuration is invalid. Carries every violation found,
 * not only the first one.
 */
public class ConfigurationException extends ReportException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        StringBuilder sb = new StringBuilder("Invalid report configuration.");
        for (String violation : violations) {
            sb.append('\n').append(violation);
        }
        sb.append("\nTip: provide real BrowserStack build IDs, or disable the corresponding section "
                + "(testReporting.enabled/appAutomate.enabled).");
        return sb.toString();
    }
}
