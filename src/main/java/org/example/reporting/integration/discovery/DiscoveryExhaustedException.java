package org.example.reporting.integration.discovery;

import org.example.reporting.ReportException;

/**
 * An enabled source has no usable build IDs after discovery.
 */
public class DiscoveryExhaustedException extends ReportException {

    private final String source;

    public DiscoveryExhaustedException(String source, String message) {
        super(message);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
