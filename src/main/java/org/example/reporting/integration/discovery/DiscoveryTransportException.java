package org.example.reporting.integration.discovery;

import org.example.reporting.ReportException;
import org.example.reporting.integration.http.TransportException;

/**
 * A failed discovery request. Recorded as a warning; the traversal it belongs to stops
 * and keeps what it collected so far.
 */
public class DiscoveryTransportException extends ReportException {

    public DiscoveryTransportException(String step, TransportException cause) {
        super(step + " stopped: " + cause.getMessage(), cause);
    }

    public int getStatusCode() {
        return ((TransportException) getCause()).getStatusCode();
    }
}
