package org.example.reporting;

/**
 * Basisklasse fuer alle fatalen Fehler eines Report-Laufs.
 */
public class ReportException extends RuntimeException {

    public ReportException(String message) {
        super(message);
    }

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
