package org.example.reporting.auth;

import org.example.reporting.ReportException;

/**
 * Raised before any network access when a credential variable is missing or empty.
 */
public class CredentialException extends ReportException {

    public CredentialException(String message) {
        super(message);
    }
}
