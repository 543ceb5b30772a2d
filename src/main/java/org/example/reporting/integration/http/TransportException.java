package org.example.reporting.integration.http;

import org.example.reporting.ReportException;

/**
 * Non-success HTTP response or network failure. {@code statusCode} is 0 when no response was received.
 */
public class TransportException extends ReportException {

    private final int statusCode;
    private final String url;
    private final String responseBody;

    public TransportException(int statusCode, String url, String responseBody, Throwable cause) {
        super(buildMessage(statusCode, url, responseBody, cause), cause);
        this.statusCode = statusCode;
        this.url = url;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public String getResponseBody() {
        return responseBody;
    }

    private static String buildMessage(int statusCode, String url, String body, Throwable cause) {
        if (statusCode == 0) {
            return "Request failed for " + url + ": " + (cause != null ? cause.getMessage() : "no response");
        }
        return "Request failed " + statusCode + " for " + url + (body == null || body.isEmpty() ? "" : "\n" + body);
    }
}
