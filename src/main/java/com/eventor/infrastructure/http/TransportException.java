package com.eventor.infrastructure.http;

import java.io.IOException;

/**
 * Connection failure, timeout or non-success status for a request.
 */
public class TransportException extends IOException {

    public static final int NO_RESPONSE = -1;

    private final String url;
    private final int statusCode;

    public TransportException(String url, int statusCode) {
        super("HTTP request failed with status " + statusCode + ": " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(String url, Throwable cause) {
        super("HTTP request failed: " + url, cause);
        this.url = url;
        this.statusCode = NO_RESPONSE;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP status of the response, or {@link #NO_RESPONSE}.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
