package com.eventor.infrastructure.http;

import java.io.IOException;
import java.util.Map;

/**
 * Blocking HTTP GET used by the API client and the result-page scraper.
 */
public interface HttpTransport {

    /**
     * Performs a GET request and returns the response body.
     *
     * @param url     absolute URL without query string
     * @param params  query parameters, sent in iteration order
     * @param headers request headers
     * @return the raw body of a 2xx response
     * @throws TransportException if no response was received or the status was not 2xx
     */
    byte[] get(String url, Map<String, String> params, Map<String, String> headers) throws IOException;
}
