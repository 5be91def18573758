package com.eventor.infrastructure.http;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link HttpTransport} backed by Apache HttpClient.
 * Uses the client's default timeouts and never retries on its own.
 */
public class HttpClientTransport implements HttpTransport, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;

    public HttpClientTransport(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        String preview = text.length() > MAX_LOG_BODY_LENGTH
            ? text.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : text;
        logger.error("Response body preview: {}", preview);
    }

    @Override
    public byte[] get(String url, Map<String, String> params, Map<String, String> headers) throws IOException {
        String fullUrl = buildUrl(url, params);
        HttpGet request = new HttpGet(fullUrl);

        if (headers != null) {
            headers.forEach(request::addHeader);
            logger.debug("GET {} headers={}", fullUrl, headers.keySet());
        } else {
            logger.debug("GET {}", fullUrl);
        }

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            byte[] body = entity != null ? EntityUtils.toByteArray(entity) : new byte[0];

            if (statusCode >= 200 && statusCode < 300) {
                return body;
            }
            logger.error("HTTP request failed with status {}: {}", statusCode, fullUrl);
            logResponseBodyPreview(body);
            throw new TransportException(fullUrl, statusCode);
        } catch (TransportException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException(fullUrl, e);
        }
    }

    /**
     * Appends URL-encoded query parameters to a base URL.
     */
    static String buildUrl(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringBuilder urlBuilder = new StringBuilder(baseUrl).append('?');
        for (Map.Entry<String, String> entry : params.entrySet()) {
            urlBuilder.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .append('&');
        }
        // Remove trailing &
        urlBuilder.setLength(urlBuilder.length() - 1);
        return urlBuilder.toString();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
