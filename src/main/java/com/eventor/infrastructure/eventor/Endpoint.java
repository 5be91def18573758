package com.eventor.infrastructure.eventor;

/**
 * Eventor API endpoints, relative to the API base URL.
 */
public enum Endpoint {
    EVENT("event"),
    EVENTS("events"),
    RESULTS("results/event"),
    ORGANISATIONS("organisations"),
    PERSONS("persons/organisations"),
    PERSON_RESULTS("results/person"),
    TOKEN_ORGANISATION("organisation/apiKey");

    private final String path;

    Endpoint(String path) {
        this.path = path;
    }

    /**
     * Builds the URL of this endpoint, optionally followed by one more path segment.
     */
    public String url(String baseUrl, String extraPath) {
        String url = baseUrl.endsWith("/") ? baseUrl + path : baseUrl + "/" + path;
        return extraPath != null ? url + "/" + extraPath : url;
    }
}
