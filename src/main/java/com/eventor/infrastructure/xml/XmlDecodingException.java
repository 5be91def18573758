package com.eventor.infrastructure.xml;

import java.io.IOException;

/**
 * Raised when a document does not match the shape of the entity it is decoded into.
 */
public class XmlDecodingException extends IOException {

    private final String path;

    public XmlDecodingException(String message, String path) {
        super(message + " at " + path);
        this.path = path;
    }

    public XmlDecodingException(String message, String path, Throwable cause) {
        super(message + " at " + path, cause);
        this.path = path;
    }

    /**
     * Slash-separated element path where decoding failed, e.g. {@code Event/EventRace[2]/RaceDate}.
     */
    public String getPath() {
        return path;
    }
}
