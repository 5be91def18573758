package com.eventor.domain.mapping;

/**
 * Enum constants carrying the numeric code the remote service uses for them.
 */
public interface Coded {

    int code();
}
