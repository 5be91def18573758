package com.eventor.domain.model;

import com.eventor.domain.mapping.Coded;

/**
 * Competitive level of an event, with the ids Eventor uses for them.
 */
public enum EventClassification implements Coded {
    CHAMPIONSHIP_EVENT(1),
    NATIONAL_EVENT(2),
    STATE_EVENT(3),
    LOCAL_EVENT(4),
    CLUB_EVENT(5);

    private final int code;

    EventClassification(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }
}
