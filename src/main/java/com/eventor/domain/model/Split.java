package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.Element;

/**
 * Punch at one control. A missing time means the control was missed.
 */
public record Split(
    @Attribute("sequence") int sequence,
    @Element("ControlCode") int controlCode,
    @Element(value = "Time", optional = true) String time
) {

    public boolean isMissed() {
        return time == null;
    }
}
