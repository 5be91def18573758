package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;

/**
 * Geographic position of an event centre.
 */
public record Position(
    @Attribute("x") double x,
    @Attribute("y") double y,
    @Attribute("unit") String unit
) {
}
