package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Date with an optional clock time, as Eventor writes start, finish and birth dates.
 */
public record EventDate(
    @Element("Date") LocalDate date,
    @Element(value = "Clock", optional = true) LocalTime clock
) {
}
