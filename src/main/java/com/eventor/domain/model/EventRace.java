package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.XmlEntity;

/**
 * One race of an event. Single-race events still have exactly one.
 *
 * @param raceDistance race format such as {@code Sprint} or {@code Middle}, when given
 */
@XmlEntity(searchMode = SearchMode.ORDERED)
public record EventRace(
    @Attribute(value = "raceDistance", optional = true) String raceDistance,
    @Element("EventRaceId") int raceId,
    @Element("EventId") int eventId,
    @Element(value = "Name", optional = true) String name,
    @Element("RaceDate") EventDate raceDate,
    @Element(value = "EventCenterPosition", optional = true) Position position
) {
}
