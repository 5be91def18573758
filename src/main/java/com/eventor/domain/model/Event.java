package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

import java.time.LocalDate;
import java.util.List;

/**
 * A competition event with its races in the order Eventor lists them.
 */
@XmlEntity(tag = "Event", searchMode = SearchMode.ORDERED)
public record Event(
    @Element("EventId") int eventId,
    @Element("Name") String name,
    @Element("EventClassificationId") EventClassification classification,
    @Element("EventStatusId") int eventStatusId,
    @Element(value = "EventAttributeId", optional = true) Integer eventAttributeId,
    @Element(value = "DisciplineId", optional = true) Integer disciplineId,
    @Wrapped("StartDate/Date") LocalDate startDate,
    @Element("FinishDate") EventDate finishDate,
    @Wrapped("Organiser/OrganisationId") List<Integer> organiserIds,
    @Element("EventRace") List<EventRace> eventRaces
) {

    public Event {
        organiserIds = List.copyOf(organiserIds);
        eventRaces = List.copyOf(eventRaces);
    }
}
