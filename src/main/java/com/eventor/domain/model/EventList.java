package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

@XmlEntity(tag = "EventList")
public record EventList(
    @Element("Event") List<Event> events
) {

    public EventList {
        events = List.copyOf(events);
    }
}
