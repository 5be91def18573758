package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.XmlEntity;

/**
 * Result in one race of a multi-race event.
 */
@XmlEntity(searchMode = SearchMode.ORDERED)
public record RaceResult(
    @Element("EventRaceId") int eventRaceId,
    @Element("Result") Result result
) {
}
