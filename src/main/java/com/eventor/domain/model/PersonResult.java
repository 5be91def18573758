package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.OneOf;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.XmlEntity;

/**
 * A result together with the competitor and club that produced it.
 * Single-race events fill {@code result}, multi-race events fill {@code raceResult}.
 */
@XmlEntity(searchMode = SearchMode.ORDERED)
public record PersonResult(
    @Element("Person") Person person,
    @Element(value = "Organisation", optional = true)
    @OneOf({Organisation.class, UnknownOrganisation.class}) OrganisationRef organisation,
    @Element(value = "Result", optional = true) Result result,
    @Element(value = "RaceResult", optional = true) RaceResult raceResult
) {
}
