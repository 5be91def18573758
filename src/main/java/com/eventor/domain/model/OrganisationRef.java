package com.eventor.domain.model;

/**
 * Organisation a competitor ran for: either a known {@link Organisation} or
 * {@link UnknownOrganisation} when the result carries none.
 */
public sealed interface OrganisationRef permits Organisation, UnknownOrganisation {

    String name();
}
