package com.eventor.domain.model;

import com.eventor.domain.mapping.DefaultValue;
import com.eventor.domain.mapping.Element;

/**
 * Stand-in for a competitor without a club.
 */
public record UnknownOrganisation(
    @Element("Name") @DefaultValue(UnknownOrganisation.CLUBLESS_NAME) String name
) implements OrganisationRef {

    public static final String CLUBLESS_NAME = "Klubblös";

    public static UnknownOrganisation clubless() {
        return new UnknownOrganisation(CLUBLESS_NAME);
    }
}
