package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

/**
 * A club, district or federation registered in Eventor.
 */
@XmlEntity(tag = "Organisation", searchMode = SearchMode.ORDERED)
public record Organisation(
    @Element("OrganisationId") int organisationId,
    @Element("Name") String name,
    @Element("ShortName") String shortName,
    @Element(value = "MediaName", optional = true) String mediaName,
    @Element("OrganisationTypeId") int organisationTypeId,
    @Element(value = "Country", optional = true) Country country,
    @Wrapped(value = "ParentOrganisation/OrganisationId", optional = true) Integer parentOrganisationId
) implements OrganisationRef {
}
