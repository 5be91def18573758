package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

@XmlEntity(tag = "OrganisationList")
public record OrganisationList(
    @Element("Organisation") List<Organisation> organisations
) {

    public OrganisationList {
        organisations = List.copyOf(organisations);
    }
}
