package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

/**
 * A competitor.
 * <p>
 * {@code id} and {@code birthDate} are always sent by the current API version but are kept
 * optional so that a sparse response still decodes.
 */
@XmlEntity(tag = "Person", searchMode = SearchMode.ORDERED)
public record Person(
    @Attribute(value = "sex", optional = true) String sex,
    @Wrapped("PersonName/Family") String familyName,
    @Wrapped("PersonName/Given") String givenName,
    @Element(value = "PersonId", optional = true) Integer id,
    @Element(value = "BirthDate", optional = true) EventDate birthDate,
    @Wrapped(value = "Nationality/Country", optional = true) Country nationality
) {

    public String fullName() {
        return givenName + " " + familyName;
    }
}
