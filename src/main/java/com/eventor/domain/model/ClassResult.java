package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

/**
 * All results of one competition class.
 */
@XmlEntity(searchMode = SearchMode.ORDERED)
public record ClassResult(
    @Attribute("numberOfEntries") int numberOfEntries,
    @Attribute(value = "numberOfStarts", optional = true) Integer numberOfStarts,
    @Wrapped("EventClass/EventClassId") int classId,
    @Wrapped(value = "EventClass", attribute = "sex", optional = true) String classSex,
    @Wrapped("EventClass/Name") String className,
    @Wrapped("EventClass/ClassShortName") String classShortName,
    @Wrapped("EventClass/ClassTypeId") int classTypeId,
    @Element("PersonResult") List<PersonResult> personResults
) {

    public ClassResult {
        personResults = List.copyOf(personResults);
    }
}
