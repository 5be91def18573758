package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

/**
 * Results of every class of one event.
 */
@XmlEntity(tag = "ResultList")
public record ResultList(
    @Element("Event") Event event,
    @Element("ClassResult") List<ClassResult> classResults
) {

    public ResultList {
        classResults = List.copyOf(classResults);
    }
}
