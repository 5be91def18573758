package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

@XmlEntity(tag = "PersonList")
public record PersonList(
    @Element("Person") List<Person> persons
) {

    public PersonList {
        persons = List.copyOf(persons);
    }
}
