package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;
import java.util.Optional;

@XmlEntity(tag = "Country", searchMode = SearchMode.ORDERED)
public record Country(
    @Wrapped(value = "CountryId", attribute = "value") int countryId,
    @Element("Name") List<CountryName> names
) {

    public Country {
        names = List.copyOf(names);
    }

    /**
     * Name of the country in the given language, e.g. {@code "sv"} or {@code "en"}.
     */
    public Optional<String> nameIn(String languageId) {
        return names.stream()
            .filter(n -> languageId.equals(n.languageId()))
            .map(CountryName::name)
            .findFirst();
    }
}
