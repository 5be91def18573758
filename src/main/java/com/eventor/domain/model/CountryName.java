package com.eventor.domain.model;

import com.eventor.domain.mapping.Attribute;
import com.eventor.domain.mapping.Text;

/**
 * Country name in one language.
 */
public record CountryName(
    @Attribute("languageId") String languageId,
    @Text String name
) {
}
