package com.eventor.domain.mapping;

/**
 * How the fields of an entity are matched against the child elements of its XML element.
 */
public enum SearchMode {

    /**
     * Fields are matched in declaration order. The search for a field starts after the
     * child that satisfied the previous field, skipping children with other tags.
     */
    ORDERED,

    /**
     * Fields may match children in any order. Each child is bound to at most one field.
     */
    UNORDERED
}
