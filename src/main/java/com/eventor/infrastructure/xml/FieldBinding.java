package com.eventor.infrastructure.xml;

import com.eventor.domain.mapping.OneOf;

import java.util.List;

/**
 * One row of an entity's mapping table: where a record component is read from and how.
 *
 * @param name         record component name
 * @param wrappers     elements descended into before the final lookup
 * @param tag          child tag of the final lookup, {@code null} for attributes and text
 * @param attribute    attribute name, {@code null} unless the value is an attribute
 * @param valueType    scalar or record type, the element type for collections
 * @param collection   whether every matching child is collected
 * @param optional     whether an absent value is allowed
 * @param defaultValue literal substituted when absent, or {@code null}
 * @param variants     alternative record shapes, empty unless {@link OneOf} is declared
 */
record FieldBinding(
    String name,
    List<String> wrappers,
    String tag,
    String attribute,
    Class<?> valueType,
    boolean collection,
    boolean optional,
    String defaultValue,
    List<Class<?>> variants
) {

    boolean isAttribute() {
        return attribute != null;
    }

    boolean isText() {
        return attribute == null && tag == null;
    }

    String describe() {
        StringBuilder location = new StringBuilder();
        for (String wrapper : wrappers) {
            location.append(wrapper).append('/');
        }
        if (isAttribute()) {
            location.append('@').append(attribute);
        } else if (tag != null) {
            location.append(tag);
        } else {
            location.append("text()");
        }
        return name + " (" + location + ")";
    }
}
