package com.eventor.domain.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Reads a field through a slash-separated chain of elements, e.g. {@code "PersonName/Family"}.
 * <p>
 * Without {@link #attribute()} every segment but the last is descended into and the last
 * one is read like an {@link Element}. With an attribute, every segment is descended into
 * and the attribute is read from the innermost element.
 * <p>
 * Several fields may share the same wrapper element.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Wrapped {

    String value();

    String attribute() default "";

    boolean optional() default false;
}
