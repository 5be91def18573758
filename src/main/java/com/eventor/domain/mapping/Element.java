package com.eventor.domain.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Reads a field from a direct child element.
 * <p>
 * Scalar fields take the child's text, record fields are decoded from the child, and
 * {@code List} fields collect every matching child in document order.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Element {

    String value();

    boolean optional() default false;
}
