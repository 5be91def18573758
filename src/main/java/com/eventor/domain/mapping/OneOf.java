package com.eventor.domain.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Alternative record shapes for a field typed as their common interface.
 * <p>
 * A present element is decoded as the first variant that accepts it. An absent optional
 * element is filled with the last variant decoded from nothing, so that variant must
 * consist of optional or defaulted fields only.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface OneOf {

    Class<? extends Record>[] value();
}
