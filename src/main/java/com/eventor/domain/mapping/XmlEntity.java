package com.eventor.domain.mapping;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a record as decodable from XML.
 * Records without this annotation are anonymous fragments matched in {@link SearchMode#UNORDERED} mode.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface XmlEntity {

    /** Expected root tag when decoded as a top-level document. Empty for anonymous fragments. */
    String tag() default "";

    SearchMode searchMode() default SearchMode.UNORDERED;
}
