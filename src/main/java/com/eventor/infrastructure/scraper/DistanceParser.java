package com.eventor.infrastructure.scraper;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads course lengths as Eventor prints them in class headers, e.g. {@code "3 200 m, 12 kontroller"}.
 */
public final class DistanceParser {

    // An optional leading digit group (thousands written with a space), then digits and " m,".
    private static final Pattern DISTANCE_PATTERN =
        Pattern.compile("(?:(\\d*)[\\s\\u00A0]+)?(\\d+) m,");

    private DistanceParser() {
    }

    /**
     * Parses a distance in meters at the start of the text. Anything after {@code " m,"} is ignored.
     *
     * @return the distance, or empty if the text does not start with one
     */
    public static OptionalInt parse(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = DISTANCE_PATTERN.matcher(text);
        if (!matcher.lookingAt()) {
            return OptionalInt.empty();
        }
        String thousands = matcher.group(1) != null ? matcher.group(1) : "";
        try {
            return OptionalInt.of(Integer.parseInt(thousands + matcher.group(2)));
        } catch (NumberFormatException e) {
            // Too many digits for an int is not a course length either.
            return OptionalInt.empty();
        }
    }
}
