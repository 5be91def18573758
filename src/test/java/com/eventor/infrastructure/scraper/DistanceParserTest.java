package com.eventor.infrastructure.scraper;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DistanceParser.
 */
class DistanceParserTest {

    @Test
    void testParseWithThousandsSeparator() {
        assertEquals(OptionalInt.of(3200), DistanceParser.parse("3 200 m, 1:30"));
    }

    @Test
    void testParseWithoutSeparator() {
        assertEquals(OptionalInt.of(450), DistanceParser.parse("450 m,"));
        assertEquals(OptionalInt.of(2100), DistanceParser.parse("2100 m, 9 kontroller"));
    }

    @Test
    void testParseNonBreakingSpaceSeparator() {
        assertEquals(OptionalInt.of(7450), DistanceParser.parse("7\u00A0450 m, 21 kontroller"));
    }

    @Test
    void testParseIgnoresTrailingText() {
        assertEquals(OptionalInt.of(5300), DistanceParser.parse("5 300 m, 18 kontroller, 190 m stigning"));
    }

    @Test
    void testNoMatch() {
        assertEquals(OptionalInt.empty(), DistanceParser.parse("no distance here"));
        assertEquals(OptionalInt.empty(), DistanceParser.parse("3 200 m"));
        assertEquals(OptionalInt.empty(), DistanceParser.parse("Bana 3 200 m,"));
        assertEquals(OptionalInt.empty(), DistanceParser.parse(""));
        assertEquals(OptionalInt.empty(), DistanceParser.parse(null));
    }
}
