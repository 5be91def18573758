package com.eventor.infrastructure.scraper;

import com.eventor.domain.model.CourseDistances;
import com.eventor.domain.model.EventDate;
import com.eventor.domain.model.EventRace;
import com.eventor.infrastructure.http.HttpTransport;
import com.eventor.infrastructure.http.TransportException;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CourseDistanceScraper against a saved result page.
 */
class CourseDistanceScraperTest {

    private static final String RESULT_LIST_URL = "https://eventor.test/Events/ResultList";

    private final EventRace race = new EventRace(null, 47001, 41234, null,
        new EventDate(LocalDate.of(2025, 5, 6), null), null);

    @Test
    void testGetCourseDistances() throws Exception {
        List<Map<String, String>> requestedParams = new ArrayList<>();
        byte[] page = fixture("result-page.html");
        HttpTransport transport = (url, params, headers) -> {
            assertEquals(RESULT_LIST_URL, url);
            assertTrue(headers.isEmpty());
            requestedParams.add(params);
            return page;
        };

        CourseDistances distances = new CourseDistanceScraper(transport, RESULT_LIST_URL).getCourseDistances(race);

        assertEquals(List.of(Map.of("eventID", "41234", "eventRaceId", "47001")), requestedParams);
        assertEquals(List.of("Gul kort ungdom", "Vit", "Blå lång vuxen"),
            List.copyOf(distances.metersByClass().keySet()));
        assertEquals(2100, distances.metersByClass().get("Gul kort ungdom"));
        assertEquals(850, distances.metersByClass().get("Vit"));
        assertEquals(7450, distances.metersByClass().get("Blå lång vuxen"));
    }

    @Test
    void testClassWithoutDistanceDoesNotAbortPage() throws Exception {
        HttpTransport transport = (url, params, headers) -> fixture("result-page.html");

        CourseDistances distances = new CourseDistanceScraper(transport, RESULT_LIST_URL).getCourseDistances(race);

        assertEquals(List.of("Inskolning"), distances.unmatchedClasses());
        assertEquals(3, distances.metersByClass().size());
    }

    @Test
    void testPageWithoutClassHeaders() {
        CourseDistanceScraper scraper = new CourseDistanceScraper((url, params, headers) -> new byte[0], RESULT_LIST_URL);

        CourseDistances distances = scraper.extractDistances(Jsoup.parse("<html><body><p>Inga resultat</p></body></html>"), race);

        assertTrue(distances.metersByClass().isEmpty());
        assertTrue(distances.unmatchedClasses().isEmpty());
    }

    @Test
    void testTransportErrorPropagates() {
        HttpTransport transport = (url, params, headers) -> {
            throw new TransportException(url, 503);
        };

        assertThrows(TransportException.class,
            () -> new CourseDistanceScraper(transport, RESULT_LIST_URL).getCourseDistances(race));
    }

    private static byte[] fixture(String name) throws IOException {
        try (InputStream in = CourseDistanceScraperTest.class.getResourceAsStream("/eventor/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return in.readAllBytes();
        }
    }
}
