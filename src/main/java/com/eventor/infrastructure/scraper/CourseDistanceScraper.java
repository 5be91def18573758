package com.eventor.infrastructure.scraper;

import com.eventor.domain.model.CourseDistances;
import com.eventor.domain.model.EventRace;
import com.eventor.domain.ports.CourseDistanceGateway;
import com.eventor.infrastructure.http.HttpTransport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Scrapes course lengths from the public Eventor result page of a race.
 * <p>
 * Depends on the page layout: each class has a {@code .eventClassHeader} block whose first
 * inner {@code div} holds an {@code h3} with the class name followed by the course length.
 */
public class CourseDistanceScraper implements CourseDistanceGateway {

    private static final Logger logger = LoggerFactory.getLogger(CourseDistanceScraper.class);

    private static final String CLASS_HEADER = "eventClassHeader";

    private final HttpTransport transport;
    private final String resultListUrl;

    public CourseDistanceScraper(HttpTransport transport, String resultListUrl) {
        this.transport = transport;
        this.resultListUrl = resultListUrl;
    }

    @Override
    public CourseDistances getCourseDistances(EventRace race) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("eventID", String.valueOf(race.eventId()));
        params.put("eventRaceId", String.valueOf(race.raceId()));

        byte[] html = transport.get(resultListUrl, params, Map.of());
        Document document = Jsoup.parse(new ByteArrayInputStream(html), null, resultListUrl);
        return extractDistances(document, race);
    }

    CourseDistances extractDistances(Document document, EventRace race) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();

        for (Element header : document.getElementsByClass(CLASS_HEADER)) {
            Element inner = header.children().select("div").first();
            Element heading = inner != null ? inner.selectFirst("h3") : null;
            if (heading == null) {
                logger.warn("Class header without name in race {}: {}", race.raceId(), header.text());
                continue;
            }
            String className = heading.text().trim();
            heading.remove();

            OptionalInt meters = DistanceParser.parse(inner.text());
            if (meters.isPresent()) {
                distances.put(className, meters.getAsInt());
            } else {
                logger.warn("No course length for class '{}' in race {}: '{}'",
                    className, race.raceId(), inner.text());
                unmatched.add(className);
            }
        }

        logger.debug("Found {} course lengths for race {}", distances.size(), race.raceId());
        return new CourseDistances(distances, unmatched);
    }
}
