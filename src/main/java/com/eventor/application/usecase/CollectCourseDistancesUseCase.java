package com.eventor.application.usecase;

import com.eventor.domain.model.CourseDistances;
import com.eventor.domain.model.Event;
import com.eventor.domain.model.EventRace;
import com.eventor.domain.ports.CourseDistanceGateway;
import com.eventor.domain.ports.EventorGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Use case for collecting the course lengths of every race in an event.
 * Races are scraped one after another; a failed race does not stop the others.
 */
@Service
public class CollectCourseDistancesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(CollectCourseDistancesUseCase.class);

    private final EventorGateway eventorGateway;
    private final CourseDistanceGateway courseDistanceGateway;

    public CollectCourseDistancesUseCase(EventorGateway eventorGateway, CourseDistanceGateway courseDistanceGateway) {
        this.eventorGateway = eventorGateway;
        this.courseDistanceGateway = courseDistanceGateway;
    }

    /**
     * Fetches the event and scrapes the result page of each of its races.
     *
     * @param eventId The Eventor id of the event
     * @return Summary of the collected distances and the races that failed
     * @throws IOException if the event itself could not be fetched
     */
    public CourseDistanceSummary execute(int eventId) throws IOException {
        Event event = eventorGateway.getEvent(eventId);
        logger.info("Collecting course lengths for {} races of event {} ({})",
            event.eventRaces().size(), eventId, event.name());

        Map<Integer, CourseDistances> distancesByRace = new LinkedHashMap<>();
        Map<Integer, String> errorsByRace = new LinkedHashMap<>();

        for (EventRace race : event.eventRaces()) {
            try {
                CourseDistances distances = courseDistanceGateway.getCourseDistances(race);
                distancesByRace.put(race.raceId(), distances);
                logger.info("Race {} has course lengths for {} classes",
                    race.raceId(), distances.metersByClass().size());
            } catch (IOException e) {
                logger.error("Scraping race {} of event {} failed", race.raceId(), eventId, e);
                errorsByRace.put(race.raceId(), e.getMessage());
            }
        }

        return new CourseDistanceSummary(event, distancesByRace, errorsByRace);
    }

    public record CourseDistanceSummary(
        Event event,
        Map<Integer, CourseDistances> distancesByRace,
        Map<Integer, String> errors
    ) {}
}
