package com.eventor.domain.ports;

import com.eventor.domain.model.CourseDistances;
import com.eventor.domain.model.EventRace;

import java.io.IOException;

/**
 * Port for course lengths, which the Eventor API does not expose.
 */
public interface CourseDistanceGateway {

    /**
     * Gets the course length of every class in a race.
     *
     * @param race The race to look up
     * @return Distances by class name
     * @throws IOException if the page could not be fetched
     */
    CourseDistances getCourseDistances(EventRace race) throws IOException;
}
