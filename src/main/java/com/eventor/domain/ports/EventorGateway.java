package com.eventor.domain.ports;

import com.eventor.domain.model.Event;
import com.eventor.domain.model.EventClassification;
import com.eventor.domain.model.Organisation;
import com.eventor.domain.model.Person;
import com.eventor.domain.model.ResultList;
import com.eventor.domain.model.ResultListList;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

/**
 * Port for reading events, organisations, persons and results from Eventor.
 * <p>
 * Every call performs its request(s) before returning. Streams are backed by the already
 * decoded document: they are single-pass and a new call is needed to iterate again.
 * Transport failures surface as {@code TransportException}, malformed documents as
 * {@code XmlDecodingException}; both are {@link IOException}s and neither is retried.
 */
public interface EventorGateway {

    /**
     * Gets all information about one event.
     *
     * @param eventId The Eventor id of the event
     * @return The decoded event
     */
    Event getEvent(int eventId) throws IOException;

    /**
     * Lists every organisation known to Eventor.
     */
    Stream<Organisation> getAllOrganisations() throws IOException;

    /**
     * Lists events within a date range.
     */
    Stream<Event> getEvents(LocalDate fromDate, LocalDate toDate) throws IOException;

    /**
     * Lists events within a date range, narrowed by optional filters.
     * A {@code null} or empty filter is not sent at all. Each list is sent as one
     * comma-separated parameter, e.g. {@code eventIds=100,101}.
     *
     * @param eventIds        only these events
     * @param organisationIds only events organised by these organisations
     * @param classifications only events with these classifications
     */
    Stream<Event> getEvents(LocalDate fromDate, LocalDate toDate, List<Integer> eventIds,
                            List<Integer> organisationIds, List<EventClassification> classifications)
        throws IOException;

    /**
     * Gets the result list of an event without split times.
     */
    ResultList getEventResults(int eventId) throws IOException;

    /**
     * Gets the result list of an event.
     *
     * @param includeSplitTimes whether each result should carry its split times
     */
    ResultList getEventResults(int eventId, boolean includeSplitTimes) throws IOException;

    /**
     * Gets every result of one person within a date range.
     */
    ResultListList getAllResultsForPerson(int personId, LocalDate fromDate, LocalDate toDate) throws IOException;

    /**
     * Gets every result of one person within a date range.
     *
     * @param top also include the best {@code top} competitors of each class; 0 or less for none
     */
    ResultListList getAllResultsForPerson(int personId, LocalDate fromDate, LocalDate toDate, int top)
        throws IOException;

    /**
     * Gets the organisation the API key belongs to.
     */
    Organisation getOwnOrganisation() throws IOException;

    /**
     * Lists every person in the organisation the API key belongs to.
     * The person listing is only requested once the organisation has been resolved.
     */
    Stream<Person> getAllPersonsInOwnOrganisation() throws IOException;
}
