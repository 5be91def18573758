package com.eventor.infrastructure.eventor;

import com.eventor.domain.model.Event;
import com.eventor.domain.model.EventClassification;
import com.eventor.domain.model.EventList;
import com.eventor.domain.model.Organisation;
import com.eventor.domain.model.OrganisationList;
import com.eventor.domain.model.Person;
import com.eventor.domain.model.PersonList;
import com.eventor.domain.model.ResultList;
import com.eventor.domain.model.ResultListList;
import com.eventor.domain.ports.EventorGateway;
import com.eventor.infrastructure.http.HttpTransport;
import com.eventor.infrastructure.xml.XmlDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Eventor API client. Every request carries the API key in the {@code ApiKey} header.
 */
public class EventorApiClient implements EventorGateway {

    private static final Logger logger = LoggerFactory.getLogger(EventorApiClient.class);

    public static final String API_KEY_HEADER = "ApiKey";

    private final HttpTransport transport;
    private final XmlDecoder decoder;
    private final String baseUrl;
    private final Map<String, String> headers;

    public EventorApiClient(HttpTransport transport, XmlDecoder decoder, String baseUrl, String apiToken) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiToken, "apiToken");
        if (apiToken.isBlank()) {
            logger.warn("No Eventor API token configured, requests will be rejected");
        }
        this.headers = Map.of(API_KEY_HEADER, apiToken);
    }

    @Override
    public Event getEvent(int eventId) throws IOException {
        byte[] body = call(Endpoint.EVENT, Map.of(), String.valueOf(eventId));
        return decoder.decode(body, Event.class);
    }

    @Override
    public Stream<Organisation> getAllOrganisations() throws IOException {
        byte[] body = call(Endpoint.ORGANISATIONS, Map.of(), null);
        return decoder.decode(body, OrganisationList.class).organisations().stream();
    }

    @Override
    public Stream<Event> getEvents(LocalDate fromDate, LocalDate toDate) throws IOException {
        return getEvents(fromDate, toDate, null, null, null);
    }

    @Override
    public Stream<Event> getEvents(LocalDate fromDate, LocalDate toDate, List<Integer> eventIds,
                                   List<Integer> organisationIds, List<EventClassification> classifications)
        throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fromDate", formatDate(fromDate));
        params.put("toDate", formatDate(toDate));

        if (eventIds != null && !eventIds.isEmpty()) {
            params.put("eventIds", joinIds(eventIds));
        }
        if (organisationIds != null && !organisationIds.isEmpty()) {
            params.put("organisationIds", joinIds(organisationIds));
        }
        if (classifications != null && !classifications.isEmpty()) {
            params.put("classificationIds", classifications.stream()
                .map(c -> String.valueOf(c.code()))
                .collect(Collectors.joining(",")));
        }

        byte[] body = call(Endpoint.EVENTS, params, null);
        return decoder.decode(body, EventList.class).events().stream();
    }

    @Override
    public ResultList getEventResults(int eventId) throws IOException {
        return getEventResults(eventId, false);
    }

    @Override
    public ResultList getEventResults(int eventId, boolean includeSplitTimes) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("eventId", String.valueOf(eventId));
        if (includeSplitTimes) {
            params.put("includeSplitTimes", "true");
        }

        byte[] body = call(Endpoint.RESULTS, params, null);
        return decoder.decode(body, ResultList.class);
    }

    @Override
    public ResultListList getAllResultsForPerson(int personId, LocalDate fromDate, LocalDate toDate)
        throws IOException {
        return getAllResultsForPerson(personId, fromDate, toDate, 0);
    }

    @Override
    public ResultListList getAllResultsForPerson(int personId, LocalDate fromDate, LocalDate toDate, int top)
        throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("fromDate", formatDate(fromDate));
        params.put("toDate", formatDate(toDate));
        params.put("personId", String.valueOf(personId));
        if (top > 0) {
            params.put("top", String.valueOf(top));
        }

        byte[] body = call(Endpoint.PERSON_RESULTS, params, null);
        return decoder.decode(body, ResultListList.class);
    }

    @Override
    public Organisation getOwnOrganisation() throws IOException {
        byte[] body = call(Endpoint.TOKEN_ORGANISATION, Map.of(), null);
        return decoder.decode(body, Organisation.class);
    }

    @Override
    public Stream<Person> getAllPersonsInOwnOrganisation() throws IOException {
        Organisation organisation = getOwnOrganisation();

        byte[] body = call(Endpoint.PERSONS, Map.of(), String.valueOf(organisation.organisationId()));
        List<Person> persons = decoder.decode(body, PersonList.class).persons();

        if (!persons.isEmpty()) {
            if (persons.stream().allMatch(p -> p.id() == null)) {
                logger.warn("None of the {} persons in organisation {} has a PersonId",
                    persons.size(), organisation.organisationId());
            }
            if (persons.stream().allMatch(p -> p.birthDate() == null)) {
                logger.warn("None of the {} persons in organisation {} has a BirthDate",
                    persons.size(), organisation.organisationId());
            }
        }
        return persons.stream();
    }

    private byte[] call(Endpoint endpoint, Map<String, String> params, String extraPath) throws IOException {
        return transport.get(endpoint.url(baseUrl, extraPath), params, headers);
    }

    private static String formatDate(LocalDate date) {
        return Objects.requireNonNull(date, "date").format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private static String joinIds(List<Integer> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
