package com.eventor.domain.model;

import com.eventor.infrastructure.xml.XmlDecoder;
import com.eventor.infrastructure.xml.XmlDecodingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decodes Eventor documents into the domain records.
 */
class EventorDocumentDecodingTest {

    private final XmlDecoder decoder = new XmlDecoder();

    @Test
    void testEvent() throws Exception {
        Event event = decoder.decode(fixture("event.xml"), Event.class);

        assertEquals(41234, event.eventId());
        assertEquals("Vårcupen deltävling 1", event.name());
        assertEquals(EventClassification.LOCAL_EVENT, event.classification());
        assertEquals(9, event.eventStatusId());
        assertNull(event.eventAttributeId());
        assertEquals(1, event.disciplineId());
        assertEquals(LocalDate.of(2025, 5, 6), event.startDate());
        assertEquals(new EventDate(LocalDate.of(2025, 5, 6), LocalTime.MIDNIGHT), event.finishDate());
        assertEquals(List.of(321, 654), event.organiserIds());

        assertEquals(2, event.eventRaces().size());
        EventRace first = event.eventRaces().get(0);
        assertEquals("Middle", first.raceDistance());
        assertEquals(47001, first.raceId());
        assertEquals(41234, first.eventId());
        assertEquals("Etapp 1", first.name());
        assertEquals(LocalTime.of(18, 0), first.raceDate().clock());
        assertEquals(new Position(13.5512, 58.1689, "WGS84"), first.position());

        EventRace second = event.eventRaces().get(1);
        assertEquals(47002, second.raceId());
        assertNull(second.name());
        assertNull(second.raceDate().clock());
        assertNull(second.position());
    }

    @Test
    void testEventList() throws Exception {
        EventList list = decoder.decode(fixture("event-list.xml"), EventList.class);

        assertEquals(List.of(100, 101), list.events().stream().map(Event::eventId).toList());
        assertEquals(EventClassification.CLUB_EVENT, list.events().get(0).classification());
        assertTrue(list.events().get(0).organiserIds().isEmpty());
    }

    @Test
    void testOrganisation() throws Exception {
        Organisation organisation = decoder.decode(fixture("organisation.xml"), Organisation.class);

        assertEquals(321, organisation.organisationId());
        assertEquals("Falköpings AIK OK", organisation.name());
        assertEquals("Falköpings AIK", organisation.shortName());
        assertEquals("Falköping", organisation.mediaName());
        assertEquals(3, organisation.organisationTypeId());
        assertEquals(14, organisation.parentOrganisationId());

        Country country = organisation.country();
        assertEquals(752, country.countryId());
        assertEquals(2, country.names().size());
        assertEquals(Optional.of("Sverige"), country.nameIn("sv"));
        assertEquals(Optional.empty(), country.nameIn("fi"));
    }

    @Test
    void testOrganisationFieldsAreMatchedInDocumentOrder() throws Exception {
        String xml = "<Organisation><OrganisationId>5</OrganisationId><Name>OK Ravinen</Name>"
            + "<MediaName>Ravinen</MediaName><ShortName>Ravinen</ShortName>"
            + "<OrganisationTypeId>3</OrganisationTypeId></Organisation>";

        Organisation organisation = decoder.decode(xml.getBytes(StandardCharsets.UTF_8), Organisation.class);

        assertEquals("Ravinen", organisation.shortName());
        assertNull(organisation.mediaName());
        assertNull(organisation.country());
        assertNull(organisation.parentOrganisationId());
    }

    @Test
    void testOrganisationList() throws Exception {
        OrganisationList list = decoder.decode(fixture("organisation-list.xml"), OrganisationList.class);

        assertEquals(3, list.organisations().size());
        assertNull(list.organisations().get(0).parentOrganisationId());
        assertEquals(1, list.organisations().get(1).parentOrganisationId());
    }

    @Test
    void testPersonList() throws Exception {
        PersonList list = decoder.decode(fixture("person-list.xml"), PersonList.class);

        Person anna = list.persons().get(0);
        assertEquals("F", anna.sex());
        assertEquals("Anna Andersson", anna.fullName());
        assertEquals(5001, anna.id());
        assertEquals(LocalDate.of(1990, 4, 12), anna.birthDate().date());
        assertEquals(752, anna.nationality().countryId());

        Person bo = list.persons().get(1);
        assertNull(bo.sex());
        assertNull(bo.nationality());
    }

    @Test
    void testResultList() throws Exception {
        ResultList resultList = decoder.decode(fixture("result-list.xml"), ResultList.class);

        assertEquals(41234, resultList.event().eventId());
        assertEquals(2, resultList.classResults().size());

        ClassResult yellow = resultList.classResults().get(0);
        assertEquals(3, yellow.numberOfEntries());
        assertEquals(3, yellow.numberOfStarts());
        assertEquals(900, yellow.classId());
        assertEquals("B", yellow.classSex());
        assertEquals("Gul kort ungdom", yellow.className());
        assertEquals("Gul K", yellow.classShortName());
        assertEquals(16, yellow.classTypeId());
        assertEquals(3, yellow.personResults().size());

        PersonResult winner = yellow.personResults().get(0);
        assertEquals("Anna Andersson", winner.person().fullName());
        Organisation club = assertInstanceOf(Organisation.class, winner.organisation());
        assertEquals(321, club.organisationId());
        Result result = winner.result();
        assertEquals(9000001, result.resultId());
        assertEquals(LocalTime.of(18, 2), result.startTime().clock());
        assertEquals(LocalTime.of(18, 27, 31), result.finishTime().clock());
        assertEquals("25:31", result.time());
        assertEquals("00:00", result.timeDiff());
        assertEquals(1, result.position());
        assertEquals("OK", result.status());
        assertEquals(List.of(new Split(1, 31, "03:12"), new Split(2, 45, "09:40")), result.splits());
        assertNull(winner.raceResult());

        ClassResult white = resultList.classResults().get(1);
        assertEquals(0, white.numberOfEntries());
        assertNull(white.numberOfStarts());
        assertNull(white.classSex());
        assertTrue(white.personResults().isEmpty());
    }

    @Test
    void testPersonResultWithoutOrganisationIsClubless() throws Exception {
        ResultList resultList = decoder.decode(fixture("result-list.xml"), ResultList.class);

        PersonResult second = resultList.classResults().get(0).personResults().get(1);

        assertEquals(UnknownOrganisation.clubless(), second.organisation());
        assertEquals("Klubblös", second.organisation().name());
        assertNull(second.result().startTime());
        assertTrue(second.result().splits().isEmpty());
    }

    @Test
    void testPartialOrganisationFallsBackToUnknownWithItsName() throws Exception {
        ResultList resultList = decoder.decode(fixture("result-list.xml"), ResultList.class);

        PersonResult third = resultList.classResults().get(0).personResults().get(2);

        assertEquals(new UnknownOrganisation("Gästlöpare"), third.organisation());
        assertFalse(third.result().isRanked());
        assertEquals("MisPunch", third.result().status());
        assertTrue(third.result().splits().get(1).isMissed());
    }

    @Test
    void testPersonResultFragment() throws Exception {
        String xml = "<PersonResult><Person><PersonName><Family>Dahl</Family><Given>Dan</Given></PersonName>"
            + "</Person></PersonResult>";

        PersonResult personResult = decoder.decode(xml.getBytes(StandardCharsets.UTF_8), PersonResult.class);

        assertEquals("Dan Dahl", personResult.person().fullName());
        assertEquals("Klubblös", personResult.organisation().name());
        assertNull(personResult.result());
        assertNull(personResult.raceResult());
    }

    @Test
    void testResultListList() throws Exception {
        ResultListList all = decoder.decode(fixture("result-list-list.xml"), ResultListList.class);

        assertEquals(2, all.resultLists().size());
        PersonResult personResult = all.resultLists().get(0).classResults().get(0).personResults().get(0);
        assertNull(personResult.result());
        assertEquals(200, personResult.raceResult().eventRaceId());
        assertEquals(1, personResult.raceResult().result().position());
        assertTrue(all.resultLists().get(1).classResults().isEmpty());
    }

    @Test
    void testUnknownClassificationFails() {
        String xml = "<Event><EventId>1</EventId><Name>X</Name><EventClassificationId>9</EventClassificationId>"
            + "<EventStatusId>1</EventStatusId><StartDate><Date>2025-01-01</Date></StartDate>"
            + "<FinishDate><Date>2025-01-01</Date></FinishDate></Event>";

        XmlDecodingException e = assertThrows(XmlDecodingException.class,
            () -> decoder.decode(xml.getBytes(StandardCharsets.UTF_8), Event.class));

        assertEquals("Event/EventClassificationId", e.getPath());
    }

    @Test
    void testWrongDocumentTypeFails() {
        assertThrows(XmlDecodingException.class,
            () -> decoder.decode(fixture("organisation.xml"), Event.class));
    }

    static byte[] fixture(String name) throws IOException {
        try (InputStream in = EventorDocumentDecodingTest.class.getResourceAsStream("/eventor/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return in.readAllBytes();
        }
    }
}
