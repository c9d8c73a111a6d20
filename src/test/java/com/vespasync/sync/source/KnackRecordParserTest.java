package com.vespasync.sync.source;

import com.vespasync.sync.identity.MappingException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnackRecordParserTest {
    private final KnackRecordParser parser = new KnackRecordParser(KnackFixtures.CATALOG, "field_2300", List.of("Australia"));

    @Test
    void parseInstitution_shouldReadNameStatusAndCalendarPolicy() throws Exception {
        JSONObject record = KnackFixtures.institution("i1", "<b>North Academy</b>").put("field_2300", "australia");

        ParsedRecords.InstitutionRecord parsed = parser.parseInstitution(record);

        assertEquals("i1", parsed.externalId());
        assertEquals("North Academy", parsed.name());
        assertEquals("Active", parsed.status());
        assertTrue(parsed.usesCalendarYear());
    }

    @Test
    void parseInstitution_shouldFallBackToSecondaryNameField() throws Exception {
        JSONObject record = new JSONObject().put("id", "i2").put("field_11", "South College");

        ParsedRecords.InstitutionRecord parsed = parser.parseInstitution(record);

        assertEquals("South College", parsed.name());
        assertNull(parsed.status());
        assertFalse(parsed.usesCalendarYear());
    }

    @Test
    void parseInstitution_shouldRejectRecordWithoutName() {
        MappingException e = assertThrows(MappingException.class,
                () -> parser.parseInstitution(new JSONObject().put("id", "i3")));
        assertEquals("missing_name", e.category());
    }

    @Test
    void parsePerson_shouldMapIdentityAndCycleScores() throws Exception {
        JSONObject record = KnackFixtures.person("p1", " Sam@School.ORG ", "i1", "15/01/2025", 5, 6, 7, 8, 9, 7);
        KnackFixtures.withCycle(record, 2, "6.5", 6, 7, 8, 9, 8);

        ParsedRecords.PersonRecord parsed = parser.parsePerson(record);

        assertEquals("sam@school.org", parsed.email());
        assertEquals("Sam Lee", parsed.name());
        assertEquals("i1", parsed.institutionExternalId());
        assertEquals("12B", parsed.groupName());
        assertEquals("15/01/2025", parsed.completionDate());
        assertEquals(2, parsed.cycles().size());
        assertEquals(List.of(5, 6, 7, 8, 9, 7), parsed.cycles().get(0).scores());
        assertEquals(7, parsed.cycles().get(1).scores().get(0));
        assertTrue(parsed.cycles().get(1).rejectedFields().isEmpty());
    }

    @Test
    void parsePerson_shouldDropOutOfRangeAndNonNumericScores() throws Exception {
        JSONObject record = KnackFixtures.person("p1", "a@b.org", "i1", "", 11, "abc", -1, null, 4, 10);

        ParsedRecords.CycleScores cycle = parser.parsePerson(record).cycles().get(0);

        assertEquals(Arrays.asList(null, null, null, null, 4, 10), cycle.scores());
        assertEquals(3, cycle.rejectedFields().size());
        assertTrue(cycle.rejectedFields().get(0).startsWith("vision@field_155"));
    }

    @Test
    void parsePerson_shouldReadEmailFromStructuredValue() throws Exception {
        JSONObject record = KnackFixtures.person("p1", "", "i1", "", 5)
                .put("field_197_raw", new JSONObject().put("email", "Raw@B.org"));

        assertEquals("raw@b.org", parser.parsePerson(record).email());
    }

    @Test
    void parsePerson_shouldRequireEmailAndInstitution() {
        MappingException noEmail = assertThrows(MappingException.class,
                () -> parser.parsePerson(KnackFixtures.person("p1", "", "i1", "", 5)));
        assertEquals("missing_email", noEmail.category());

        JSONObject unlinked = KnackFixtures.person("p2", "a@b.org", "i1", "", 5);
        unlinked.put("field_133_raw", new JSONArray());
        MappingException noInstitution = assertThrows(MappingException.class, () -> parser.parsePerson(unlinked));
        assertEquals("missing_institution", noInstitution.category());
    }

    @Test
    void parseResponses_shouldMapCatalogQuestionsAndRejectOutOfRange() throws Exception {
        JSONObject record = KnackFixtures.responses("r1", "p1", 4, 9, 2)
                .put("field_2829", "3");

        ParsedRecords.ResponseSet parsed = parser.parseResponses(record);

        assertEquals("p1", parsed.personExternalId());
        assertEquals(4, parsed.answers().size());
        assertTrue(parsed.answers().contains(new ParsedRecords.Answer(1, "q1", 4)));
        assertTrue(parsed.answers().contains(new ParsedRecords.Answer(1, "outcome_q_support", 4)));
        assertTrue(parsed.answers().contains(new ParsedRecords.Answer(2, "outcome_q_support", 3)));
        assertEquals(List.of("outcome_q_equipped@cycle1=9"), parsed.rejectedFields());
    }

    @Test
    void parseResponses_shouldRequirePersonLink() {
        JSONObject record = new JSONObject().put("id", "r1").put("field_2826", 3);

        MappingException e = assertThrows(MappingException.class, () -> parser.parseResponses(record));
        assertEquals("missing_person_link", e.category());
    }

    @Test
    void parseStaff_shouldReadRoleSpecificFields() throws Exception {
        ParsedRecords.StaffRecord admin = parser.parseStaffAdmin(KnackFixtures.staffAdmin("s1", "Admin@North.org", "North Academy"));
        ParsedRecords.StaffRecord root = parser.parseSuperUser(KnackFixtures.superUser("u1", "root@x.org"));

        assertEquals("admin@north.org", admin.email());
        assertEquals("Pat Admin", admin.name());
        assertEquals("North Academy", admin.institutionName());
        assertEquals("Root User", root.name());
        assertNull(root.institutionName());
    }

    @Test
    void parse_shouldRejectRecordWithoutId() {
        MappingException e = assertThrows(MappingException.class,
                () -> parser.parseSuperUser(new JSONObject().put("field_234", "a@b.org")));
        assertEquals("missing_id", e.category());
    }
}
