package com.vespasync.sync.source;

import com.vespasync.sync.config.Config;
import com.vespasync.sync.identity.IdentityResolver;
import com.vespasync.sync.identity.MappingException;
import com.vespasync.sync.model.ResponseRecord;
import com.vespasync.sync.model.ScoreRecord;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts raw Knack records into {@link ParsedRecords} views.
 * <p>
 * Field ids follow the VESPA Knack application: institutions are object_2, people with their
 * cycle scores object_10, questionnaire answers object_29, staff admins object_5 and super
 * users object_21.
 */
public final class KnackRecordParser {
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

    static final String INSTITUTION_NAME = "field_44";
    static final String INSTITUTION_NAME_FALLBACK = "field_11";
    static final String INSTITUTION_STATUS = "field_2209";

    static final String PERSON_EMAIL = "field_197";
    static final String PERSON_NAME = "field_187";
    static final String PERSON_INSTITUTION = "field_133";
    static final String PERSON_GROUP = "field_223";
    static final String PERSON_YEAR_GROUP = "field_144";
    static final String PERSON_COURSE = "field_2299";
    static final String PERSON_FACULTY = "field_782";
    static final String PERSON_COMPLETION_DATE = "field_855";
    static final int FIRST_SCORE_FIELD = 155;
    static final int SCORE_FIELDS_PER_CYCLE = 6;
    public static final int CYCLES = 3;

    static final String RESPONSE_PERSON_LINK = "field_792";

    static final String STAFF_EMAIL = "field_24";
    static final String STAFF_NAME = "field_23";
    static final String STAFF_INSTITUTION = "field_205";
    static final String SUPER_USER_EMAIL = "field_234";
    static final String SUPER_USER_NAME = "field_233";

    private final QuestionCatalog catalog;
    private final String calendarYearField;
    private final Set<String> calendarYearValues;

    public KnackRecordParser(QuestionCatalog catalog, String calendarYearField, List<String> calendarYearValues) {
        this.catalog = catalog;
        this.calendarYearField = calendarYearField == null ? "" : calendarYearField.trim();
        this.calendarYearValues = calendarYearValues == null
                ? Set.of()
                : calendarYearValues.stream()
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toSet());
    }

    public KnackRecordParser(QuestionCatalog catalog, Config config) {
        this(catalog,
                config.getString("source.calendar_year.field", "field_2300"),
                config.getList("source.calendar_year.values"));
    }

    public ParsedRecords.InstitutionRecord parseInstitution(JSONObject record) throws MappingException {
        String id = requireId(record);
        String name = text(record, INSTITUTION_NAME);
        if (name.isEmpty()) {
            name = text(record, INSTITUTION_NAME_FALLBACK);
        }
        if (name.isEmpty()) {
            throw new MappingException("missing_name", "institution " + id + " has no name");
        }
        String status = text(record, INSTITUTION_STATUS);
        boolean calendar = !calendarYearField.isEmpty()
                && calendarYearValues.contains(text(record, calendarYearField).toLowerCase(Locale.ROOT));
        return new ParsedRecords.InstitutionRecord(id, name, status.isEmpty() ? null : status, calendar);
    }

    public ParsedRecords.PersonRecord parsePerson(JSONObject record) throws MappingException {
        String id = requireId(record);
        String email = IdentityResolver.normalizeEmail(emailValue(record, PERSON_EMAIL));
        if (email.isEmpty()) {
            throw new MappingException("missing_email", "person " + id + " has no usable email");
        }
        String institution = firstConnectionId(record, PERSON_INSTITUTION);
        if (institution.isEmpty()) {
            throw new MappingException("missing_institution", "person " + id + " has no institution link");
        }

        List<ParsedRecords.CycleScores> cycles = new ArrayList<>();
        for (int cycle = 1; cycle <= CYCLES; cycle++) {
            int base = FIRST_SCORE_FIELD + SCORE_FIELDS_PER_CYCLE * (cycle - 1);
            // a cycle exists once its first score field is sent, even blank
            if (rawValue(record, "field_" + base) == null) {
                continue;
            }
            List<Integer> scores = new ArrayList<>(SCORE_FIELDS_PER_CYCLE);
            List<String> rejected = new ArrayList<>();
            for (int i = 0; i < SCORE_FIELDS_PER_CYCLE; i++) {
                String field = "field_" + (base + i);
                Object raw = rawValue(record, field);
                Integer parsed = parseInteger(raw);
                if (parsed == null) {
                    if (!isBlank(raw)) {
                        rejected.add(ScoreRecord.DIMENSIONS.get(i) + "@" + field + "=" + raw);
                    }
                    scores.add(null);
                    continue;
                }
                if (!ScoreRecord.inRange(parsed)) {
                    rejected.add(ScoreRecord.DIMENSIONS.get(i) + "@" + field + "=" + raw);
                    scores.add(null);
                    continue;
                }
                scores.add(parsed);
            }
            cycles.add(new ParsedRecords.CycleScores(cycle, scores, rejected));
        }

        return new ParsedRecords.PersonRecord(
                id,
                email,
                personName(record),
                institution,
                nullIfEmpty(text(record, PERSON_GROUP)),
                nullIfEmpty(text(record, PERSON_YEAR_GROUP)),
                nullIfEmpty(text(record, PERSON_COURSE)),
                nullIfEmpty(text(record, PERSON_FACULTY)),
                text(record, PERSON_COMPLETION_DATE),
                cycles
        );
    }

    public ParsedRecords.ResponseSet parseResponses(JSONObject record) throws MappingException {
        String id = requireId(record);
        String person = firstConnectionId(record, RESPONSE_PERSON_LINK);
        if (person.isEmpty()) {
            throw new MappingException("missing_person_link", "response record " + id + " has no person link");
        }
        List<ParsedRecords.Answer> answers = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (int cycle = 1; cycle <= CYCLES; cycle++) {
            for (QuestionCatalog.Question question : catalog.questions()) {
                String field = question.fieldFor(cycle);
                if (field.isEmpty()) {
                    continue;
                }
                Object raw = rawValue(record, field);
                if (isBlank(raw)) {
                    continue;
                }
                Integer value = parseInteger(raw);
                if (!ResponseRecord.inRange(value)) {
                    rejected.add(question.id() + "@cycle" + cycle + "=" + raw);
                    continue;
                }
                answers.add(new ParsedRecords.Answer(cycle, question.id(), value));
            }
        }
        return new ParsedRecords.ResponseSet(id, person, answers, rejected);
    }

    public ParsedRecords.StaffRecord parseStaffAdmin(JSONObject record) throws MappingException {
        return parseStaff(record, STAFF_EMAIL, STAFF_NAME, STAFF_INSTITUTION);
    }

    public ParsedRecords.StaffRecord parseSuperUser(JSONObject record) throws MappingException {
        return parseStaff(record, SUPER_USER_EMAIL, SUPER_USER_NAME, null);
    }

    private ParsedRecords.StaffRecord parseStaff(JSONObject record, String emailField, String nameField, String institutionField)
            throws MappingException {
        String id = requireId(record);
        String email = IdentityResolver.normalizeEmail(emailValue(record, emailField));
        if (email.isEmpty()) {
            throw new MappingException("missing_email", "staff record " + id + " has no usable email");
        }
        String name = nameValue(record, nameField);
        String institution = institutionField == null ? "" : text(record, institutionField);
        return new ParsedRecords.StaffRecord(id, email, nullIfEmpty(name), nullIfEmpty(institution));
    }

    private String requireId(JSONObject record) throws MappingException {
        String id = record == null ? "" : record.optString("id", "").trim();
        if (id.isEmpty()) {
            throw new MappingException("missing_id", "record without id");
        }
        return id;
    }

    private String personName(JSONObject record) {
        return nullIfEmpty(nameValue(record, PERSON_NAME));
    }

    private String nameValue(JSONObject record, String field) {
        Object raw = rawValue(record, field);
        if (raw instanceof JSONObject) {
            JSONObject name = (JSONObject) raw;
            String full = name.optString("full", "").trim();
            if (!full.isEmpty()) {
                return full;
            }
            return (name.optString("first", "").trim() + " " + name.optString("last", "").trim()).trim();
        }
        return text(record, field);
    }

    private String emailValue(JSONObject record, String field) {
        Object raw = rawValue(record, field);
        if (raw instanceof JSONObject) {
            return ((JSONObject) raw).optString("email", "");
        }
        if (raw instanceof JSONArray) {
            JSONArray arr = (JSONArray) raw;
            if (arr.length() > 0 && arr.opt(0) instanceof JSONObject) {
                return arr.getJSONObject(0).optString("email", "");
            }
        }
        Object plain = record.opt(field);
        if (plain instanceof String) {
            return (String) plain;
        }
        return raw instanceof String ? (String) raw : "";
    }

    /**
     * First connected record id of a connection field ({@code field_x_raw: [{"id": ...}]}).
     */
    static String firstConnectionId(JSONObject record, String field) {
        Object raw = record.opt(field + "_raw");
        if (raw instanceof JSONArray) {
            JSONArray arr = (JSONArray) raw;
            if (arr.length() == 0) {
                return "";
            }
            Object first = arr.opt(0);
            if (first instanceof JSONObject) {
                JSONObject item = (JSONObject) first;
                String id = item.optString("id", "").trim();
                return id.isEmpty() ? item.optString("value", "").trim() : id;
            }
            return first == null ? "" : String.valueOf(first).trim();
        }
        if (raw instanceof String) {
            return ((String) raw).trim();
        }
        return "";
    }

    /**
     * {@code field_x_raw} when present, otherwise {@code field_x}; JSON null is returned as null.
     */
    static Object rawValue(JSONObject record, String field) {
        Object raw = record.opt(field + "_raw");
        if (raw == null) {
            raw = record.opt(field);
        }
        return raw == null || JSONObject.NULL.equals(raw) ? null : raw;
    }

    /**
     * Display text of a field with markup stripped; connection fields yield their first identifier.
     */
    static String text(JSONObject record, String field) {
        Object value = record.opt(field);
        if (value == null || JSONObject.NULL.equals(value)) {
            value = record.opt(field + "_raw");
        }
        if (value == null || JSONObject.NULL.equals(value)) {
            return "";
        }
        if (value instanceof JSONArray) {
            JSONArray arr = (JSONArray) value;
            if (arr.length() == 0) {
                return "";
            }
            Object first = arr.opt(0);
            if (first instanceof JSONObject) {
                return ((JSONObject) first).optString("identifier", "").trim();
            }
            return String.valueOf(first).trim();
        }
        String text = String.valueOf(value);
        if (text.contains("<")) {
            text = HTML_TAG.matcher(text).replaceAll("");
        }
        return text.trim();
    }

    static Integer parseInteger(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            return (int) Math.round(((Number) raw).doubleValue());
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return (int) Math.round(Double.parseDouble(text));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private static boolean isBlank(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof JSONArray) {
            return ((JSONArray) raw).isEmpty();
        }
        return String.valueOf(raw).trim().isEmpty();
    }

    private static String nullIfEmpty(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
