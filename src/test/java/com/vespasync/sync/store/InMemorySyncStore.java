package com.vespasync.sync.store;

import com.vespasync.sync.model.BenchmarkStatistic;
import com.vespasync.sync.model.GroupStatistic;
import com.vespasync.sync.model.Institution;
import com.vespasync.sync.model.Person;
import com.vespasync.sync.model.PersonAlias;
import com.vespasync.sync.model.ResponseRecord;
import com.vespasync.sync.model.ScoreRecord;
import com.vespasync.sync.model.StaffMember;
import com.vespasync.sync.stats.ReadinessAnswer;
import com.vespasync.sync.stats.ScoreObservation;
import com.vespasync.sync.stats.StatisticsScope;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory {@link SyncStore} mirroring the PostgreSQL store's observable behavior.
 */
public final class InMemorySyncStore implements SyncStore {
    public final InMemoryRowStore<Institution> institutions = new InMemoryRowStore<>("institutions");
    public final InMemoryRowStore<Person> persons = new InMemoryRowStore<>("persons");
    public final InMemoryRowStore<PersonAlias> personAliases = new InMemoryRowStore<>("person_aliases");
    public final InMemoryRowStore<ScoreRecord> scoreRecords = new InMemoryRowStore<>("score_records");
    public final InMemoryRowStore<ResponseRecord> responseRecords = new InMemoryRowStore<>("response_records");
    public final InMemoryRowStore<StaffMember> staffAdmins = new InMemoryRowStore<>("staff_admins");
    public final InMemoryRowStore<StaffMember> superUsers = new InMemoryRowStore<>("super_users");

    public final Map<StatisticsScope, List<GroupStatistic>> groupStatistics = new EnumMap<>(StatisticsScope.class);
    public final Map<StatisticsScope, List<BenchmarkStatistic>> benchmarkStatistics = new EnumMap<>(StatisticsScope.class);
    public final Map<Long, String> runStatuses = new LinkedHashMap<>();
    public final Map<Long, String> runSummaries = new HashMap<>();
    private long nextRunId = 1L;
    private boolean lockHeld;

    @Override
    public RowStore<Institution> institutions() {
        return institutions;
    }

    @Override
    public RowStore<Person> persons() {
        return persons;
    }

    @Override
    public RowStore<PersonAlias> personAliases() {
        return personAliases;
    }

    @Override
    public RowStore<ScoreRecord> scoreRecords() {
        return scoreRecords;
    }

    @Override
    public RowStore<ResponseRecord> responseRecords() {
        return responseRecords;
    }

    @Override
    public RowStore<StaffMember> staffAdmins() {
        return staffAdmins;
    }

    @Override
    public RowStore<StaffMember> superUsers() {
        return superUsers;
    }

    @Override
    public List<Institution> loadInstitutions() {
        return institutions.rows();
    }

    @Override
    public List<Person> loadPersons() {
        return persons.rows();
    }

    @Override
    public Map<String, UUID> loadPersonAliases() {
        Map<String, UUID> out = new LinkedHashMap<>();
        for (PersonAlias alias : personAliases.rows()) {
            out.put(alias.getExternalId(), alias.getPersonId());
        }
        return out;
    }

    @Override
    public int backfillResponsePeriods() {
        Map<String, ScoreRecord> latest = new HashMap<>();
        Comparator<ScoreRecord> byCompletion = Comparator.comparing(
                ScoreRecord::getCompletionDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()));
        for (ScoreRecord score : scoreRecords.rows()) {
            String key = score.getPersonId() + "|" + score.getCycle();
            ScoreRecord current = latest.get(key);
            if (current == null || byCompletion.compare(score, current) >= 0) {
                latest.put(key, score);
            }
        }
        int changed = 0;
        for (ResponseRecord response : responseRecords.rows()) {
            ScoreRecord score = latest.get(response.getPersonId() + "|" + response.getCycle());
            if (score != null && !score.getPeriod().equals(response.getPeriod())) {
                responseRecords.put(response.toBuilder().period(score.getPeriod()).build());
                changed++;
            }
        }
        return changed;
    }

    @Override
    public List<ScoreObservation> loadScoreObservations() {
        List<ScoreObservation> out = new ArrayList<>();
        for (ScoreRecord score : scoreRecords.rows()) {
            UUID institutionId = institutionOf(score.getPersonId());
            List<Integer> values = score.scores();
            for (int i = 0; i < ScoreRecord.DIMENSIONS.size(); i++) {
                if (values.get(i) != null) {
                    out.add(new ScoreObservation(institutionId, score.getCycle(), score.getPeriod(),
                            ScoreRecord.DIMENSIONS.get(i), values.get(i)));
                }
            }
        }
        return out;
    }

    @Override
    public List<ReadinessAnswer> loadReadinessAnswers(List<String> questionIds) {
        List<ReadinessAnswer> out = new ArrayList<>();
        for (ResponseRecord response : responseRecords.rows()) {
            if (!questionIds.isEmpty() && !questionIds.contains(response.getQuestionId())) {
                continue;
            }
            out.add(new ReadinessAnswer(institutionOf(response.getPersonId()), response.getPersonId(),
                    response.getCycle(), response.getPeriod(), response.getQuestionId(), response.getValue()));
        }
        return out;
    }

    @Override
    public void replaceGroupStatistics(StatisticsScope scope, List<GroupStatistic> rows) {
        groupStatistics.put(scope, new ArrayList<>(rows));
    }

    @Override
    public void replaceBenchmarkStatistics(StatisticsScope scope, List<BenchmarkStatistic> rows) {
        benchmarkStatistics.put(scope, new ArrayList<>(rows));
    }

    @Override
    public long startRun(String mode, Instant startedAt) {
        long id = nextRunId++;
        runStatuses.put(id, "RUNNING");
        return id;
    }

    @Override
    public void finishRun(long runId, String status, String summaryJson, String reportPath) {
        runStatuses.put(runId, status);
        runSummaries.put(runId, summaryJson);
    }

    @Override
    public int recoverDanglingRuns() {
        int recovered = 0;
        for (Map.Entry<Long, String> entry : runStatuses.entrySet()) {
            if ("RUNNING".equals(entry.getValue())) {
                entry.setValue("ABORTED");
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public boolean tryAcquireRunLock() throws SQLException {
        if (lockHeld) {
            return false;
        }
        lockHeld = true;
        return true;
    }

    @Override
    public void releaseRunLock() {
        lockHeld = false;
    }

    public List<GroupStatistic> groups(StatisticsScope scope) {
        return groupStatistics.getOrDefault(scope, List.of());
    }

    public List<BenchmarkStatistic> benchmarks(StatisticsScope scope) {
        return benchmarkStatistics.getOrDefault(scope, List.of());
    }

    private UUID institutionOf(UUID personId) {
        for (Person person : persons.rows()) {
            if (person.getId().equals(personId)) {
                return person.getInstitutionId();
            }
        }
        return null;
    }
}
