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
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The relational analytics store the sync writes into.
 */
public interface SyncStore {
    RowStore<Institution> institutions();

    RowStore<Person> persons();

    RowStore<PersonAlias> personAliases();

    RowStore<ScoreRecord> scoreRecords();

    RowStore<ResponseRecord> responseRecords();

    RowStore<StaffMember> staffAdmins();

    RowStore<StaffMember> superUsers();

    List<Institution> loadInstitutions() throws SQLException;

    List<Person> loadPersons() throws SQLException;

    /**
     * External id to internal person id for every alias ever bound.
     */
    Map<String, UUID> loadPersonAliases() throws SQLException;

    /**
     * Copies each person's score-record period onto their response records of the same cycle.
     *
     * @return number of response rows changed
     */
    int backfillResponsePeriods() throws SQLException;

    List<ScoreObservation> loadScoreObservations() throws SQLException;

    List<ReadinessAnswer> loadReadinessAnswers(List<String> questionIds) throws SQLException;

    /**
     * Deletes every group statistic of {@code scope} and inserts {@code rows} in one transaction.
     */
    void replaceGroupStatistics(StatisticsScope scope, List<GroupStatistic> rows) throws SQLException;

    void replaceBenchmarkStatistics(StatisticsScope scope, List<BenchmarkStatistic> rows) throws SQLException;

    long startRun(String mode, Instant startedAt) throws SQLException;

    void finishRun(long runId, String status, String summaryJson, String reportPath) throws SQLException;

    /**
     * Marks runs left in RUNNING state by a crashed process as ABORTED.
     */
    int recoverDanglingRuns() throws SQLException;

    /**
     * Takes the cross-process sync lock; returns false when another run holds it.
     */
    boolean tryAcquireRunLock() throws SQLException;

    void releaseRunLock();
}
