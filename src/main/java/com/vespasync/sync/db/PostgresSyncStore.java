package com.vespasync.sync.db;

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
import com.vespasync.sync.store.RowStore;
import com.vespasync.sync.store.SyncStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 模块说明：PostgresSyncStore（class）。
 * 主要职责：把各表 DAO 组合为 {@link SyncStore}，并提供跨进程的同步锁。
 * 维护提示：同步锁是会话级 advisory lock，持有锁的连接在 releaseRunLock 之前保持打开。
 */
public final class PostgresSyncStore implements SyncStore {
    static final long RUN_LOCK_KEY = 0x56455350415359L;

    private final Database database;
    private final InstitutionDao institutions;
    private final PersonDao persons;
    private final PersonAliasDao personAliases;
    private final ScoreRecordDao scoreRecords;
    private final ResponseRecordDao responseRecords;
    private final StaffDao staffAdmins;
    private final StaffDao superUsers;
    private final StatisticsDao statistics;
    private final SyncRunDao runs;
    private Connection lockConnection;

    public PostgresSyncStore(Database database) {
        this.database = database;
        this.institutions = new InstitutionDao(database);
        this.persons = new PersonDao(database);
        this.personAliases = new PersonAliasDao(database);
        this.scoreRecords = new ScoreRecordDao(database);
        this.responseRecords = new ResponseRecordDao(database);
        this.staffAdmins = new StaffDao(database, "staff_admins");
        this.superUsers = new StaffDao(database, "super_users");
        this.statistics = new StatisticsDao(database);
        this.runs = new SyncRunDao(database);
    }

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
    public List<Institution> loadInstitutions() throws SQLException {
        return institutions.listAll();
    }

    @Override
    public List<Person> loadPersons() throws SQLException {
        return persons.listAll();
    }

    @Override
    public Map<String, UUID> loadPersonAliases() throws SQLException {
        return personAliases.loadAll();
    }

    @Override
    public int backfillResponsePeriods() throws SQLException {
        return responseRecords.backfillPeriods();
    }

    @Override
    public List<ScoreObservation> loadScoreObservations() throws SQLException {
        return statistics.loadScoreObservations();
    }

    @Override
    public List<ReadinessAnswer> loadReadinessAnswers(List<String> questionIds) throws SQLException {
        return statistics.loadReadinessAnswers(questionIds);
    }

    @Override
    public void replaceGroupStatistics(StatisticsScope scope, List<GroupStatistic> rows) throws SQLException {
        statistics.replaceGroupStatistics(scope, rows);
    }

    @Override
    public void replaceBenchmarkStatistics(StatisticsScope scope, List<BenchmarkStatistic> rows) throws SQLException {
        statistics.replaceBenchmarkStatistics(scope, rows);
    }

    @Override
    public long startRun(String mode, Instant startedAt) throws SQLException {
        return runs.startRun(mode, startedAt);
    }

    @Override
    public void finishRun(long runId, String status, String summaryJson, String reportPath) throws SQLException {
        runs.finishRun(runId, status, summaryJson, reportPath);
    }

    @Override
    public int recoverDanglingRuns() throws SQLException {
        return runs.recoverDanglingRuns();
    }

    @Override
    public synchronized boolean tryAcquireRunLock() throws SQLException {
        if (lockConnection != null) {
            return true;
        }
        Connection conn = database.connect();
        boolean acquired = false;
        try (PreparedStatement ps = conn.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            ps.setLong(1, RUN_LOCK_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                acquired = rs.next() && rs.getBoolean(1);
            }
        } finally {
            if (acquired) {
                lockConnection = conn;
            } else {
                conn.close();
            }
        }
        return acquired;
    }

    @Override
    public synchronized void releaseRunLock() {
        if (lockConnection == null) {
            return;
        }
        try (Connection conn = lockConnection;
             PreparedStatement ps = conn.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            ps.setLong(1, RUN_LOCK_KEY);
            ps.execute();
        } catch (SQLException e) {
            // closing the session releases the lock as well
            System.err.println("WARN: run lock release failed: " + e.getMessage());
        } finally {
            lockConnection = null;
        }
    }
}
