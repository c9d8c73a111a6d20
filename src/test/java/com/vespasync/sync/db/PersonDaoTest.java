package com.vespasync.sync.db;

import com.vespasync.core.FatalSyncException;
import com.vespasync.core.SyncReporter;
import com.vespasync.sync.model.Person;
import com.vespasync.sync.writer.BatchUpsertWriter;
import com.vespasync.sync.writer.SyncTable;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PersonDaoTest {

    @Test
    void upsert_shouldSurfaceConstraintViolationAsSqlException() {
        PersonDao dao = daoFailing(sql -> sql.startsWith("INSERT")
                ? new SQLException("duplicate key value violates unique constraint", "23505")
                : null);

        SQLException e = assertThrows(SQLException.class, () -> dao.upsert(List.of(person("a@x.org"))));

        assertEquals("23505", e.getSQLState());
    }

    @Test
    void flushAll_shouldCountRejectedRowWhenMapperInsertViolatesConstraint() {
        SyncReporter reporter = new SyncReporter("FULL", Instant.parse("2025-03-10T09:00:00Z"));
        BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
        SyncTable<Person> persons = SyncTable.of(daoFailing(sql -> sql.startsWith("INSERT")
                ? new SQLException("duplicate key value violates unique constraint", "23505")
                : null), 10);
        writer.register(persons);

        writer.stage(persons, person("a@x.org"));
        writer.flushAll();

        SyncReporter.TableCounters counters = reporter.table("persons");
        assertEquals(1, counters.rejected());
        assertEquals(0, counters.created());
        assertEquals(1, reporter.warningCount("constraint_violation"));
    }

    @Test
    void flushAll_shouldCountErrorsWhenMapperLookupFails() {
        SyncReporter reporter = new SyncReporter("FULL", Instant.parse("2025-03-10T09:00:00Z"));
        BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
        SyncTable<Person> persons = SyncTable.of(daoFailing(sql -> sql.startsWith("SELECT")
                ? new SQLException("relation \"persons\" does not exist", "42P01")
                : null), 10);
        writer.register(persons);

        writer.stage(persons, person("a@x.org"));
        writer.stage(persons, person("b@x.org"));
        writer.flushAll();

        assertEquals(2, reporter.table("persons").errors());
    }

    @Test
    void flushAll_shouldEscalateConnectionFailureFromMapper() {
        SyncReporter reporter = new SyncReporter("FULL", Instant.parse("2025-03-10T09:00:00Z"));
        BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
        SyncTable<Person> persons = SyncTable.of(daoFailing(sql -> sql.startsWith("INSERT")
                ? new SQLException("connection lost", "08006")
                : null), 10);
        writer.register(persons);
        writer.stage(persons, person("a@x.org"));

        assertThrows(FatalSyncException.class, writer::flushAll);
    }

    private static PersonDao daoFailing(Function<String, SQLException> failureForSql) {
        return new PersonDao(new Database(StubJdbc.dataSource(sql -> failureForSql.apply(sql.trim())), "vespa"));
    }

    private static Person person(String email) {
        return Person.builder()
                .id(UUID.nameUUIDFromBytes(email.getBytes()))
                .email(email)
                .externalId("ext-" + email)
                .name("Test Person")
                .currentCycle(1)
                .build();
    }
}
