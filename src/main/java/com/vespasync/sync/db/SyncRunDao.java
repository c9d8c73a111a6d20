package com.vespasync.sync.db;

import com.vespasync.sync.db.mybatis.MyBatisSupport;
import com.vespasync.sync.db.mybatis.SyncRunFinishParam;
import com.vespasync.sync.db.mybatis.SyncRunInsertParam;
import com.vespasync.sync.db.mybatis.SyncRunMapper;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Run history rows in {@code sync_runs}.
 */
public final class SyncRunDao {
    private final Database database;

    public SyncRunDao(Database database) {
        this.database = database;
    }

    public int recoverDanglingRuns() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int n = session.getMapper(SyncRunMapper.class).recoverDanglingRuns(OffsetDateTime.now(ZoneOffset.UTC));
            conn.commit();
            return n;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    public long startRun(String mode, Instant startedAt) throws SQLException {
        SyncRunInsertParam row = SyncRunInsertParam.builder()
                .mode(mode)
                .startedAt(OffsetDateTime.ofInstant(startedAt, ZoneOffset.UTC))
                .status("RUNNING")
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(SyncRunMapper.class).insertRun(row);
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
        if (row.getId() == null) {
            throw new SQLException("failed to create sync run");
        }
        return row.getId();
    }

    public void finishRun(long runId, String status, String summaryJson, String reportPath) throws SQLException {
        SyncRunFinishParam row = SyncRunFinishParam.builder()
                .finishedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .status(status)
                .summaryJson(summaryJson)
                .reportPath(reportPath)
                .runId(runId)
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(SyncRunMapper.class).updateRunFinish(row);
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
