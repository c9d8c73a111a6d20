package com.vespasync.sync.db;

import com.vespasync.sync.model.ResponseRecord;
import com.vespasync.sync.store.RowStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class ResponseRecordDao implements RowStore<ResponseRecord> {
    private final Database database;

    public ResponseRecordDao(Database database) {
        this.database = database;
    }

    @Override
    public String tableName() {
        return "response_records";
    }

    @Override
    public Map<String, ResponseRecord> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, ResponseRecord> out = new LinkedHashMap<>();
        if (naturalKeys == null || naturalKeys.isEmpty()) {
            return out;
        }
        Set<String> wanted = new HashSet<>(naturalKeys);
        Set<UUID> personIds = new LinkedHashSet<>();
        for (String key : naturalKeys) {
            UUID id = JdbcValues.personIdOf(key);
            if (id != null) {
                personIds.add(id);
            }
        }
        if (personIds.isEmpty()) {
            return out;
        }
        String sql = "SELECT person_id, cycle, question_id, value, period FROM response_records WHERE person_id = ANY(?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, conn.createArrayOf("uuid", personIds.toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ResponseRecord row = ResponseRecord.builder()
                            .personId(JdbcValues.getUuid(rs, "person_id"))
                            .cycle(rs.getInt("cycle"))
                            .questionId(rs.getString("question_id"))
                            .value(JdbcValues.getInt(rs, "value"))
                            .period(rs.getString("period"))
                            .build();
                    if (wanted.contains(row.naturalKey())) {
                        out.put(row.naturalKey(), row);
                    }
                }
            }
        }
        return out;
    }

    /**
     * A null incoming period keeps the stored one; periods are filled by the backfill step.
     */
    @Override
    public void upsert(List<ResponseRecord> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO response_records(person_id, cycle, question_id, value, period, updated_at) " +
                "VALUES(?, ?, ?, ?, ?, now()) " +
                "ON CONFLICT(person_id, cycle, question_id) DO UPDATE SET value=excluded.value, " +
                "period=COALESCE(excluded.period, response_records.period), updated_at=excluded.updated_at";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            conn.setAutoCommit(false);
            for (ResponseRecord row : rows) {
                JdbcValues.setUuid(ps, 1, row.getPersonId());
                ps.setInt(2, row.getCycle());
                ps.setString(3, row.getQuestionId());
                JdbcValues.setInt(ps, 4, row.getValue());
                ps.setString(5, row.getPeriod());
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        }
    }

    /**
     * Copies the period of each person's latest score record onto their responses of the same cycle.
     */
    public int backfillPeriods() throws SQLException {
        String sql = "UPDATE response_records r SET period=s.period, updated_at=now() " +
                "FROM (SELECT DISTINCT ON (person_id, cycle) person_id, cycle, period FROM score_records " +
                "ORDER BY person_id, cycle, completion_date DESC NULLS LAST, id DESC) s " +
                "WHERE r.person_id=s.person_id AND r.cycle=s.cycle AND r.period IS DISTINCT FROM s.period";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            return ps.executeUpdate();
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM response_records");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
