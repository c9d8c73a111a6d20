package com.vespasync.sync.db;

import com.vespasync.sync.model.ScoreRecord;
import com.vespasync.sync.store.RowStore;

import java.sql.Array;
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

public final class ScoreRecordDao implements RowStore<ScoreRecord> {
    private static final String COLUMNS = "person_id, cycle, period, vision, effort, systems, practice, attitude, overall, completion_date";

    private final Database database;

    public ScoreRecordDao(Database database) {
        this.database = database;
    }

    @Override
    public String tableName() {
        return "score_records";
    }

    @Override
    public Map<String, ScoreRecord> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, ScoreRecord> out = new LinkedHashMap<>();
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
        String sql = "SELECT " + COLUMNS + " FROM score_records WHERE person_id = ANY(?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            Array ids = conn.createArrayOf("uuid", personIds.toArray());
            ps.setArray(1, ids);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ScoreRecord row = ScoreRecord.builder()
                            .personId(JdbcValues.getUuid(rs, "person_id"))
                            .cycle(rs.getInt("cycle"))
                            .period(rs.getString("period"))
                            .vision(JdbcValues.getInt(rs, "vision"))
                            .effort(JdbcValues.getInt(rs, "effort"))
                            .systems(JdbcValues.getInt(rs, "systems"))
                            .practice(JdbcValues.getInt(rs, "practice"))
                            .attitude(JdbcValues.getInt(rs, "attitude"))
                            .overall(JdbcValues.getInt(rs, "overall"))
                            .completionDate(JdbcValues.getDate(rs, "completion_date"))
                            .build();
                    if (wanted.contains(row.naturalKey())) {
                        out.put(row.naturalKey(), row);
                    }
                }
            }
        }
        return out;
    }

    @Override
    public void upsert(List<ScoreRecord> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO score_records(" + COLUMNS + ", updated_at) VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now()) " +
                "ON CONFLICT(person_id, cycle, period) DO UPDATE SET " +
                "vision=excluded.vision, effort=excluded.effort, systems=excluded.systems, practice=excluded.practice, " +
                "attitude=excluded.attitude, overall=excluded.overall, completion_date=excluded.completion_date, " +
                "updated_at=excluded.updated_at";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            conn.setAutoCommit(false);
            for (ScoreRecord row : rows) {
                JdbcValues.setUuid(ps, 1, row.getPersonId());
                ps.setInt(2, row.getCycle());
                ps.setString(3, row.getPeriod());
                JdbcValues.setInt(ps, 4, row.getVision());
                JdbcValues.setInt(ps, 5, row.getEffort());
                JdbcValues.setInt(ps, 6, row.getSystems());
                JdbcValues.setInt(ps, 7, row.getPractice());
                JdbcValues.setInt(ps, 8, row.getAttitude());
                JdbcValues.setInt(ps, 9, row.getOverall());
                JdbcValues.setDate(ps, 10, row.getCompletionDate());
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM score_records");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
