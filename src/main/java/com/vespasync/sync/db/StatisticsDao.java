package com.vespasync.sync.db;

import com.vespasync.sync.model.BenchmarkStatistic;
import com.vespasync.sync.model.GroupStatistic;
import com.vespasync.sync.model.ScoreRecord;
import com.vespasync.sync.stats.ReadinessAnswer;
import com.vespasync.sync.stats.ScoreObservation;
import com.vespasync.sync.stats.StatisticsAggregator;
import com.vespasync.sync.stats.StatisticsScope;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads aggregation inputs and replaces derived statistics rows.
 */
public final class StatisticsDao {
    private final Database database;

    public StatisticsDao(Database database) {
        this.database = database;
    }

    public List<ScoreObservation> loadScoreObservations() throws SQLException {
        String sql = "SELECT p.institution_id, s.cycle, s.period, s.vision, s.effort, s.systems, s.practice, s.attitude, s.overall " +
                "FROM score_records s JOIN persons p ON p.id = s.person_id WHERE p.institution_id IS NOT NULL";
        List<ScoreObservation> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                UUID institution = JdbcValues.getUuid(rs, "institution_id");
                int cycle = rs.getInt("cycle");
                String period = rs.getString("period");
                for (String dimension : ScoreRecord.DIMENSIONS) {
                    Integer value = JdbcValues.getInt(rs, dimension);
                    if (value != null) {
                        out.add(new ScoreObservation(institution, cycle, period, dimension, value));
                    }
                }
            }
        }
        return out;
    }

    public List<ReadinessAnswer> loadReadinessAnswers(List<String> questionIds) throws SQLException {
        List<ReadinessAnswer> out = new ArrayList<>();
        if (questionIds == null || questionIds.isEmpty()) {
            return out;
        }
        String sql = "SELECT p.institution_id, r.person_id, r.cycle, r.period, r.question_id, r.value " +
                "FROM response_records r JOIN persons p ON p.id = r.person_id " +
                "WHERE p.institution_id IS NOT NULL AND r.question_id = ANY(?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, conn.createArrayOf("text", questionIds.toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ReadinessAnswer(
                            JdbcValues.getUuid(rs, "institution_id"),
                            JdbcValues.getUuid(rs, "person_id"),
                            rs.getInt("cycle"),
                            rs.getString("period"),
                            rs.getString("question_id"),
                            rs.getInt("value")
                    ));
                }
            }
        }
        return out;
    }

    public void replaceGroupStatistics(StatisticsScope scope, List<GroupStatistic> rows) throws SQLException {
        String delete = "DELETE FROM group_statistics WHERE " + scopePredicate(scope);
        String insert = "INSERT INTO group_statistics(institution_id, cycle, period, dimension, mean, std_dev, p25, p50, p75, " +
                "observation_count, histogram, computed_at) VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now())";
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement del = conn.prepareStatement(delete);
                 PreparedStatement ins = conn.prepareStatement(insert)) {
                del.setString(1, StatisticsAggregator.READINESS_DIMENSION);
                del.executeUpdate();
                for (GroupStatistic row : rows) {
                    JdbcValues.setUuid(ins, 1, row.getInstitutionId());
                    ins.setInt(2, row.getCycle());
                    ins.setString(3, row.getPeriod());
                    ins.setString(4, row.getDimension());
                    ins.setDouble(5, row.getMean());
                    ins.setDouble(6, row.getStdDev());
                    ins.setDouble(7, row.getP25());
                    ins.setDouble(8, row.getP50());
                    ins.setDouble(9, row.getP75());
                    ins.setInt(10, row.getCount());
                    ins.setArray(11, conn.createArrayOf("integer", boxed(row.getHistogram())));
                    ins.addBatch();
                }
                if (!rows.isEmpty()) {
                    ins.executeBatch();
                }
            }
            conn.commit();
        }
    }

    public void replaceBenchmarkStatistics(StatisticsScope scope, List<BenchmarkStatistic> rows) throws SQLException {
        String delete = "DELETE FROM benchmark_statistics WHERE " + scopePredicate(scope);
        String insert = "INSERT INTO benchmark_statistics(cycle, period, dimension, mean, std_dev, p25, p50, p75, " +
                "observation_count, institution_count, histogram, computed_at) VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now())";
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement del = conn.prepareStatement(delete);
                 PreparedStatement ins = conn.prepareStatement(insert)) {
                del.setString(1, StatisticsAggregator.READINESS_DIMENSION);
                del.executeUpdate();
                for (BenchmarkStatistic row : rows) {
                    ins.setInt(1, row.getCycle());
                    ins.setString(2, row.getPeriod());
                    ins.setString(3, row.getDimension());
                    ins.setDouble(4, row.getMean());
                    ins.setDouble(5, row.getStdDev());
                    ins.setDouble(6, row.getP25());
                    ins.setDouble(7, row.getP50());
                    ins.setDouble(8, row.getP75());
                    ins.setInt(9, row.getCount());
                    ins.setInt(10, row.getInstitutionCount());
                    ins.setArray(11, conn.createArrayOf("integer", boxed(row.getHistogram())));
                    ins.addBatch();
                }
                if (!rows.isEmpty()) {
                    ins.executeBatch();
                }
            }
            conn.commit();
        }
    }

    private static String scopePredicate(StatisticsScope scope) {
        return scope == StatisticsScope.READINESS ? "dimension = ?" : "dimension <> ?";
    }

    private static Integer[] boxed(int[] values) {
        if (values == null) {
            return new Integer[0];
        }
        Integer[] out = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }
}
