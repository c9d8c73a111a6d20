package com.vespasync.sync.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration for the sync target tables.
 */
public final class MigrationRunner {
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema=" + schema
                        + ", schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                System.err.println("ERROR: " + detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                System.out.println("Schema migrated: schema=" + schema + " version " + currentVersion + " -> " + TARGET_VERSION);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS institutions (" +
                "id UUID PRIMARY KEY," +
                "external_id TEXT NOT NULL UNIQUE," +
                "name TEXT NOT NULL," +
                "status TEXT NULL," +
                "uses_calendar_year BOOLEAN NOT NULL DEFAULT FALSE," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS persons (" +
                "id UUID PRIMARY KEY," +
                "email TEXT NOT NULL UNIQUE," +
                "external_id TEXT NULL," +
                "name TEXT NULL," +
                "institution_id UUID NULL REFERENCES institutions(id)," +
                "group_name TEXT NULL," +
                "year_group TEXT NULL," +
                "course TEXT NULL," +
                "faculty TEXT NULL," +
                "current_cycle INTEGER NULL," +
                "current_period TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS person_aliases (" +
                "external_id TEXT PRIMARY KEY," +
                "person_id UUID NOT NULL REFERENCES persons(id)," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS score_records (" +
                "id BIGSERIAL PRIMARY KEY," +
                "person_id UUID NOT NULL REFERENCES persons(id)," +
                "cycle INTEGER NOT NULL CHECK (cycle BETWEEN 1 AND 3)," +
                "period TEXT NOT NULL," +
                "vision INTEGER NULL CHECK (vision BETWEEN 0 AND 10)," +
                "effort INTEGER NULL CHECK (effort BETWEEN 0 AND 10)," +
                "systems INTEGER NULL CHECK (systems BETWEEN 0 AND 10)," +
                "practice INTEGER NULL CHECK (practice BETWEEN 0 AND 10)," +
                "attitude INTEGER NULL CHECK (attitude BETWEEN 0 AND 10)," +
                "overall INTEGER NULL CHECK (overall BETWEEN 0 AND 10)," +
                "completion_date DATE NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (person_id, cycle, period)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS response_records (" +
                "id BIGSERIAL PRIMARY KEY," +
                "person_id UUID NOT NULL REFERENCES persons(id)," +
                "cycle INTEGER NOT NULL CHECK (cycle BETWEEN 1 AND 3)," +
                "question_id TEXT NOT NULL," +
                "value INTEGER NOT NULL CHECK (value BETWEEN 1 AND 5)," +
                "period TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (person_id, cycle, question_id)" +
                ")");

        for (String table : List.of("staff_admins", "super_users")) {
            sqls.add("CREATE TABLE IF NOT EXISTS " + table + " (" +
                    "external_id TEXT PRIMARY KEY," +
                    "email TEXT NOT NULL," +
                    "name TEXT NULL," +
                    "institution_id UUID NULL REFERENCES institutions(id)," +
                    "institution_name TEXT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");
        }

        sqls.add("CREATE TABLE IF NOT EXISTS group_statistics (" +
                "id BIGSERIAL PRIMARY KEY," +
                "institution_id UUID NOT NULL REFERENCES institutions(id)," +
                "cycle INTEGER NOT NULL," +
                "period TEXT NOT NULL," +
                "dimension TEXT NOT NULL," +
                "mean NUMERIC(6,2) NOT NULL," +
                "std_dev NUMERIC(6,2) NOT NULL," +
                "p25 NUMERIC(6,2) NOT NULL," +
                "p50 NUMERIC(6,2) NOT NULL," +
                "p75 NUMERIC(6,2) NOT NULL," +
                "observation_count INTEGER NOT NULL," +
                "histogram INTEGER[] NOT NULL," +
                "computed_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (institution_id, cycle, period, dimension)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS benchmark_statistics (" +
                "id BIGSERIAL PRIMARY KEY," +
                "cycle INTEGER NOT NULL," +
                "period TEXT NOT NULL," +
                "dimension TEXT NOT NULL," +
                "mean NUMERIC(6,2) NOT NULL," +
                "std_dev NUMERIC(6,2) NOT NULL," +
                "p25 NUMERIC(6,2) NOT NULL," +
                "p50 NUMERIC(6,2) NOT NULL," +
                "p75 NUMERIC(6,2) NOT NULL," +
                "observation_count INTEGER NOT NULL," +
                "institution_count INTEGER NOT NULL," +
                "histogram INTEGER[] NOT NULL," +
                "computed_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (cycle, period, dimension)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS sync_runs (" +
                "id BIGSERIAL PRIMARY KEY," +
                "mode TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "status TEXT NOT NULL," +
                "summary_json TEXT NULL," +
                "report_path TEXT NULL," +
                "notes TEXT NULL" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_persons_institution ON persons(institution_id)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_person_aliases_person ON person_aliases(person_id)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_score_records_person_cycle ON score_records(person_id, cycle)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_response_records_person_cycle ON response_records(person_id, cycle)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_response_records_question ON response_records(question_id)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_group_statistics_dimension ON group_statistics(dimension)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_benchmark_statistics_dimension ON benchmark_statistics(dimension)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_sync_runs_started ON sync_runs(started_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    try {
                        return Integer.parseInt(value.trim());
                    } catch (NumberFormatException e) {
                        System.err.println("WARN: unreadable schema_version in metadata: " + value);
                    }
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
