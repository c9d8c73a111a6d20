package com.vespasync.sync.db;

import com.vespasync.sync.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;

/**
 * PostgreSQL connection factory for the analytics schema.
 */
public final class Database {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final String DEFAULT_SCHEMA = "vespa";

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        if (!this.jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;

        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(this.jdbcUrl);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(this.schema);
        pg.setApplicationName("vespa-sync");
        this.dataSource = pg;
    }

    Database(DataSource dataSource, String schema) {
        this.dataSource = dataSource;
        this.jdbcUrl = "jdbc:postgresql://datasource";
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = false;
    }

    /**
     * Connection settings from the process environment first, then config.
     */
    public static Database fromConfig(Config config, Map<String, String> env) {
        return new Database(
                firstNonBlank(env.get("VESPASYNC_DB_URL"), config.getString("db.url")),
                firstNonBlank(env.get("VESPASYNC_DB_USER"), config.getString("db.user")),
                firstNonBlank(env.get("VESPASYNC_DB_PASS"), config.getString("db.pass")),
                firstNonBlank(env.get("VESPASYNC_DB_SCHEMA"), config.getString("db.schema")),
                config.getBoolean("db.sql_log.enabled", true)
        );
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            }
            return sqlLogEnabled ? SqlLogProxy.wrap(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", sqlstate=" + safe(e.getSQLState())
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            System.err.println("ERROR: " + details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    static String classifyConnectFailure(SQLException e) {
        String state = e == null ? null : e.getSQLState();
        if (state != null && state.startsWith("28")) {
            return "authentication";
        }
        if (state != null && state.startsWith("08")) {
            return "unreachable";
        }
        if ("3D000".equals(state)) {
            return "missing_database";
        }
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied")) {
            return "permission";
        }
        return "connection_error";
    }

    private static String normalizeSchema(String raw) {
        String value = isBlank(raw) ? DEFAULT_SCHEMA : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (!isBlank(v)) {
                return v.trim();
            }
        }
        return "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
