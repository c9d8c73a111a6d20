package com.vespasync.sync.db;

import com.vespasync.sync.model.StaffMember;
import com.vespasync.sync.store.RowStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staff role tables share one shape; the table name is restricted to the known role tables.
 */
public final class StaffDao implements RowStore<StaffMember> {
    private static final Set<String> TABLES = Set.of("staff_admins", "super_users");

    private final Database database;
    private final String table;

    public StaffDao(Database database, String table) {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("unknown staff table: " + table);
        }
        this.database = database;
        this.table = table;
    }

    @Override
    public String tableName() {
        return table;
    }

    @Override
    public Map<String, StaffMember> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, StaffMember> out = new LinkedHashMap<>();
        if (naturalKeys == null || naturalKeys.isEmpty()) {
            return out;
        }
        String sql = "SELECT external_id, email, name, institution_id, institution_name FROM " + table +
                " WHERE external_id = ANY(?)";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, conn.createArrayOf("text", naturalKeys.toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    StaffMember row = StaffMember.builder()
                            .externalId(rs.getString("external_id"))
                            .email(rs.getString("email"))
                            .name(rs.getString("name"))
                            .institutionId(JdbcValues.getUuid(rs, "institution_id"))
                            .institutionName(rs.getString("institution_name"))
                            .build();
                    out.put(row.naturalKey(), row);
                }
            }
        }
        return out;
    }

    @Override
    public void upsert(List<StaffMember> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO " + table + "(external_id, email, name, institution_id, institution_name, updated_at) " +
                "VALUES(?, ?, ?, ?, ?, now()) " +
                "ON CONFLICT(external_id) DO UPDATE SET email=excluded.email, name=excluded.name, " +
                "institution_id=excluded.institution_id, institution_name=excluded.institution_name, " +
                "updated_at=excluded.updated_at";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            conn.setAutoCommit(false);
            for (StaffMember row : rows) {
                ps.setString(1, row.getExternalId());
                ps.setString(2, row.getEmail());
                ps.setString(3, row.getName());
                JdbcValues.setUuid(ps, 4, row.getInstitutionId());
                ps.setString(5, row.getInstitutionName());
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM " + table);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
