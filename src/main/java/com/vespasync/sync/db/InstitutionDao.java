package com.vespasync.sync.db;

import com.vespasync.sync.db.mybatis.InstitutionMapper;
import com.vespasync.sync.db.mybatis.MyBatisSupport;
import com.vespasync.sync.model.Institution;
import com.vespasync.sync.store.RowStore;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class InstitutionDao implements RowStore<Institution> {
    private final Database database;

    public InstitutionDao(Database database) {
        this.database = database;
    }

    @Override
    public String tableName() {
        return "institutions";
    }

    public List<Institution> listAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(InstitutionMapper.class).selectAll();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Map<String, Institution> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, Institution> out = new LinkedHashMap<>();
        if (naturalKeys == null || naturalKeys.isEmpty()) {
            return out;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (Institution row : session.getMapper(InstitutionMapper.class).selectByExternalIds(naturalKeys)) {
                out.put(row.naturalKey(), row);
            }
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
        return out;
    }

    @Override
    public void upsert(List<Institution> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(InstitutionMapper.class).upsert(rows);
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(InstitutionMapper.class).count();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
