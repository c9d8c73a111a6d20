package com.vespasync.sync.db;

import com.vespasync.sync.db.mybatis.MyBatisSupport;
import com.vespasync.sync.db.mybatis.PersonAliasMapper;
import com.vespasync.sync.model.PersonAlias;
import com.vespasync.sync.store.RowStore;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class PersonAliasDao implements RowStore<PersonAlias> {
    private final Database database;

    public PersonAliasDao(Database database) {
        this.database = database;
    }

    @Override
    public String tableName() {
        return "person_aliases";
    }

    public Map<String, UUID> loadAll() throws SQLException {
        Map<String, UUID> out = new LinkedHashMap<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (PersonAlias alias : session.getMapper(PersonAliasMapper.class).selectAll()) {
                out.put(alias.getExternalId(), alias.getPersonId());
            }
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
        return out;
    }

    @Override
    public Map<String, PersonAlias> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, PersonAlias> out = new LinkedHashMap<>();
        if (naturalKeys == null || naturalKeys.isEmpty()) {
            return out;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (PersonAlias row : session.getMapper(PersonAliasMapper.class).selectByExternalIds(naturalKeys)) {
                out.put(row.naturalKey(), row);
            }
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
        return out;
    }

    @Override
    public void upsert(List<PersonAlias> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(PersonAliasMapper.class).upsert(rows);
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(PersonAliasMapper.class).count();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
