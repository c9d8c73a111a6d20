package com.vespasync.sync.db;

import com.vespasync.sync.db.mybatis.MyBatisSupport;
import com.vespasync.sync.db.mybatis.PersonMapper;
import com.vespasync.sync.model.Person;
import com.vespasync.sync.store.RowStore;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persons keyed by normalized email.
 */
public final class PersonDao implements RowStore<Person> {
    private final Database database;

    public PersonDao(Database database) {
        this.database = database;
    }

    @Override
    public String tableName() {
        return "persons";
    }

    public List<Person> listAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(PersonMapper.class).selectAll();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Map<String, Person> findByKeys(Collection<String> naturalKeys) throws SQLException {
        Map<String, Person> out = new LinkedHashMap<>();
        if (naturalKeys == null || naturalKeys.isEmpty()) {
            return out;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (Person row : session.getMapper(PersonMapper.class).selectByEmails(naturalKeys)) {
                out.put(row.naturalKey(), row);
            }
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
        return out;
    }

    @Override
    public void upsert(List<Person> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(PersonMapper.class).upsert(rows);
            conn.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public long count() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(PersonMapper.class).count();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
