package com.vespasync.sync.db.mybatis;

import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Shared MyBatis bootstrap for the sync mappers; sessions run on caller-owned connections.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    /**
     * Recovers the JDBC failure MyBatis wrapped, so callers can still classify it by SQLSTATE.
     */
    public static SQLException toSqlException(PersistenceException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                return (SQLException) t;
            }
        }
        return new SQLException(e.getMessage(), e);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.getTypeHandlerRegistry().register(UUID.class, new UuidTypeHandler());

        config.addMapper(InstitutionMapper.class);
        config.addMapper(PersonMapper.class);
        config.addMapper(PersonAliasMapper.class);
        config.addMapper(SyncRunMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
