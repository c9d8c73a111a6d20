package com.vespasync.sync.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * JDBC proxies that log every executed statement with its duration to the {@code SQL} logger.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final int MAX_SQL_CHARS = 600;

    private SqlLogProxy() {
    }

    static Connection wrap(Connection delegate, Logger logger) {
        return proxy(Connection.class, (proxy, method, args) -> {
            Object out = invoke(delegate, method, args);
            if ("prepareStatement".equals(method.getName()) && out instanceof PreparedStatement
                    && args != null && args.length > 0 && args[0] instanceof String) {
                return proxy(PreparedStatement.class, new StatementHandler(out, (String) args[0], logger));
            }
            if ("createStatement".equals(method.getName()) && out instanceof Statement) {
                return proxy(Statement.class, new StatementHandler(out, null, logger));
            }
            return out;
        });
    }

    @SuppressWarnings("unchecked")
    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class[]{type}, handler);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    /**
     * Handles both plain and prepared statements; a prepared statement carries its SQL up front,
     * a plain one receives it as the first execute argument.
     */
    private static final class StatementHandler implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;
        private int batched;

        private StatementHandler(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name)) {
                batched++;
            }
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql != null
                    ? preparedSql
                    : (args != null && args.length > 0 && args[0] instanceof String ? (String) args[0] : "");
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isInfoEnabled()) {
                    logger.info("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsedMs(started), summary(out), compact(sql));
                }
                return out;
            } catch (Throwable t) {
                logger.warn("SQL fail method={} elapsed_ms={} sqlstate={} err={} sql={}",
                        name, elapsedMs(started), sqlState(t), t.getMessage(), compact(sql));
                throw t;
            } finally {
                if (name.endsWith("Batch")) {
                    batched = 0;
                }
            }
        }

        private String summary(Object result) {
            if (result instanceof int[] || result instanceof long[]) {
                return " batched=" + batched;
            }
            if (result instanceof Integer || result instanceof Long) {
                return " rows=" + result;
            }
            return "";
        }
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String sqlState(Throwable t) {
        if (t instanceof java.sql.SQLException) {
            String state = ((java.sql.SQLException) t).getSQLState();
            return state == null ? "-" : state;
        }
        return "-";
    }

    private static String compact(String sql) {
        if (sql == null) {
            return "";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_SQL_CHARS ? oneLine : oneLine.substring(0, MAX_SQL_CHARS) + "...";
    }
}
