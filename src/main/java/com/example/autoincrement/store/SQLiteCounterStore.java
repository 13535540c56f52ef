package com.example.autoincrement.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

public final class SQLiteCounterStore implements CounterStore {
    private static final Logger log = LoggerFactory.getLogger(SQLiteCounterStore.class);
    private static final int MAX_BUSY_RETRIES = 5;
    private static final Duration BUSY_BACKOFF = Duration.ofMillis(200);

    // SQLite turns an overflowing integer into a REAL, so the increment is refused instead
    private static final String UPSERT_INCREMENT =
            "INSERT INTO identity_counters (model, field, count, updated_at) VALUES (?, ?, ?, ?) " +
                    "ON CONFLICT(model, field) DO UPDATE SET count = count + ?, updated_at = excluded.updated_at " +
                    "WHERE typeof(count + ?) = 'integer'";
    private static final String UPSERT_SET =
            "INSERT INTO identity_counters (model, field, count, updated_at) VALUES (?, ?, ?, ?) " +
                    "ON CONFLICT(model, field) DO UPDATE SET count = excluded.count, updated_at = excluded.updated_at";
    private static final String UPSERT_ADVANCE_ASC = UPSERT_SET + " WHERE count < excluded.count";
    private static final String UPSERT_ADVANCE_DESC = UPSERT_SET + " WHERE count > excluded.count";

    private final String jdbcUrl;
    private final Duration busyTimeout;

    public SQLiteCounterStore(String jdbcUrl, Duration busyTimeout) {
        this.jdbcUrl = jdbcUrl;
        this.busyTimeout = busyTimeout;
        init();
    }

    private void init() {
        withRetry(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute(
                        "CREATE TABLE IF NOT EXISTS identity_counters (" +
                                "model TEXT NOT NULL," +
                                "field TEXT NOT NULL," +
                                "count INTEGER NOT NULL," +
                                "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP," +
                                "PRIMARY KEY (model, field))");
            }
            return null;
        });
    }

    @Override
    public long incrementAndGet(CounterKey key, long incrementBy, long startAt) {
        long value = withTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_INCREMENT)) {
                ps.setString(1, key.getModel());
                ps.setString(2, key.getField());
                ps.setLong(3, startAt);
                ps.setTimestamp(4, Timestamp.from(Instant.now()));
                ps.setLong(5, incrementBy);
                ps.setLong(6, incrementBy);
                if (ps.executeUpdate() == 0) {
                    long current = select(key, conn).map(CounterRecord::getCount).orElse(startAt);
                    throw new CounterOverflowException(key, current, incrementBy);
                }
            }
            return select(key, conn)
                    .orElseThrow(() -> new SQLException("Counter row missing after upsert: " + key.id()))
                    .getCount();
        });
        log.debug("Allocated {} from counter {}", value, key.id());
        return value;
    }

    @Override
    public long peek(CounterKey key, long startAt, long incrementBy) {
        return find(key)
                .map(record -> step(key, record.getCount(), incrementBy))
                .orElse(startAt);
    }

    @Override
    public long reset(CounterKey key, long startAt, long incrementBy) {
        long beforeStart;
        try {
            beforeStart = Math.subtractExact(startAt, incrementBy);
        } catch (ArithmeticException e) {
            throw new CounterOverflowException(key, startAt, incrementBy);
        }
        withRetry(conn -> set(key, beforeStart, UPSERT_SET, conn));
        log.info("Reset counter {}, next value is {}", key.id(), startAt);
        return startAt;
    }

    @Override
    public boolean advanceTo(CounterKey key, long observed, boolean ascending) {
        int changed = withRetry(conn -> set(key, observed, ascending ? UPSERT_ADVANCE_ASC : UPSERT_ADVANCE_DESC, conn));
        if (changed > 0) {
            log.debug("Advanced counter {} to {}", key.id(), observed);
        }
        return changed > 0;
    }

    @Override
    public Optional<CounterRecord> find(CounterKey key) {
        return withRetry(conn -> select(key, conn));
    }

    private static long step(CounterKey key, long count, long incrementBy) {
        try {
            return Math.addExact(count, incrementBy);
        } catch (ArithmeticException e) {
            throw new CounterOverflowException(key, count, incrementBy);
        }
    }

    <T> T withTransaction(SqlFunction<Connection, T> work) {
        return withRetry(conn -> {
            try {
                conn.setAutoCommit(false);
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (RuntimeException | SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException re) {
                    log.error("Rollback failed", re);
                }
                throw e;
            }
        });
    }

    private CounterRecord mapRow(ResultSet rs) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new CounterRecord(
                rs.getString("model"),
                rs.getString("field"),
                rs.getLong("count"),
                updatedAt == null ? null : updatedAt.toInstant());
    }

    private Optional<CounterRecord> select(CounterKey key, Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT model, field, count, updated_at FROM identity_counters WHERE model=? AND field=?")) {
            ps.setString(1, key.getModel());
            ps.setString(2, key.getField());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        }
    }

    private int set(CounterKey key, long count, String sql, Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.getModel());
            ps.setString(2, key.getField());
            ps.setLong(3, count);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            return ps.executeUpdate();
        }
    }

    private <T> T withRetry(SqlFunction<Connection, T> work) {
        int attempt = 0;
        while (true) {
            try (Connection conn = DriverManager.getConnection(jdbcUrl)) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA busy_timeout=" + busyTimeout.toMillis());
                }
                return work.apply(conn);
            } catch (SQLException e) {
                if (isBusy(e)) {
                    if (attempt >= MAX_BUSY_RETRIES) {
                        throw new StoreUnavailableException("SQLite busy after retries: " + jdbcUrl, e);
                    }
                    attempt++;
                    log.warn("SQLite busy, retry {} of {}", attempt, MAX_BUSY_RETRIES);
                    try {
                        Thread.sleep(BUSY_BACKOFF.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new StoreUnavailableException("Interrupted during backoff", ie);
                    }
                    continue;
                }
                throw new StoreUnavailableException("SQLite operation failed: " + jdbcUrl, e);
            }
        }
    }

    private boolean isBusy(SQLException e) {
        return e.getErrorCode() == SQLiteErrorCode.SQLITE_BUSY.code
                || "SQLITE_BUSY".equals(e.getSQLState())
                || (e.getMessage() != null && e.getMessage().contains("database is locked"));
    }

    @FunctionalInterface
    interface SqlFunction<T, R> {
        R apply(T t) throws SQLException;
    }
}
