package com.lodestar.core.persistence;

import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.state.IterationFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link StateStore} for PostgreSQL or H2.
 * <p>
 * The session-scoped facts of each session live in one JSON row of
 * {@code lodestar_state}, the persistent facts of each agent in one row of
 * {@code lodestar_persistent}; every iteration appends a row to
 * {@code lodestar_history}. A save updates both fact rows and inserts the
 * history row in a single transaction. The tables are created automatically
 * via {@link #createTables()}.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private static final String STATE_TABLE = "lodestar_state";
    private static final String HISTORY_TABLE = "lodestar_history";
    private static final String PERSISTENT_TABLE = "lodestar_persistent";

    private static final String CREATE_STATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                agent_id    VARCHAR(255) NOT NULL,
                session_id  VARCHAR(255) NOT NULL,
                facts       TEXT NOT NULL,
                updated_at  TIMESTAMP WITH TIME ZONE NOT NULL,
                PRIMARY KEY (agent_id, session_id)
            )
            """.formatted(STATE_TABLE);

    private static final String CREATE_HISTORY_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                agent_id    VARCHAR(255) NOT NULL,
                session_id  VARCHAR(255) NOT NULL,
                iteration   INTEGER NOT NULL,
                phase       VARCHAR(255) NOT NULL,
                recorded_at TIMESTAMP WITH TIME ZONE NOT NULL,
                by_action   TEXT NOT NULL,
                PRIMARY KEY (agent_id, session_id, iteration)
            )
            """.formatted(HISTORY_TABLE);

    private static final String CREATE_PERSISTENT_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                agent_id    VARCHAR(255) NOT NULL PRIMARY KEY,
                facts       TEXT NOT NULL,
                updated_at  TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """.formatted(PERSISTENT_TABLE);

    private static final String SELECT_PERSISTENT_SQL = """
            SELECT facts FROM %s WHERE agent_id = ?
            """.formatted(PERSISTENT_TABLE);

    private static final String INSERT_PERSISTENT_SQL = """
            INSERT INTO %s (facts, updated_at, agent_id) VALUES (?, ?, ?)
            """.formatted(PERSISTENT_TABLE);

    private static final String UPDATE_PERSISTENT_SQL = """
            UPDATE %s SET facts = ?, updated_at = ? WHERE agent_id = ?
            """.formatted(PERSISTENT_TABLE);

    private static final String DELETE_PERSISTENT_SQL = """
            DELETE FROM %s WHERE agent_id = ?
            """.formatted(PERSISTENT_TABLE);

    private static final String SELECT_STATE_SQL = """
            SELECT facts FROM %s WHERE agent_id = ? AND session_id = ?
            """.formatted(STATE_TABLE);

    private static final String INSERT_STATE_SQL = """
            INSERT INTO %s (facts, updated_at, agent_id, session_id)
            VALUES (?, ?, ?, ?)
            """.formatted(STATE_TABLE);

    private static final String UPDATE_STATE_SQL = """
            UPDATE %s SET facts = ?, updated_at = ?
            WHERE agent_id = ? AND session_id = ?
            """.formatted(STATE_TABLE);

    private static final String SELECT_LATEST_ITERATION_SQL = """
            SELECT MAX(iteration) FROM %s WHERE agent_id = ? AND session_id = ?
            """.formatted(HISTORY_TABLE);

    private static final String INSERT_HISTORY_SQL = """
            INSERT INTO %s (agent_id, session_id, iteration, phase, recorded_at, by_action)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(HISTORY_TABLE);

    private static final String SELECT_HISTORY_SQL = """
            SELECT iteration, phase, recorded_at, by_action
            FROM %s
            WHERE agent_id = ? AND session_id = ?
            ORDER BY iteration ASC
            """.formatted(HISTORY_TABLE);

    private static final String SELECT_SESSIONS_SQL = """
            SELECT session_id FROM %s WHERE agent_id = ? ORDER BY session_id
            """.formatted(STATE_TABLE);

    private final DataSource dataSource;
    private final FactCodec codec;

    public JdbcStateStore(DataSource dataSource) {
        this(dataSource, new FactCodec());
    }

    public JdbcStateStore(DataSource dataSource, FactCodec codec) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.codec = codec;
    }

    /**
     * Creates the state, persistent and history tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_STATE_TABLE_SQL, CREATE_PERSISTENT_TABLE_SQL, CREATE_HISTORY_TABLE_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("State tables '{}', '{}' and '{}' ensured", STATE_TABLE, PERSISTENT_TABLE, HISTORY_TABLE);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to create state tables", e);
        }
    }

    @Override
    public boolean bootstrap(SessionKey key, Facts seed) {
        Facts durable = StateStore.requireDurable(seed);
        return inTransaction(key, "bootstrap", conn -> {
            if (selectFacts(conn, key).isPresent()) {
                return false;
            }
            Facts seeded = durable.withScope(Scope.PERSISTENT);
            if (!seeded.isEmpty()) {
                writePersistent(conn, key.agentId(), seeded.merge(selectPersistent(conn, key.agentId())));
            }
            writeState(conn, INSERT_STATE_SQL, key, StateStore.sessionPart(durable));
            log.debug("Bootstrapped session {} with {} seed facts", key, durable.size());
            return true;
        });
    }

    @Override
    public boolean exists(SessionKey key) {
        try (Connection conn = dataSource.getConnection()) {
            return selectFacts(conn, key).isPresent();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to look up session " + key, e);
        }
    }

    @Override
    public Facts load(SessionKey key) {
        try (Connection conn = dataSource.getConnection()) {
            Facts session = selectFacts(conn, key).map(codec::readFacts).orElse(Facts.empty());
            return StateStore.overlay(selectPersistent(conn, key.agentId()), session);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load state of " + key, e);
        }
    }

    @Override
    public Facts loadPersistent(String agentId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectPersistent(conn, agentId);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load persistent facts of agent '" + agentId + "'", e);
        }
    }

    @Override
    public void save(SessionKey key, IterationFacts record, Facts durable) {
        StateStore.requireDurable(durable);
        inTransaction(key, "save", conn -> {
            int latest = latestIteration(conn, key);
            if (record.iteration() <= latest) {
                throw new StateStoreException("History of " + key + " is append-only: iteration "
                        + record.iteration() + " does not follow " + latest);
            }
            Facts session = StateStore.sessionPart(durable);
            if (writeState(conn, UPDATE_STATE_SQL, key, session) == 0) {
                writeState(conn, INSERT_STATE_SQL, key, session);
            }
            Facts persistent = durable.withScope(Scope.PERSISTENT);
            if (!persistent.isEmpty()) {
                writePersistent(conn, key.agentId(), selectPersistent(conn, key.agentId()).merge(persistent));
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_HISTORY_SQL)) {
                stmt.setString(1, key.agentId());
                stmt.setString(2, key.sessionId());
                stmt.setInt(3, record.iteration());
                stmt.setString(4, record.phaseName());
                stmt.setObject(5, OffsetDateTime.ofInstant(record.timestamp(), ZoneOffset.UTC));
                stmt.setString(6, codec.write(codec.byActionToJson(record.byAction())));
                stmt.executeUpdate();
            }
            return null;
        });
        log.debug("Saved iteration {} of {} ({} durable facts)", record.iteration(), key, durable.size());
    }

    @Override
    public List<IterationFacts> history(SessionKey key) {
        List<IterationFacts> history = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_HISTORY_SQL)) {
            stmt.setString(1, key.agentId());
            stmt.setString(2, key.sessionId());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    history.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read history of " + key, e);
        }
        return history;
    }

    @Override
    public List<String> sessions(String agentId) {
        StateStore.requireAgentId(agentId);
        List<String> sessionIds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SESSIONS_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sessionIds.add(rs.getString("session_id"));
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list sessions of agent '" + agentId + "'", e);
        }
        return sessionIds;
    }

    @Override
    public void clearScope(SessionKey key, Scope scope) {
        StateStore.requireDurableScope(scope);
        inTransaction(key, "clear " + scope.wireName() + " facts of", conn -> {
            if (scope == Scope.PERSISTENT) {
                try (PreparedStatement stmt = conn.prepareStatement(DELETE_PERSISTENT_SQL)) {
                    stmt.setString(1, key.agentId());
                    stmt.executeUpdate();
                }
                return null;
            }
            Optional<String> json = selectFacts(conn, key);
            if (json.isPresent()) {
                writeState(conn, UPDATE_STATE_SQL, key, codec.readFacts(json.get()).without(scope));
            }
            return null;
        });
        log.debug("Cleared {} facts of {}", scope.wireName(), key);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface TransactionWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(SessionKey key, String operation, TransactionWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to " + operation + " session " + key, e);
        }
    }

    private Optional<String> selectFacts(Connection conn, SessionKey key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_STATE_SQL)) {
            stmt.setString(1, key.agentId());
            stmt.setString(2, key.sessionId());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("facts")) : Optional.empty();
            }
        }
    }

    private Facts selectPersistent(Connection conn, String agentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_PERSISTENT_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? codec.readFacts(rs.getString("facts")) : Facts.empty();
            }
        }
    }

    /** Both persistent statements take (facts, updated_at, agent_id). */
    private void writePersistent(Connection conn, String agentId, Facts facts) throws SQLException {
        for (String sql : List.of(UPDATE_PERSISTENT_SQL, INSERT_PERSISTENT_SQL)) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, codec.writeFacts(facts));
                stmt.setObject(2, OffsetDateTime.now(ZoneOffset.UTC));
                stmt.setString(3, agentId);
                if (stmt.executeUpdate() > 0) {
                    return;
                }
            }
        }
    }

    private int latestIteration(Connection conn, SessionKey key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_ITERATION_SQL)) {
            stmt.setString(1, key.agentId());
            stmt.setString(2, key.sessionId());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /** Both state statements take (facts, updated_at, agent_id, session_id). */
    private int writeState(Connection conn, String sql, SessionKey key, Facts facts) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, codec.writeFacts(facts));
            stmt.setObject(2, OffsetDateTime.now(ZoneOffset.UTC));
            stmt.setString(3, key.agentId());
            stmt.setString(4, key.sessionId());
            return stmt.executeUpdate();
        }
    }

    private IterationFacts fromResultSet(ResultSet rs) throws SQLException {
        int iteration = rs.getInt("iteration");
        String phase = rs.getString("phase");
        Instant recordedAt = rs.getObject("recorded_at", OffsetDateTime.class).toInstant();
        String byAction = rs.getString("by_action");
        return new IterationFacts(iteration, phase, null, recordedAt, codec.byActionFromJson(codec.read(byAction)));
    }
}
