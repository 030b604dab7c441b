package com.hookledger.store;

import com.hookledger.shared.config.IngestConfig;
import com.hookledger.shared.model.InboundMessage;
import com.hookledger.shared.model.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Message table over plain JDBC. Uniqueness of message_id is left to the
 * primary key so concurrent writers, in this process or others, need no lock.
 */
public class JdbcMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMessageStore.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String DATA_EXCEPTION_CLASS = "22";
    private static final String INTEGRITY_VIOLATION_CLASS = "23";
    // connection, transaction rollback, insufficient resources, operator intervention, system error
    private static final List<String> TRANSIENT_CLASSES = List.of("08", "40", "53", "57", "58");
    private static final int TOP_SENDERS = 10;

    private static final String[] SCHEMA = {
        """
        CREATE TABLE IF NOT EXISTS messages (
            message_id VARCHAR(255) PRIMARY KEY,
            from_msisdn VARCHAR(16) NOT NULL,
            to_msisdn VARCHAR(16) NOT NULL,
            ts TIMESTAMP WITH TIME ZONE NOT NULL,
            body VARCHAR(%d),
            created_at TIMESTAMP WITH TIME ZONE NOT NULL
        )""".formatted(IngestConfig.MAX_TEXT_LENGTH),
        "CREATE INDEX IF NOT EXISTS idx_messages_ts_id ON messages (ts, message_id)",
        "CREATE INDEX IF NOT EXISTS idx_messages_from ON messages (from_msisdn)"
    };

    private final DataSource dataSource;
    private final Clock clock;
    private final int queryTimeoutSeconds;
    private volatile boolean schemaReady;

    public JdbcMessageStore(DataSource dataSource, Clock clock, int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.clock = clock;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public void initSchema() {
        try (var conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            for (var ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            schemaReady = true;
        } catch (SQLException e) {
            throw translate("Failed to initialise message schema", e);
        }
    }

    @Override
    public InsertResult insert(InboundMessage message) {
        var sql = "INSERT INTO messages (message_id, from_msisdn, to_msisdn, ts, body, created_at) VALUES (?, ?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn.prepareStatement(sql))) {
            ps.setString(1, message.messageId());
            ps.setString(2, message.from());
            ps.setString(3, message.to());
            ps.setObject(4, utc(message.ts()));
            ps.setString(5, message.text());
            ps.setObject(6, utc(clock.instant()));
            ps.executeUpdate();
            return InsertResult.CREATED;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                return InsertResult.ALREADY_EXISTS;
            }
            if (sqlClass(e, DATA_EXCEPTION_CLASS) || sqlClass(e, INTEGRITY_VIOLATION_CLASS)) {
                throw new MessageRejectedException("Message rejected by database: " + message.messageId(), e);
            }
            throw translate("Failed to insert message: " + message.messageId(), e);
        }
    }

    @Override
    public MessagePage list(MessageFilter filter, int limit, int offset) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }

        var where = new StringBuilder();
        var params = new ArrayList<Object>();
        if (filter.from() != null) {
            where.append(where.length() == 0 ? " WHERE " : " AND ").append("from_msisdn = ?");
            params.add(filter.from());
        }
        if (filter.since() != null) {
            where.append(where.length() == 0 ? " WHERE " : " AND ").append("ts >= ?");
            params.add(utc(filter.since()));
        }
        if (filter.textQuery() != null && !filter.textQuery().isEmpty()) {
            where.append(where.length() == 0 ? " WHERE " : " AND ").append("LOWER(body) LIKE ? ESCAPE '\\'");
            params.add("%" + escapeLike(filter.textQuery().toLowerCase(Locale.ROOT)) + "%");
        }

        var countSql = "SELECT COUNT(*) FROM messages" + where;
        var pageSql = "SELECT message_id, from_msisdn, to_msisdn, ts, body, created_at FROM messages" + where
            + " ORDER BY ts ASC, message_id ASC OFFSET ? ROWS FETCH NEXT ? ROWS ONLY";

        try (var conn = dataSource.getConnection()) {
            long total;
            try (var ps = prepare(conn.prepareStatement(countSql))) {
                bind(ps, params);
                try (var rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            var items = new ArrayList<StoredMessage>();
            try (var ps = prepare(conn.prepareStatement(pageSql))) {
                bind(ps, params);
                ps.setInt(params.size() + 1, offset);
                ps.setInt(params.size() + 2, limit);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        items.add(readMessage(rs));
                    }
                }
            }
            return new MessagePage(items, total);
        } catch (SQLException e) {
            if (sqlClass(e, DATA_EXCEPTION_CLASS)) {
                throw new IllegalArgumentException("filter value not accepted", e);
            }
            throw translate("Failed to list messages", e);
        }
    }

    @Override
    public MessageStats stats() {
        try (var conn = dataSource.getConnection()) {
            long total = 0;
            long senders = 0;
            Instant first = null;
            Instant last = null;
            try (var ps = prepare(conn.prepareStatement(
                     "SELECT COUNT(*), COUNT(DISTINCT from_msisdn), MIN(ts), MAX(ts) FROM messages"));
                 var rs = ps.executeQuery()) {
                if (rs.next()) {
                    total = rs.getLong(1);
                    senders = rs.getLong(2);
                    first = instant(rs.getObject(3, OffsetDateTime.class));
                    last = instant(rs.getObject(4, OffsetDateTime.class));
                }
            }

            var top = new ArrayList<SenderCount>();
            try (var ps = prepare(conn.prepareStatement(
                     "SELECT from_msisdn, COUNT(*) AS cnt FROM messages GROUP BY from_msisdn"
                         + " ORDER BY cnt DESC, from_msisdn ASC FETCH FIRST " + TOP_SENDERS + " ROWS ONLY"));
                 var rs = ps.executeQuery()) {
                while (rs.next()) {
                    top.add(new SenderCount(rs.getString(1), rs.getLong(2)));
                }
            }
            return new MessageStats(total, senders, List.copyOf(top), first, last);
        } catch (SQLException e) {
            throw translate("Failed to compute message stats", e);
        }
    }

    @Override
    public boolean ping() {
        if (!schemaReady) {
            try {
                initSchema();
            } catch (StorageUnavailableException | IllegalStateException e) {
                log.warn("Message schema not ready: {}", e.getCause().getMessage());
                return false;
            }
        }
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn.prepareStatement("SELECT 1"));
             var rs = ps.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Database ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Connection loss, timeouts and resource exhaustion are retryable and become
     * {@link StorageUnavailableException}. Anything else is a fault on this side.
     */
    static RuntimeException translate(String action, SQLException e) {
        if (isTransient(e)) {
            return new StorageUnavailableException(action, e);
        }
        return new IllegalStateException(action, e);
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTimeoutException
            || e instanceof SQLTransientException
            || e instanceof SQLRecoverableException
            || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        // drivers leave the state empty for plain socket failures
        if (e.getSQLState() == null) return true;
        return TRANSIENT_CLASSES.stream().anyMatch(c -> sqlClass(e, c));
    }

    private static boolean sqlClass(SQLException e, String sqlClass) {
        return e.getSQLState() != null && e.getSQLState().startsWith(sqlClass);
    }

    private PreparedStatement prepare(PreparedStatement ps) throws SQLException {
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static StoredMessage readMessage(ResultSet rs) throws SQLException {
        return new StoredMessage(
            rs.getString("message_id"),
            rs.getString("from_msisdn"),
            rs.getString("to_msisdn"),
            instant(rs.getObject("ts", OffsetDateTime.class)),
            rs.getString("body"),
            instant(rs.getObject("created_at", OffsetDateTime.class)));
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }

    static String escapeLike(String query) {
        return query.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
