package com.phillippitts.axiom.service.store;

import com.phillippitts.axiom.domain.ConversationTurn;
import com.phillippitts.axiom.domain.Event;
import com.phillippitts.axiom.exception.StorageException;
import com.phillippitts.axiom.exception.TurnConflictException;
import com.phillippitts.axiom.service.bus.EventCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link DurableStore} on a relational database through Spring's {@link JdbcTemplate}.
 * The schema is owned by the Flyway migrations under {@code db/migration}.
 *
 * <p>Idempotence relies on the table constraints: a duplicate key on insert is reported as
 * "already stored" rather than as a failure, provided the stored row carries the same input and
 * response. A duplicate key with different content is a {@link TurnConflictException}.
 */
public class JdbcDurableStore implements DurableStore {

    private static final Logger LOG = LogManager.getLogger(JdbcDurableStore.class);

    private static final String INSERT_TURN = """
            INSERT INTO conversation_turns
                (session_id, sequence_number, user_input, detected_intent, assistant_response,
                 created_at, processing_duration_ms, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_TURNS = """
            SELECT session_id, sequence_number, user_input, detected_intent, assistant_response,
                   created_at, processing_duration_ms, metadata
            FROM conversation_turns
            WHERE session_id = ?
            ORDER BY sequence_number DESC
            LIMIT ?
            """;

    private static final String SELECT_TURN_CONTENT = """
            SELECT user_input, assistant_response
            FROM conversation_turns
            WHERE session_id = ? AND sequence_number = ?
            """;

    private static final String INSERT_EVENT = """
            INSERT INTO system_events (id, topic, source, correlation_id, payload, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_EVENTS = """
            SELECT id, topic, source, correlation_id, payload, created_at
            FROM system_events
            WHERE topic = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

    private static final RowMapper<ConversationTurn> TURN_MAPPER = (rs, rowNum) -> new ConversationTurn(
            rs.getString("session_id"),
            rs.getLong("sequence_number"),
            rs.getString("user_input"),
            rs.getString("detected_intent"),
            rs.getString("assistant_response"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("processing_duration_ms"),
            EventCodec.readMap(rs.getString("metadata")));

    private static final RowMapper<Event> EVENT_MAPPER = (rs, rowNum) -> new Event(
            rs.getString("id"),
            rs.getString("topic"),
            EventCodec.readMap(rs.getString("payload")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getString("source"),
            rs.getString("correlation_id"));

    private final JdbcTemplate jdbc;

    public JdbcDurableStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    @Override
    public boolean persist(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        try {
            jdbc.update(INSERT_TURN,
                    turn.sessionId(),
                    turn.sequenceNumber(),
                    turn.userInput(),
                    turn.detectedIntent(),
                    turn.assistantResponse(),
                    Timestamp.from(turn.createdAt()),
                    turn.processingDurationMs(),
                    EventCodec.writeMap(turn.metadata()));
            LOG.debug("Persisted turn {}#{}", turn.sessionId(), turn.sequenceNumber());
            return true;
        } catch (DuplicateKeyException e) {
            if (!sameContent(turn)) {
                LOG.error("Turn {}#{} already stored with different content", turn.sessionId(), turn.sequenceNumber());
                throw new TurnConflictException(turn.sessionId(), turn.sequenceNumber());
            }
            LOG.debug("Turn {}#{} already stored", turn.sessionId(), turn.sequenceNumber());
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("persist", "Failed to persist turn "
                    + turn.sessionId() + "#" + turn.sequenceNumber(), e);
        }
    }

    private boolean sameContent(ConversationTurn turn) {
        try {
            List<Boolean> matches = jdbc.query(SELECT_TURN_CONTENT,
                    (rs, rowNum) -> Objects.equals(rs.getString("user_input"), turn.userInput())
                            && Objects.equals(rs.getString("assistant_response"), turn.assistantResponse()),
                    turn.sessionId(), turn.sequenceNumber());
            return matches.isEmpty() || matches.get(0);
        } catch (DataAccessException e) {
            throw new StorageException("persist", "Failed to compare stored turn "
                    + turn.sessionId() + "#" + turn.sequenceNumber(), e);
        }
    }

    @Override
    public List<ConversationTurn> query(String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return jdbc.query(SELECT_TURNS, TURN_MAPPER, sessionId, limit);
        } catch (DataAccessException e) {
            throw new StorageException("query", "Failed to query turns for session " + sessionId, e);
        }
    }

    @Override
    public long latestSequenceNumber(String sessionId) {
        try {
            Long max = jdbc.queryForObject(
                    "SELECT MAX(sequence_number) FROM conversation_turns WHERE session_id = ?",
                    Long.class, sessionId);
            return max == null ? 0L : max;
        } catch (DataAccessException e) {
            throw new StorageException("latestSequenceNumber", "Failed to read sequence for session " + sessionId, e);
        }
    }

    @Override
    public boolean persistEvent(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!event.hasId()) {
            throw new IllegalArgumentException("Only published events can be stored");
        }
        try {
            jdbc.update(INSERT_EVENT,
                    event.id(),
                    event.topic(),
                    event.source(),
                    event.correlationId(),
                    EventCodec.writeMap(event.payload()),
                    Timestamp.from(event.createdAt()));
            return true;
        } catch (DuplicateKeyException e) {
            LOG.debug("Event {} already stored", event.id());
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("persistEvent", "Failed to persist event " + event.id(), e);
        }
    }

    @Override
    public List<Event> queryEvents(String topic, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return jdbc.query(SELECT_EVENTS, EVENT_MAPPER, topic, limit);
        } catch (DataAccessException e) {
            throw new StorageException("queryEvents", "Failed to query events for topic " + topic, e);
        }
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        Timestamp ts = Timestamp.from(cutoff);
        try {
            int turns = jdbc.update("DELETE FROM conversation_turns WHERE created_at < ?", ts);
            int events = jdbc.update("DELETE FROM system_events WHERE created_at < ?", ts);
            if (turns + events > 0) {
                LOG.info("Purged {} turn(s) and {} event(s) older than {}", turns, events, cutoff);
            }
            return turns + events;
        } catch (DataAccessException e) {
            throw new StorageException("purge", "Failed to purge records older than " + cutoff, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            jdbc.queryForObject("SELECT COUNT(*) FROM conversation_turns WHERE 1 = 0", Integer.class);
            return true;
        } catch (DataAccessException e) {
            LOG.warn("Durable store unavailable: {}", e.getMessage());
            return false;
        }
    }
}
