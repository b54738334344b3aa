package com.courier.database;

import com.courier.eventmodel.EventFactory;
import com.courier.eventmodel.EventSerializer;
import com.courier.eventmodel.PendingEvent;
import com.courier.eventmodel.StoredEvent;
import com.courier.eventstore.ConcurrentAppendException;
import com.courier.eventstore.EventLog;
import com.courier.eventstore.EventStorageException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link EventLog} backed by the {@code domain_events} table.
 *
 * <p>Event ids are assigned as {@code latest + 1} and the primary key on {@code (aggregate_id,
 * event_id)} rejects a second writer claiming the same id, so ids stay unique and gap-free across
 * processes sharing the database. Timestamps are truncated to microseconds, the finest precision
 * PostgreSQL stores, so an event reads back equal to what {@link #append} returned.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    static final int MAX_APPEND_ATTEMPTS = 5;

    private static final String INSERT =
            "INSERT INTO domain_events (aggregate_id, event_id, event_type, payload, created_at)"
                    + " VALUES (?, ?, ?, ?, ?)";

    private static final String SELECT_BY_AGGREGATE =
            "SELECT aggregate_id, event_id, event_type, payload, created_at FROM domain_events"
                    + " WHERE aggregate_id = ? ORDER BY created_at, event_id";

    private static final String SELECT_LATEST_ID =
            "SELECT COALESCE(MAX(event_id), 0) FROM domain_events WHERE aggregate_id = ?";

    private final JdbcTemplate jdbc;
    private final Clock clock;
    private final RowMapper<StoredEvent> rowMapper = this::mapRow;

    public JdbcEventLog(JdbcTemplate jdbc) {
        this(jdbc, Clock.systemUTC());
    }

    public JdbcEventLog(JdbcTemplate jdbc, Clock clock) {
        if (jdbc == null || clock == null) {
            throw new IllegalArgumentException("jdbc and clock must not be null");
        }
        this.jdbc = jdbc;
        this.clock = clock;
    }

    /**
     * Appends at the next free id, re-reading the latest id if another writer got there first.
     */
    @Override
    public StoredEvent append(PendingEvent event) {
        ConcurrentAppendException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_APPEND_ATTEMPTS; attempt++) {
            try {
                return append(event, latestEventId(event.aggregateId()));
            } catch (ConcurrentAppendException e) {
                log.debug("Append to aggregate {} lost a race (attempt {})", event.aggregateId(), attempt);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    @Override
    public StoredEvent append(PendingEvent event, long expectedLatestId) {
        StoredEvent stored = EventFactory.stored(
                event, expectedLatestId + 1, clock.instant().truncatedTo(ChronoUnit.MICROS));
        String payload = serialize(stored);
        try {
            jdbc.update(INSERT,
                    stored.aggregateId(),
                    stored.id(),
                    stored.type(),
                    payload,
                    OffsetDateTime.ofInstant(stored.createdAt(), ZoneOffset.UTC));
            return stored;
        } catch (DuplicateKeyException e) {
            throw new ConcurrentAppendException(event.aggregateId(), expectedLatestId, e);
        } catch (DataIntegrityViolationException e) {
            // the row itself is unacceptable; retrying cannot succeed
            throw new IllegalArgumentException(
                    "Event %s for aggregate '%s' violates the event table's constraints"
                            .formatted(event.type(), event.aggregateId()), e);
        } catch (DataAccessException e) {
            throw new EventStorageException(
                    "Failed to append event to aggregate '%s'".formatted(event.aggregateId()), e);
        }
    }

    @Override
    public List<StoredEvent> listByAggregate(String aggregateId) {
        try {
            return List.copyOf(jdbc.query(SELECT_BY_AGGREGATE, rowMapper, aggregateId));
        } catch (DataAccessException e) {
            throw new EventStorageException(
                    "Failed to read events of aggregate '%s'".formatted(aggregateId), e);
        }
    }

    @Override
    public long latestEventId(String aggregateId) {
        try {
            Long latest = jdbc.queryForObject(SELECT_LATEST_ID, Long.class, aggregateId);
            return latest == null ? 0 : latest;
        } catch (DataAccessException e) {
            throw new EventStorageException(
                    "Failed to read latest event id of aggregate '%s'".formatted(aggregateId), e);
        }
    }

    private static String serialize(StoredEvent event) {
        try {
            return EventSerializer.serializePayload(event.payload());
        } catch (EventSerializer.EventSerializationException e) {
            throw new IllegalArgumentException(
                    "Payload of %s event is not serializable".formatted(event.type()), e);
        }
    }

    private StoredEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        String aggregateId = rs.getString("aggregate_id");
        long eventId = rs.getLong("event_id");
        Instant createdAt = rs.getObject("created_at", OffsetDateTime.class).toInstant();
        try {
            return new StoredEvent(
                    eventId,
                    aggregateId,
                    rs.getString("event_type"),
                    EventSerializer.deserializePayload(rs.getString("payload")),
                    createdAt);
        } catch (EventSerializer.EventSerializationException e) {
            throw new EventStorageException(
                    "Stored payload of event #%d of aggregate '%s' is unreadable".formatted(eventId, aggregateId), e);
        }
    }
}
