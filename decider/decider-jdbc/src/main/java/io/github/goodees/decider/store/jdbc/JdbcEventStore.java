package io.github.goodees.decider.store.jdbc;

/*-
 * #%L
 * decider-jdbc
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.decider.core.store.EventHistory;
import io.github.goodees.decider.core.store.EventStore;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.Serialization;
import io.github.goodees.decider.core.store.StoredEvent;
import io.github.goodees.decider.core.store.StreamId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event store backed by a relational database, delegating SQL to a {@link JdbcSchema} and payload conversion to a
 * {@link Serialization}.
 * <p>Writes check the stream version up front and rely on the unique key over (type, id, sequence) to resolve races
 * between writers that passed the check concurrently. Either way the losing write is rolled back and reported as
 * {@linkplain EventStoreException.Fault#OPTIMISTIC_LOCK optimistic lock}.</p>
 * <p>When the store is in strict mode, it will throw an exception when an event being read cannot be deserialized.
 * This usually happens when payload serialization was broken, or when an event belongs to a newer version of the
 * system and the running code doesn't know it yet. In non-strict mode such events are logged and skipped.</p>
 * @param <E> event type
 */
public class JdbcEventStore<E> implements EventStore<E> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final TxHandler txHandler;
    private final boolean strict;
    private final Clock clock;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this(dataSource, schema, serialization, LOCAL_HANDLER, true, Clock.systemUTC());
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
            TxHandler handler, boolean strict) {
        this(dataSource, schema, serialization, handler, strict, Clock.systemUTC());
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
            TxHandler handler, boolean strict, Clock clock) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
        this.strict = strict;
        this.clock = clock;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true if unreadable events fail the read
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public List<StoredEvent<E>> fetchEvents(StreamId streamId) throws EventStoreException {
        return fetchHistory(streamId).getEvents();
    }

    /**
     * Read the stream. In non-strict mode the version of the history includes events that were skipped, so that
     * writes based on it do not conflict with events nobody could read.
     */
    @Override
    public EventHistory<E> fetchHistory(StreamId streamId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectEvents(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            List<StoredEvent<E>> events = new ArrayList<>();
            long version = readEvents(rs, events);
            return new EventHistory<>(events, version);
        } catch (SQLException e) {
            throw EventStoreException.readFailed("stream " + streamId, e);
        }
    }

    @Override
    public List<StoredEvent<E>> fetchAllEvents(String aggregateType) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectEventsOfType(connection, aggregateType);
                ResultSet rs = select.executeQuery()) {
            List<StoredEvent<E>> events = new ArrayList<>();
            readEvents(rs, events);
            return events;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events of " + aggregateType, e);
        }
    }

    @Override
    public long currentVersion(StreamId streamId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            return schema.readStreamVersion(rs);
        } catch (SQLException e) {
            throw EventStoreException.readFailed("version of " + streamId, e);
        }
    }

    @Override
    public List<StoredEvent<E>> save(StreamId streamId, long expectedVersion, List<? extends E> events)
            throws EventStoreException {
        if (expectedVersion < 0) {
            throw EventStoreException.invalidVersion(streamId, expectedVersion);
        }
        PersistTemplate template = createTemplate(streamId, expectedVersion);
        for (E event : events) {
            template.addEvent(event);
        }
        return template.persist();
    }

    protected PersistTemplate createTemplate(StreamId streamId, long expectedVersion) {
        return new PersistTemplate(streamId, expectedVersion);
    }

    protected E checkCast(StreamId streamId, Object event) throws EventStoreException {
        E cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(streamId, event);
        } else {
            return cast;
        }
    }

    /**
     * Read all rows into {@code result}.
     * @return sequence of the last row read, whether it could be deserialized or not
     */
    private long readEvents(ResultSet rs, List<StoredEvent<E>> result) throws SQLException, EventStoreException {
        long lastSequence = 0;
        while (rs.next()) {
            StreamId streamId = schema.readStreamId(rs);
            long sequence = schema.readSequence(rs);
            lastSequence = sequence;
            String type = schema.readEventType(rs);
            E event = deserialize(streamId, sequence, schema.readEventPayloadVersion(rs),
                schema.readEventPayload(rs), type);
            if (event != null) {
                result.add(new StoredEvent<>(streamId, sequence, type, event, schema.readRecordedAt(rs),
                        schema.readPosition(rs)));
            } else if (isStrict()) {
                throw EventStoreException.undeserializable(streamId, sequence, null);
            } else {
                logger.error("{} Could not deserialize event {}", streamId, sequence);
            }
        }
        return lastSequence;
    }

    private E deserialize(StreamId streamId, long sequence, int payloadVersion, String payload, String type)
            throws EventStoreException {
        try {
            return serialization.deserialize(payloadVersion, payload, type);
        } catch (RuntimeException e) {
            if (isStrict()) {
                throw EventStoreException.undeserializable(streamId, sequence, e);
            }
            logger.error("{} Could not deserialize event {}", streamId, sequence, e);
            return null;
        }
    }

    static boolean isConstraintViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                // SQL state class 23: integrity constraint violation
                if (state != null && state.startsWith("23")) {
                    return true;
                }
            }
        }
        return false;
    }

    protected class PersistTemplate {
        private final StreamId streamId;
        private final long expectedVersion;
        private final List<E> events = new ArrayList<>();

        protected PersistTemplate(StreamId streamId, long expectedVersion) {
            this.streamId = streamId;
            this.expectedVersion = expectedVersion;
        }

        void addEvent(Object event) throws EventStoreException {
            events.add(checkCast(streamId, event));
        }

        public List<StoredEvent<E>> persist() throws EventStoreException {
            if (events.isEmpty()) {
                return Collections.emptyList();
            }
            List<PendingEvent> pending = serializeEvents();
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    checkSourceVersion(connection);
                    List<StoredEvent<E>> stored = storeEvents(connection, pending);
                    txHandler.commit(connection);
                    return stored;
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
            } catch (SQLException e) {
                if (isConstraintViolation(e)) {
                    throw EventStoreException.optimisticLock(streamId, expectedVersion, e);
                }
                throw EventStoreException.storeFailed(streamId, e);
            }
        }

        private List<PendingEvent> serializeEvents() throws EventStoreException {
            List<PendingEvent> result = new ArrayList<>(events.size());
            for (E event : events) {
                String payload;
                try {
                    payload = serialization.serialize(event);
                } catch (RuntimeException e) {
                    throw EventStoreException.unserializable(streamId, event, e);
                }
                result.add(new PendingEvent(event, serialization.typeOf(event), serialization.payloadVersion(event),
                        payload));
            }
            return result;
        }

        private void checkSourceVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                    ResultSet rs = selectVersion.executeQuery()) {
                long version = schema.readStreamVersion(rs);
                if (version != expectedVersion) {
                    throw EventStoreException.optimisticLock(streamId, version, expectedVersion);
                }
            }
        }

        private List<StoredEvent<E>> storeEvents(Connection connection, List<PendingEvent> pending)
                throws SQLException {
            Instant recordedAt = clock.instant();
            List<StoredEvent<E>> stored = new ArrayList<>(pending.size());
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long sequence = expectedVersion;
                for (PendingEvent p : pending) {
                    sequence++;
                    schema.prepareInsert(insertEvent, streamId, sequence, p.type, recordedAt, p.payloadVersion,
                        p.payload);
                    insertEvent.executeUpdate();
                    long position = schema.readGeneratedPosition(insertEvent);
                    stored.add(new StoredEvent<>(streamId, sequence, p.type, p.event, recordedAt, position));
                }
            }
            return stored;
        }
    }

    private class PendingEvent {
        final E event;
        final String type;
        final int payloadVersion;
        final String payload;

        PendingEvent(E event, String type, int payloadVersion, String payload) {
            this.event = event;
            this.type = type;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }
    }

    /**
     * Transaction demarcation around a write.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Handler that manages local transaction of the connection.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };

    /**
     * Handler for connections whose transaction is managed by a container.
     */
    public static final TxHandler CONTAINER_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };
}
