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

import io.github.goodees.decider.core.error.ErrorCode;
import io.github.goodees.decider.core.store.EventHistory;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.StoredEvent;
import io.github.goodees.decider.core.store.StreamId;
import io.github.goodees.decider.immutables.events.TodoCreatedEvent;
import io.github.goodees.decider.immutables.events.TodoEvent;
import io.github.goodees.decider.immutables.events.TodoRenamedEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private TodoEvent created(String text) {
        return TodoCreatedEvent.builder().text(text).createdAt(NOW).build();
    }

    private TodoEvent renamed(String text) {
        return new TodoRenamedEvent.Builder().text(text).build();
    }

    @Test
    public void events_for_new_stream_are_persisted() throws EventStoreException {
        List<StoredEvent<TodoEvent>> stored = eventStore.save(stream(), 0,
            Arrays.asList(created("milk"), renamed("oat milk")));
        assertEquals(2, stored.size());
        assertEquals(1, stored.get(0).getSequence());
        assertEquals(2, stored.get(1).getSequence());
        assertEquals("TodoCreated", stored.get(0).getEventType());
        assertEquals(NOW, stored.get(0).getRecordedAt());
        assertTrue(stored.get(0).getPosition() < stored.get(1).getPosition());
        assertDb(2, "select count(*) from event where AGGREGATE_ID = ?", name());
        assertDb(2, "select max(STREAM_VERSION) from event where AGGREGATE_ID = ?", name());
    }

    @Test
    public void events_for_existing_stream_are_persisted() throws EventStoreException {
        eventStore.save(stream(), 0, Arrays.asList(created("milk"), renamed("oat milk")));
        eventStore.save(stream(), 2, Arrays.asList(renamed("soy milk"), renamed("milk")));
        assertDb(4, "select count(*) from event where AGGREGATE_ID = ?", name());
        assertEquals(4, eventStore.currentVersion(stream()));
    }

    @Test
    public void stored_events_are_read_back_in_order() throws EventStoreException {
        List<StoredEvent<TodoEvent>> stored = eventStore.save(stream(), 0,
            Arrays.asList(created("milk"), renamed("oat milk")));
        List<StoredEvent<TodoEvent>> fetched = eventStore.fetchEvents(stream());
        assertEquals(stored, fetched);
        assertEquals(created("milk"), fetched.get(0).getEvent());
    }

    @Test
    public void unknown_stream_is_empty() throws EventStoreException {
        assertTrue(eventStore.fetchEvents(stream()).isEmpty());
        assertEquals(0, eventStore.currentVersion(stream()));
    }

    @Test
    public void empty_save_writes_nothing() throws EventStoreException {
        assertTrue(eventStore.save(stream(), 0, Collections.emptyList()).isEmpty());
        assertDb(0, "select count(*) from event where AGGREGATE_ID = ?", name());
    }

    @Test
    public void all_events_of_type_are_in_insertion_order() throws EventStoreException {
        StreamId first = StreamId.of("Todo", name() + "-1");
        StreamId second = StreamId.of("Todo", name() + "-2");
        eventStore.save(first, 0, Collections.singletonList(created("a")));
        eventStore.save(second, 0, Collections.singletonList(created("b")));
        eventStore.save(first, 1, Collections.singletonList(renamed("c")));
        eventStore.save(StreamId.of("Other", name()), 0, Collections.singletonList(created("x")));

        List<StoredEvent<TodoEvent>> all = eventStore.fetchAllEvents("Todo");
        long lastPosition = 0;
        StringBuilder order = new StringBuilder();
        for (StoredEvent<TodoEvent> event : all) {
            assertEquals("Todo", event.getStreamId().getAggregateType());
            assertTrue(event.getPosition() > lastPosition);
            lastPosition = event.getPosition();
            if (event.getStreamId().getAggregateId().startsWith(name())) {
                order.append(event.getStreamId().getAggregateId().substring(name().length()));
            }
        }
        assertEquals("-1-2-1", order.toString());
    }

    @Test
    public void persisting_unsupported_events_fails() {
        try {
            eventStore.save(stream(), 0, (List) Arrays.asList(created("milk"), "not an event"));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from event where AGGREGATE_ID = ?", name());
        }
    }

    @Test
    public void persisting_at_negative_version_fails() {
        try {
            eventStore.save(stream(), -1, Collections.singletonList(created("milk")));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void persisting_stale_events_throws_early() throws EventStoreException {
        eventStore.save(stream(), 0, Arrays.asList(created("milk"), renamed("oat milk")));
        try {
            eventStore.save(stream(), 1, Collections.singletonList(renamed("soy milk")));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            assertEquals(ErrorCode.CONFLICT, e.getCode());
            assertEquals(name(), e.getAggregateId());
            assertDb(2, "select count(*) from event where AGGREGATE_ID = ?", name());
        }
    }

    @Test
    public void persisting_stale_events_fails_on_unique_key() throws InterruptedException {
        /*
            THREAD 1                      THREAD 2

                                          checkSourceVersion (0)
                                          < release "T2 has version" >
            < wait for "T2 has version" >
            checkSourceVersion (0)
            insert 1, commit
            < release "T1 saved" >
                                          < wait for "T1 saved" >
                                          insert 1 -> unique key violation, rollback

            Thread 1 wins, thread 2 fails with optimistic lock.
         */
        CountDownLatch thread2hasVersion = new CountDownLatch(1);
        CountDownLatch thread1saved = new CountDownLatch(1);

        JdbcSchema race1 = new DefaultJdbcSchema("event") {
            @Override
            protected PreparedStatement selectStreamVersion(Connection connection, StreamId streamId)
                    throws SQLException {
                try {
                    logger.info("Thread 1 waits for thread 2 to read stream version");
                    thread2hasVersion.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                return super.selectStreamVersion(connection, streamId);
            }
        };

        JdbcSchema race2 = new DefaultJdbcSchema("event") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    logger.info("Thread 2 has read stream version");
                    thread2hasVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement insertEvent(Connection connection) throws SQLException {
                try {
                    logger.info("Thread 2 waits for thread 1 to save");
                    thread1saved.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                return super.insertEvent(connection);
            }
        };

        JdbcEventStore<TodoEvent> store1 = new JdbcEventStore<>(ds, race1, serialization);
        JdbcEventStore<TodoEvent> store2 = new JdbcEventStore<>(ds, race2, serialization);

        Thread thread1 = new Thread(() -> {
            try {
                store1.save(stream(), 0, Collections.singletonList(created("first")));
            } catch (Exception e) {
                logger.error("Thread 1 failed", e);
                collector.addError(e);
            } finally {
                // release all latches in case we failed:
                thread1saved.countDown();
            }
        });
        thread1.setName("Thread 1");
        thread1.start();
        try {
            store2.save(stream(), 0, Arrays.asList(created("second"), renamed("second again")));
            fail("Should have failed");
        } catch (EventStoreException e) {
            logger.info("Thread 2 got (expected) event store exception", e);
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        thread1.join();
        assertDb(1, "select count(*) from event where AGGREGATE_ID = ?", name());
        assertDb(1, "select count(*) from event where AGGREGATE_ID = ? and PAYLOAD like '%first%'", name());
        assertDb(0, "select count(*) from event where AGGREGATE_ID = ? and PAYLOAD like '%second%'", name());
    }

    @Test
    public void undeserializable_event_fails_strict_read() {
        insertRaw(1, "TodoArchived", 1, "{\"type\":\"TodoArchived\"}");
        try {
            eventStore.fetchEvents(stream());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void undeserializable_event_is_skipped_when_lenient() throws EventStoreException {
        JdbcEventStore<TodoEvent> lenient = new JdbcEventStore<>(ds, schema, serialization,
                JdbcEventStore.LOCAL_HANDLER, false);
        insertRaw(1, "TodoCreated", 1, serialization.serialize(created("milk")));
        insertRaw(2, "TodoArchived", 1, "{\"type\":\"TodoArchived\"}");
        insertRaw(3, "TodoRenamed", 2, "{\"type\":\"TodoRenamed\",\"text\":\"from the future\"}");
        insertRaw(4, "TodoRenamed", 1, serialization.serialize(renamed("oat milk")));

        List<StoredEvent<TodoEvent>> events = lenient.fetchEvents(stream());
        assertEquals(2, events.size());
        assertEquals(1, events.get(0).getSequence());
        assertEquals(4, events.get(1).getSequence());
        assertEquals(renamed("oat milk"), events.get(1).getEvent());
    }

    @Test
    public void skipped_tail_events_count_towards_stream_version() throws EventStoreException {
        JdbcEventStore<TodoEvent> lenient = new JdbcEventStore<>(ds, schema, serialization,
                JdbcEventStore.LOCAL_HANDLER, false);
        insertRaw(1, "TodoCreated", 1, serialization.serialize(created("milk")));
        insertRaw(2, "TodoArchived", 1, "{\"type\":\"TodoArchived\"}");

        EventHistory<TodoEvent> history = lenient.fetchHistory(stream());
        assertEquals(1, history.getEvents().size());
        assertEquals(2, history.getVersion());
        assertFalse(history.isComplete());
        assertEquals(lenient.currentVersion(stream()), history.getVersion());
    }

    @Test
    public void failing_statement_fails_with_tx_error() {
        JdbcEventStore<TodoEvent> store = new JdbcEventStore<>(ds, new DefaultJdbcSchema("missing_event"),
                serialization);
        try {
            store.save(stream(), 0, Collections.singletonList(created("milk")));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.TX_ERROR, e.getFault());
            assertEquals(ErrorCode.INTERNAL_ERROR, e.getCode());
        }
    }

    @Test
    public void constraint_violation_is_recognized_in_cause_chain() {
        SQLException wrapped = new SQLException("batch failed", "HY000",
                new SQLException("duplicate key", "23505"));
        assertTrue(JdbcEventStore.isConstraintViolation(wrapped));
        assertFalse(JdbcEventStore.isConstraintViolation(new SQLException("syntax", "42000")));
    }
}
