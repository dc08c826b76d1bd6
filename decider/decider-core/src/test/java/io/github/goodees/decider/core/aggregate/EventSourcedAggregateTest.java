package io.github.goodees.decider.core.aggregate;

/*-
 * #%L
 * decider-core
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

import io.github.goodees.decider.core.Decider;
import io.github.goodees.decider.core.MockEventStore;
import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.RecordingEventBus;
import io.github.goodees.decider.core.Sum;
import io.github.goodees.decider.core.bus.EventPublisher;
import io.github.goodees.decider.core.error.CommandRejectedException;
import io.github.goodees.decider.core.error.DomainError;
import io.github.goodees.decider.core.error.ErrorCode;
import io.github.goodees.decider.core.error.Futures;
import io.github.goodees.decider.core.example.querysession.QuerySessionCommand;
import io.github.goodees.decider.core.example.querysession.QuerySessionDecider;
import io.github.goodees.decider.core.example.querysession.QuerySessionEvent;
import io.github.goodees.decider.core.example.todo.TodoCommand;
import io.github.goodees.decider.core.example.todo.TodoDecider;
import io.github.goodees.decider.core.example.todo.TodoEvent;
import io.github.goodees.decider.core.example.todo.TodoState;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.InMemoryEventStore;
import io.github.goodees.decider.core.store.StoredEvent;
import io.github.goodees.decider.core.store.StreamId;
import io.github.goodees.decider.core.store.StreamIdentity;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventSourcedAggregateTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final ExecutorService executor = Executors.newFixedThreadPool(3);

    @Rule
    public TestName testName = new TestName();

    private MockEventStore<TodoEvent> store;
    private RecordingEventBus bus;
    private EventSourcedAggregate<TodoCommand, TodoState, TodoEvent, DomainError> aggregate;

    @Before
    public void setUp() {
        store = new MockEventStore<>();
        bus = new RecordingEventBus();
        aggregate = new EventSourcedAggregate<>("todo", new TodoDecider(), store, TodoDecider.IDENTITY,
                new EventPublisher<TodoEvent>(bus), executor);
    }

    @AfterClass
    public static void shutdown() {
        executor.shutdownNow();
    }

    private String id() {
        return testName.getMethodName();
    }

    private StreamId stream() {
        return StreamId.of(TodoDecider.AGGREGATE_TYPE, id());
    }

    @Test
    public void accepted_command_is_stored_and_published() throws Exception {
        List<StoredEvent<TodoEvent>> created = aggregate.handleNow(new TodoCommand.Create(id(), "milk", NOW));
        List<StoredEvent<TodoEvent>> renamed = aggregate.handleNow(new TodoCommand.Rename(id(), "oat milk"));

        assertEquals(1, created.size());
        assertEquals(1, created.get(0).getSequence());
        assertEquals(2, renamed.get(0).getSequence());
        assertThat(events(store.fetchEvents(stream())), contains(new TodoEvent.CreatedEvent("milk", NOW),
            new TodoEvent.RenamedEvent("oat milk")));
        assertThat(bus.getPublished().stream().map(m -> m.getTopic()).collect(Collectors.toList()),
            contains("events/Todo/" + id() + "/1", "events/Todo/" + id() + "/2"));
        assertThat(bus.getPublished().get(0).getPayload(), instanceOf(StoredEvent.class));
    }

    @Test
    public void rejected_command_writes_nothing() throws Exception {
        try {
            aggregate.handleNow(new TodoCommand.Rename(id(), "milk"));
            fail("Rename of nonexistent todo should be rejected");
        } catch (CommandRejectedException e) {
            assertEquals(ErrorCode.NOT_FOUND, e.getCode());
            assertEquals(e.getError(DomainError.class).getErrorId(), e.getErrorId());
        }
        assertEquals(0, store.saveCalls());
        assertThat(bus.getPublished(), empty());
    }

    @Test
    public void noop_command_stores_and_publishes_nothing() throws Exception {
        aggregate.handleNow(new TodoCommand.Create(id(), "milk", NOW));
        int publishedBefore = bus.getPublished().size();
        int savesBefore = store.saveCalls();

        List<StoredEvent<TodoEvent>> result = aggregate.handleNow(new TodoCommand.Rename(id(), "milk"));

        assertThat(result, empty());
        assertEquals(savesBefore, store.saveCalls());
        assertEquals(publishedBefore, bus.getPublished().size());
        assertEquals(1, store.currentVersion(stream()));
    }

    @Test
    public void store_failure_propagates_unchanged() throws Exception {
        EventStoreException failure = EventStoreException.storeFailed(stream(), new IllegalStateException("disk"));
        store.throwExceptionOnce(failure);
        try {
            aggregate.handleNow(new TodoCommand.Create(id(), "milk", NOW));
            fail("Expected store failure");
        } catch (EventStoreException e) {
            assertSame(failure, e);
            assertEquals(ErrorCode.INTERNAL_ERROR, e.getCode());
        }
        assertThat(bus.getPublished(), empty());
    }

    @Test
    public void publication_failure_does_not_fail_command() throws Exception {
        bus.setFailing(true);
        List<StoredEvent<TodoEvent>> result = aggregate.handleNow(new TodoCommand.Create(id(), "milk", NOW));
        assertEquals(1, result.size());
        assertEquals(1, store.currentVersion(stream()));
    }

    @Test
    public void concurrent_creation_results_in_one_conflict() throws Exception {
        CyclicBarrier bothDecided = new CyclicBarrier(2);
        store.beforeSave(() -> {
            try {
                bothDecided.await(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException("Writers did not meet", e);
            }
        });
        CompletableFuture<List<StoredEvent<TodoEvent>>> first = aggregate
                .handle(new TodoCommand.Create(id(), "first", NOW));
        CompletableFuture<List<StoredEvent<TodoEvent>>> second = aggregate
                .handle(new TodoCommand.Create(id(), "second", NOW));

        List<Throwable> failures = new ArrayList<>();
        int successes = 0;
        for (CompletableFuture<List<StoredEvent<TodoEvent>>> f : Arrays.asList(first, second)) {
            try {
                f.get(10, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException e) {
                failures.add(Futures.unwrap(e));
            }
        }
        assertEquals(1, successes);
        assertEquals(1, failures.size());
        assertThat(failures.get(0), instanceOf(EventStoreException.class));
        EventStoreException conflict = (EventStoreException) failures.get(0);
        assertTrue(conflict.isConflict());
        assertEquals(ErrorCode.CONFLICT, conflict.getCode());

        List<TodoEvent> stored = events(store.fetchEvents(stream()));
        assertEquals(1, stored.size());
        assertThat(stored.get(0), instanceOf(TodoEvent.CreatedEvent.class));
        assertEquals(1, bus.getPublished().size());
    }

    @Test
    public void async_rejection_completes_future_exceptionally() throws Exception {
        CompletableFuture<List<StoredEvent<TodoEvent>>> result = aggregate
                .handle(new TodoCommand.Create(id(), " ", NOW));
        try {
            result.get(5, TimeUnit.SECONDS);
            fail("Expected rejection");
        } catch (ExecutionException e) {
            Throwable cause = Futures.unwrap(e);
            assertThat(cause, instanceOf(CommandRejectedException.class));
            assertEquals(ErrorCode.VALIDATION_FAILED, ((CommandRejectedException) cause).getCode());
        }
    }

    @Test
    public void non_domain_errors_are_validation_failures() throws Exception {
        EventSourcedAggregate<TodoCommand, TodoState, TodoEvent, String> plain = new EventSourcedAggregate<>(
                "plain", new TodoDecider().mapError(DomainError::getMessage), store, TodoDecider.IDENTITY, executor);
        try {
            plain.handleNow(new TodoCommand.Complete(id(), NOW));
            fail("Expected rejection");
        } catch (CommandRejectedException e) {
            assertEquals(ErrorCode.VALIDATION_FAILED, e.getCode());
            assertThat(e.getError(), instanceOf(String.class));
        }
    }

    @Test
    public void combined_decider_routes_commands_to_own_streams() throws Exception {
        InMemoryEventStore<Sum<TodoEvent, QuerySessionEvent>> combinedStore = new InMemoryEventStore<>();
        Decider<Sum<TodoCommand, QuerySessionCommand>, Pair<TodoState, QuerySessionDecider.State>,
                Sum<TodoEvent, QuerySessionEvent>, DomainError> decider = Decider.combine(new TodoDecider(),
                    new QuerySessionDecider());
        EventSourcedAggregate<Sum<TodoCommand, QuerySessionCommand>, Pair<TodoState, QuerySessionDecider.State>,
                Sum<TodoEvent, QuerySessionEvent>, DomainError> combined = new EventSourcedAggregate<>("combined",
                    decider, combinedStore,
                    StreamIdentity.combine(TodoDecider.IDENTITY, QuerySessionDecider.IDENTITY), executor);

        combined.handleNow(Sum.<TodoCommand, QuerySessionCommand>first(new TodoCommand.Create(id(), "milk", NOW)));
        combined.handleNow(Sum.<TodoCommand, QuerySessionCommand>second(
            new QuerySessionCommand.StartQuery(id(), "q1", "select 1", NOW)));
        List<StoredEvent<Sum<TodoEvent, QuerySessionEvent>>> renamed = combined.handleNow(
            Sum.<TodoCommand, QuerySessionCommand>first(new TodoCommand.Rename(id(), "oat milk")));

        assertEquals(2, renamed.get(0).getSequence());
        List<Sum<TodoEvent, QuerySessionEvent>> todoEvents = sums(combinedStore.fetchEvents(stream()));
        assertThat(todoEvents, contains(
            Sum.<TodoEvent, QuerySessionEvent>first(new TodoEvent.CreatedEvent("milk", NOW)),
            Sum.<TodoEvent, QuerySessionEvent>first(new TodoEvent.RenamedEvent("oat milk"))));
        List<Sum<TodoEvent, QuerySessionEvent>> sessionEvents = sums(
            combinedStore.fetchEvents(StreamId.of(QuerySessionDecider.AGGREGATE_TYPE, id())));
        assertEquals(1, sessionEvents.size());
        assertFalse(sessionEvents.get(0).isFirst());

        Pair<TodoState, QuerySessionDecider.State> todoSide = decider.fold(todoEvents);
        assertEquals("oat milk", todoSide.first().getText());
        assertSame(new QuerySessionDecider().initialState(), todoSide.second());
        Pair<TodoState, QuerySessionDecider.State> sessionSide = decider.fold(sessionEvents);
        assertSame(TodoState.NONE, sessionSide.first());
        assertEquals(QuerySessionDecider.Status.PENDING, sessionSide.second().getStatus());
    }

    private static <E> List<E> sums(List<StoredEvent<E>> stored) {
        return stored.stream().map(StoredEvent::getEvent).collect(Collectors.toList());
    }

    private static List<TodoEvent> events(List<StoredEvent<TodoEvent>> stored) {
        return stored.stream().map(StoredEvent::getEvent).collect(Collectors.toList());
    }
}
