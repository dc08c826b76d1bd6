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
import io.github.goodees.decider.core.Decision;
import io.github.goodees.decider.core.bus.EventPublisher;
import io.github.goodees.decider.core.error.CommandRejectedException;
import io.github.goodees.decider.core.store.EventHistory;
import io.github.goodees.decider.core.store.EventStore;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.StoredEvent;
import io.github.goodees.decider.core.store.StreamId;
import io.github.goodees.decider.core.store.StreamIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Command pipeline of one aggregate. It binds a {@link Decider} to an {@link EventStore} and optionally to an
 * {@link EventPublisher}.
 *
 * <h2 id="command-lifecycle">Command lifecycle</h2>
 * <ol>
 * <li><b>Start</b>: the command is resolved to its stream via {@link StreamIdentity}</li>
 * <li><b>Fetched</b>: the history of the stream is read and folded from {@link Decider#initialState()}. The
 * {@linkplain EventHistory#getVersion() version of the stream} is the version the decision is based on</li>
 * <li><b>Decided</b>: the decider is invoked with the command and the state</li>
 * <li>If the decision is a rejection, the command ends <b>Rejected</b> with {@link CommandRejectedException}. Nothing
 * is written</li>
 * <li>If the decision contains no events, the command ends with empty result. Nothing is written or published</li>
 * <li><b>Persisted</b>: the events are saved at the fetched version. When another command got to the stream first,
 * the store's {@link EventStoreException} with optimistic lock fault is thrown to the caller, who may retry the whole
 * command</li>
 * <li>Stored events are published. Publication failures never fail the command</li>
 * </ol>
 * <p>The aggregate holds no state between commands, it can be shared by any number of threads. Two concurrent
 * commands for the same stream are serialized by the store, not by the pipeline.</p>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @param <R> error type
 */
public class EventSourcedAggregate<C, S, E, R> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final Decider<C, S, E, R> decider;
    private final EventStore<E> eventStore;
    private final StreamIdentity<? super C> identity;
    private final EventPublisher<? super E> publisher;
    private final ExecutorService executor;

    /**
     * Create pipeline with no publication.
     */
    public EventSourcedAggregate(String name, Decider<C, S, E, R> decider, EventStore<E> eventStore,
            StreamIdentity<? super C> identity, ExecutorService executor) {
        this(name, decider, eventStore, identity, null, executor);
    }

    /**
     * Create pipeline.
     * @param name name of the aggregate, used in logs and rejections
     * @param decider business logic
     * @param eventStore store of the events
     * @param identity mapping of commands to streams
     * @param publisher publisher of stored events, may be null
     * @param executor executor for asynchronous handling
     */
    public EventSourcedAggregate(String name, Decider<C, S, E, R> decider, EventStore<E> eventStore,
            StreamIdentity<? super C> identity, EventPublisher<? super E> publisher, ExecutorService executor) {
        this.name = Objects.requireNonNull(name, "Aggregate name must be specified");
        this.decider = Objects.requireNonNull(decider, "Decider must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.identity = Objects.requireNonNull(identity, "Stream identity must be specified");
        this.publisher = publisher;
        this.executor = Objects.requireNonNull(executor, "Executor service must be specified");
    }

    public String getName() {
        return name;
    }

    /**
     * Handle the command on the caller's thread.
     * @param command the command
     * @return stored events, empty list if the decider decided nothing should change
     * @throws CommandRejectedException when the decider rejected the command
     * @throws EventStoreException when reading or writing the stream failed, including concurrent modification
     */
    public List<StoredEvent<E>> handleNow(C command) throws CommandRejectedException, EventStoreException {
        Objects.requireNonNull(command, "Command must be specified");
        StreamId streamId = identity.streamOf(command);
        logger.debug("{}: Starting {} on stream {}", name, command, streamId);

        EventHistory<E> history = eventStore.fetchEvents(command, identity);
        S state = decider.initialState();
        for (StoredEvent<E> stored : history) {
            state = decider.evolve(state, stored.getEvent());
        }
        long version = history.getVersion();
        if (history.isComplete()) {
            logger.debug("{}: Fetched {} events of stream {}, version {}", name, history.getEvents().size(),
                streamId, version);
        } else {
            logger.warn("{}: Stream {} is at version {} but only {} events could be read, deciding without the rest",
                name, streamId, version, history.getEvents().size());
        }

        Decision<E, R> decision = decider.decide(command, state);
        if (decision.isRejected()) {
            logger.debug("{}: Rejected {} with {}", name, command, decision.getError());
            throw new CommandRejectedException(name, decision.getError());
        }
        if (decision.isNoop()) {
            logger.debug("{}: Decided no change for {}", name, command);
            return Collections.emptyList();
        }
        logger.debug("{}: Decided {} events for {}", name, decision.getEvents().size(), command);

        List<StoredEvent<E>> stored = eventStore.save(streamId, version, decision.getEvents());
        logger.debug("{}: Persisted stream {} at version {}", name, streamId, version + stored.size());
        publish(stored);
        return stored;
    }

    /**
     * Handle the command on the executor of this aggregate. The returned future completes exceptionally with the
     * same exceptions {@link #handleNow(Object)} throws.
     * @param command the command
     * @return future of stored events
     */
    public CompletableFuture<List<StoredEvent<E>>> handle(C command) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return handleNow(command);
            } catch (CommandRejectedException | EventStoreException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private void publish(List<StoredEvent<E>> stored) {
        if (publisher == null) {
            return;
        }
        for (StoredEvent<E> event : stored) {
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                logger.warn("{}: Publication of {} failed", name, event, e);
            }
        }
    }
}
