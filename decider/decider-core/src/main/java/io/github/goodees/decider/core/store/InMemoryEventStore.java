package io.github.goodees.decider.core.store;

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

import io.github.goodees.decider.core.EventType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event store keeping streams in memory. Each stream is an immutable list behind an atomic reference, an append
 * succeeds only if it swaps the exact list it was validated against. No locks are taken.
 * @param <E> event type
 */
public class InMemoryEventStore<E> implements EventStore<E> {
    private final ConcurrentMap<StreamId, AtomicReference<List<StoredEvent<E>>>> storage = new ConcurrentHashMap<>();
    private final AtomicLong positions = new AtomicLong();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    private AtomicReference<List<StoredEvent<E>>> streamLog(StreamId streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new AtomicReference<>(Collections.emptyList()));
    }

    @Override
    public List<StoredEvent<E>> fetchEvents(StreamId streamId) {
        AtomicReference<List<StoredEvent<E>>> log = storage.get(streamId);
        return log == null ? Collections.emptyList() : log.get();
    }

    @Override
    public List<StoredEvent<E>> fetchAllEvents(String aggregateType) {
        List<StoredEvent<E>> result = new ArrayList<>();
        for (Map.Entry<StreamId, AtomicReference<List<StoredEvent<E>>>> entry : storage.entrySet()) {
            if (entry.getKey().getAggregateType().equals(aggregateType)) {
                result.addAll(entry.getValue().get());
            }
        }
        result.sort(Comparator.comparingLong(StoredEvent::getPosition));
        return result;
    }

    @Override
    public List<StoredEvent<E>> save(StreamId streamId, long expectedVersion, List<? extends E> events)
            throws EventStoreException {
        if (expectedVersion < 0) {
            throw EventStoreException.invalidVersion(streamId, expectedVersion);
        }
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        AtomicReference<List<StoredEvent<E>>> log = streamLog(streamId);
        List<StoredEvent<E>> current = log.get();
        if (current.size() != expectedVersion) {
            throw EventStoreException.optimisticLock(streamId, current.size(), expectedVersion);
        }
        Instant now = clock.instant();
        List<StoredEvent<E>> appended = new ArrayList<>(events.size());
        long sequence = expectedVersion;
        for (E event : events) {
            appended.add(new StoredEvent<>(streamId, ++sequence, EventType.of(event), event, now,
                positions.incrementAndGet()));
        }
        List<StoredEvent<E>> next = new ArrayList<>(current.size() + appended.size());
        next.addAll(current);
        next.addAll(appended);
        if (!log.compareAndSet(current, Collections.unmodifiableList(next))) {
            throw EventStoreException.optimisticLock(streamId, expectedVersion);
        }
        return Collections.unmodifiableList(appended);
    }

    @Override
    public long currentVersion(StreamId streamId) {
        return fetchEvents(streamId).size();
    }
}
