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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Events read from a stream, and the version of the stream at the time of the read.
 * <p>The version equals the sequence of the last event, unless the store skipped unreadable events. Then the
 * history is {@linkplain #isComplete() incomplete} and the version is still the one the next write must be based
 * on.</p>
 * @param <E> event type
 */
public final class EventHistory<E> implements Iterable<StoredEvent<E>> {
    private final List<StoredEvent<E>> events;
    private final long version;

    public EventHistory(List<StoredEvent<E>> events, long version) {
        this.events = Collections.unmodifiableList(Objects.requireNonNull(events, "Events must be specified"));
        long last = lastSequence(events);
        if (version < last) {
            throw new IllegalArgumentException("Version " + version + " is behind last event " + last);
        }
        this.version = version;
    }

    /**
     * History of events read without omissions.
     */
    public static <E> EventHistory<E> of(List<StoredEvent<E>> events) {
        return new EventHistory<>(events, lastSequence(events));
    }

    private static long lastSequence(List<? extends StoredEvent<?>> events) {
        return events.isEmpty() ? 0 : events.get(events.size() - 1).getSequence();
    }

    public List<StoredEvent<E>> getEvents() {
        return events;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Whether every stored event of the stream is in this history. Sequences are gap-free from 1, so any skipped
     * event shows as fewer events than the version.
     */
    public boolean isComplete() {
        return events.size() == version;
    }

    @Override
    public Iterator<StoredEvent<E>> iterator() {
        return events.iterator();
    }

    @Override
    public String toString() {
        return "EventHistory{" + events.size() + " events, version=" + version + '}';
    }
}
