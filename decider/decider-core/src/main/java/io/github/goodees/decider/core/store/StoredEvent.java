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

import java.time.Instant;
import java.util.Objects;

/**
 * Event as recorded in a stream. Immutable once written.
 * <p>{@link #getSequence()} is the version token of the stream after this event; it is what the next write to the
 * stream has to be based on.
 * @param <E> event type
 */
public final class StoredEvent<E> {
    private final StreamId streamId;
    private final long sequence;
    private final String eventType;
    private final E event;
    private final Instant recordedAt;
    private final long position;

    /**
     * Create record of a stored event.
     * @param streamId stream the event belongs to
     * @param sequence position within the stream, starting at 1
     * @param eventType type name of the event
     * @param event the event
     * @param recordedAt time of the write
     * @param position store-wide insertion order
     */
    public StoredEvent(StreamId streamId, long sequence, String eventType, E event, Instant recordedAt,
            long position) {
        this.streamId = Objects.requireNonNull(streamId, "Stream id must be specified");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence starts at 1, was " + sequence);
        }
        this.sequence = sequence;
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.event = Objects.requireNonNull(event, "Event must be specified");
        this.recordedAt = Objects.requireNonNull(recordedAt, "Record time must be specified");
        this.position = position;
    }

    public StreamId getStreamId() {
        return streamId;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Version token for optimistic concurrency. Same as sequence.
     * @return the version of the stream after this event
     */
    public long getVersion() {
        return sequence;
    }

    public String getEventType() {
        return eventType;
    }

    public E getEvent() {
        return event;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public long getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        StoredEvent<?> that = (StoredEvent<?>) o;
        return sequence == that.sequence && position == that.position && streamId.equals(that.streamId)
                && eventType.equals(that.eventType) && event.equals(that.event)
                && recordedAt.equals(that.recordedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, sequence);
    }

    @Override
    public String toString() {
        return "StoredEvent{" + streamId + "#" + sequence + ", type=" + eventType + ", event=" + event
                + ", recordedAt=" + recordedAt + '}';
    }
}
