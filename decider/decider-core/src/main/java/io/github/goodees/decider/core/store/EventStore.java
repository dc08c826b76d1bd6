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

import java.util.List;

/**
 * Append-only log of events, keyed by {@link StreamId}.
 * <p>Implementations allocate sequence numbers atomically and without gaps per stream, and guarantee
 * read-your-writes within a stream. Concurrent writers of single stream race: for given sequence exactly one
 * append succeeds, the other one is rejected in its entirety with
 * {@linkplain EventStoreException.Fault#OPTIMISTIC_LOCK optimistic lock} fault. The store never retries, as retry
 * requires re-running business logic against fresh state.</p>
 * @param <E> event type
 */
public interface EventStore<E> {

    /**
     * Full ordered history of a stream.
     * @param streamId the stream
     * @return stored events in sequence order, empty list for stream without history
     * @throws EventStoreException when the store cannot be read
     */
    List<StoredEvent<E>> fetchEvents(StreamId streamId) throws EventStoreException;

    /**
     * History of a stream together with the stream's version. The version is the sequence of the last stored event,
     * even if the store could not read that event and left it out of the history.
     * @param streamId the stream
     * @return the history
     * @throws EventStoreException when the store cannot be read
     */
    default EventHistory<E> fetchHistory(StreamId streamId) throws EventStoreException {
        return EventHistory.of(fetchEvents(streamId));
    }

    /**
     * History of the stream a command targets. This is what a command has to be decided against, its
     * {@linkplain EventHistory#getVersion() version} is what the resulting events have to be saved at.
     * @param command the command
     * @param identity resolution of the command's stream
     * @return stored events in sequence order and the version of the stream
     * @throws EventStoreException when the store cannot be read
     */
    default <C> EventHistory<E> fetchEvents(C command, StreamIdentity<? super C> identity)
            throws EventStoreException {
        return fetchHistory(identity.streamOf(command));
    }

    /**
     * Events of all streams of an aggregate type, in insertion order.
     * @param aggregateType the aggregate type
     * @return stored events
     * @throws EventStoreException when the store cannot be read
     */
    List<StoredEvent<E>> fetchAllEvents(String aggregateType) throws EventStoreException;

    /**
     * Append events to a stream. First event gets sequence {@code expectedVersion + 1}.
     * @param streamId target stream
     * @param expectedVersion version of the stream the events were decided against, 0 for new stream
     * @param events events to append, empty list results in no write
     * @return the stored events, in order
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} if the stream is no longer at expected version,
     *         other faults when storage fails
     */
    List<StoredEvent<E>> save(StreamId streamId, long expectedVersion, List<? extends E> events)
            throws EventStoreException;

    /**
     * Latest sequence of a stream.
     * @param streamId the stream
     * @return last sequence number, 0 for empty stream
     * @throws EventStoreException when the store cannot be read
     */
    long currentVersion(StreamId streamId) throws EventStoreException;
}
