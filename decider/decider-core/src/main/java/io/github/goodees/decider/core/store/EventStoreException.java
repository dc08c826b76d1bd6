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

import io.github.goodees.decider.core.error.AggregateException;
import io.github.goodees.decider.core.error.ErrorCode;

/**
 * Failure of an {@link EventStore}. The {@link Fault} tells whether the operation can be retried.
 */
public class EventStoreException extends AggregateException {
    private final Fault fault;
    private final String aggregateType;
    private final String aggregateId;

    public enum Fault {
        /** Stream advanced past the version the events were decided against. */
        OPTIMISTIC_LOCK(ErrorCode.CONFLICT),
        /** Storage transaction failed. */
        TX_ERROR(ErrorCode.INTERNAL_ERROR),
        /** The store was used incorrectly or could not (de)serialize an event. */
        PROGRAMMATIC_ERROR(ErrorCode.INTERNAL_ERROR),
        /** The store is unreachable. */
        UNAVAILABLE(ErrorCode.SERVICE_UNAVAILABLE);

        private final ErrorCode code;

        Fault(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    protected EventStoreException(Fault type, StreamId streamId, String message, Throwable cause) {
        super(type.getCode(), message, cause);
        this.fault = type;
        this.aggregateType = streamId != null ? streamId.getAggregateType() : null;
        this.aggregateId = streamId != null ? streamId.getAggregateId() : null;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isConflict() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public static EventStoreException optimisticLock(StreamId streamId, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, streamId, "Stream " + streamId
                + " advanced past version " + expectedVersion + " by a concurrent write", null);
    }

    public static EventStoreException optimisticLock(StreamId streamId, long actualVersion, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, streamId, "Stream " + streamId
                + " storing events based on version " + expectedVersion + " attempted while last known version is "
                + actualVersion, null);
    }

    public static EventStoreException optimisticLock(StreamId streamId, long expectedVersion, Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, streamId, "Stream " + streamId
                + " already contains events past version " + expectedVersion, cause);
    }

    public static EventStoreException storeFailed(StreamId streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, streamId,
            "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, null, "Reading " + what + " failed. " + cause.getMessage(),
            cause);
    }

    public static EventStoreException unavailable(String what, Throwable cause) {
        return new EventStoreException(Fault.UNAVAILABLE, null, "Event store is unavailable: " + what, cause);
    }

    public static EventStoreException invalidVersion(StreamId streamId, long expectedVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, streamId, "Stream " + streamId
                + " cannot be written at negative version " + expectedVersion, null);
    }

    public static EventStoreException unsupported(StreamId streamId, Object event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, streamId, "Unsupported event type: " + event, null);
    }

    public static EventStoreException unserializable(StreamId streamId, Object event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, streamId, "Could not serialize event " + event,
                cause);
    }

    public static EventStoreException undeserializable(StreamId streamId, long sequence, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, streamId, "Could not deserialize event " + sequence
                + " of stream " + streamId, cause);
    }
}
