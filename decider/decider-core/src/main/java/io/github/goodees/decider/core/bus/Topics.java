package io.github.goodees.decider.core.bus;

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

import io.github.goodees.decider.core.store.StreamId;

import java.util.Objects;

/**
 * Construction of hierarchical bus topics. Topics of stored events have form
 * {@code {root}/{aggregateType}/{aggregateId}/{sequence}}. Segments are separated by {@code /}; {@code *} and
 * {@code **} are wildcards reserved for patterns and may not appear in literal segments.
 */
public final class Topics {
    /** Default root of event topics. */
    public static final String EVENTS_ROOT = "events";

    /** Pattern of every event published under the default root. */
    public static final String ALL_EVENTS = EVENTS_ROOT + "/**";

    private Topics() {

    }

    public static String eventTopic(String root, String aggregateType, String aggregateId, long sequence) {
        return literal(root) + "/" + literal(aggregateType) + "/" + literal(aggregateId) + "/" + sequence;
    }

    public static String eventTopic(String aggregateType, String aggregateId, long sequence) {
        return eventTopic(EVENTS_ROOT, aggregateType, aggregateId, sequence);
    }

    public static String eventTopic(String root, StreamId streamId, long sequence) {
        return eventTopic(root, streamId.getAggregateType(), streamId.getAggregateId(), sequence);
    }

    /**
     * Pattern of all events of an aggregate type, any instance and sequence.
     */
    public static String aggregatePattern(String aggregateType) {
        return aggregatePattern(EVENTS_ROOT, aggregateType);
    }

    public static String aggregatePattern(String root, String aggregateType) {
        return literal(root) + "/" + literal(aggregateType) + "/**";
    }

    /**
     * Pattern of all events of single aggregate instance.
     */
    public static String instancePattern(String aggregateType, String aggregateId) {
        return instancePattern(EVENTS_ROOT, aggregateType, aggregateId);
    }

    public static String instancePattern(String root, String aggregateType, String aggregateId) {
        return literal(root) + "/" + literal(aggregateType) + "/" + literal(aggregateId) + "/*";
    }

    public static String allEvents(String root) {
        return literal(root) + "/**";
    }

    static String literal(String segment) {
        Objects.requireNonNull(segment, "Topic segment must be specified");
        if (segment.isEmpty() || segment.indexOf('/') >= 0 || segment.indexOf('*') >= 0) {
            throw new IllegalArgumentException("Topic segment must be non-empty and may not contain '/' or '*': "
                    + segment);
        }
        return segment;
    }
}
