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

import java.util.Objects;

/**
 * Identity of one append-only stream: the aggregate type and the id of an aggregate instance.
 * <p>Both parts become segments of bus topics, therefore they may not be empty and may contain neither {@code /}
 * nor {@code *}.
 */
public final class StreamId {
    private final String aggregateType;
    private final String aggregateId;

    private StreamId(String aggregateType, String aggregateId) {
        this.aggregateType = requireSegment(aggregateType, "Aggregate type");
        this.aggregateId = requireSegment(aggregateId, "Aggregate id");
    }

    public static StreamId of(String aggregateType, String aggregateId) {
        return new StreamId(aggregateType, aggregateId);
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    static String requireSegment(String value, String what) {
        Objects.requireNonNull(value, what + " must be specified");
        if (value.isEmpty() || value.indexOf('/') >= 0 || value.indexOf('*') >= 0) {
            throw new IllegalArgumentException(what + " must be non-empty and may not contain '/' or '*': "
                    + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        StreamId that = (StreamId) o;
        return aggregateType.equals(that.aggregateType) && aggregateId.equals(that.aggregateId);
    }

    @Override
    public int hashCode() {
        return 31 * aggregateType.hashCode() + aggregateId.hashCode();
    }

    @Override
    public String toString() {
        return aggregateType + "/" + aggregateId;
    }
}
