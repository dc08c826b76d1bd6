package io.github.goodees.decider.core;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of {@link Decider#decide(Object, Object)}. Either accepted with a (possibly empty) list of events, or
 * rejected with an error. An accepted decision with no events is a valid no-op.
 * @param <E> event type
 * @param <R> error type
 */
public final class Decision<E, R> {
    private static final Decision<?, ?> NONE = new Decision<>(Collections.emptyList(), null);

    private final List<E> events;
    private final R error;

    private Decision(List<E> events, R error) {
        this.events = events;
        this.error = error;
    }

    @SafeVarargs
    public static <E, R> Decision<E, R> accept(E... events) {
        return accept(Arrays.asList(events));
    }

    public static <E, R> Decision<E, R> accept(List<? extends E> events) {
        Objects.requireNonNull(events, "Events must be specified");
        if (events.isEmpty()) {
            return none();
        }
        return new Decision<>(Collections.unmodifiableList(new ArrayList<>(events)), null);
    }

    /**
     * Accepted decision without any events.
     * @return no-op decision
     */
    public static <E, R> Decision<E, R> none() {
        return (Decision<E, R>) NONE;
    }

    public static <E, R> Decision<E, R> reject(R error) {
        return new Decision<>(Collections.emptyList(), Objects.requireNonNull(error, "Error must be specified"));
    }

    public boolean isRejected() {
        return error != null;
    }

    public boolean isNoop() {
        return error == null && events.isEmpty();
    }

    public List<E> getEvents() {
        return events;
    }

    /**
     * The error of rejected decision.
     * @return the error, or null when decision was accepted
     */
    public R getError() {
        return error;
    }

    public <E2> Decision<E2, R> mapEvents(Function<? super E, ? extends E2> mapper) {
        if (isRejected()) {
            return reject(error);
        }
        List<E2> mapped = new ArrayList<>(events.size());
        for (E event : events) {
            mapped.add(mapper.apply(event));
        }
        return accept(mapped);
    }

    public <R2> Decision<E, R2> mapError(Function<? super R, ? extends R2> mapper) {
        if (isRejected()) {
            return reject(mapper.apply(error));
        }
        return accept(events);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Decision<?, ?> decision = (Decision<?, ?>) o;
        return events.equals(decision.events) && Objects.equals(error, decision.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(events, error);
    }

    @Override
    public String toString() {
        return isRejected() ? "Decision{rejected=" + error + '}' : "Decision{events=" + events + '}';
    }
}
