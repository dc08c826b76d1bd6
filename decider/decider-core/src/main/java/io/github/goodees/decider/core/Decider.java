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

import java.util.Objects;
import java.util.function.Function;

/**
 * Pure state machine describing the business rules of an aggregate. A decider never touches storage, the bus or
 * a clock: any timestamp it needs must be part of the command.
 * <p>Both {@link #decide(Object, Object)} and {@link #evolve(Object, Object)} must be total. Expected business
 * conditions are reported as a {@linkplain Decision#reject(Object) rejected decision}, never as an exception.
 *
 * <h2>Composition</h2>
 * {@link #mapError(Function)} translates the error type when deciders of different subsystems need to share an
 * error taxonomy, and {@link #combine(Decider, Decider)} builds a product of two independent deciders.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @param <R> error type
 */
public interface Decider<C, S, E, R> {

    /**
     * Decide which events the command results in.
     * @param command command to handle
     * @param state current state, as folded from the stream
     * @return accepted decision with zero or more events, or rejected decision with an error
     */
    Decision<E, R> decide(C command, S state);

    /**
     * Apply an event to a state. Must not fail for any event this decider could have produced.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     */
    S evolve(S state, E event);

    /**
     * State of a stream without any events.
     * @return the initial state
     */
    S initialState();

    /**
     * Left fold of events starting at {@link #initialState()}.
     * @param events events in stream order
     * @return resulting state
     */
    default S fold(Iterable<? extends E> events) {
        S state = initialState();
        for (E event : events) {
            state = evolve(state, event);
        }
        return state;
    }

    /**
     * Decider with the same behaviour, whose errors are translated by {@code mapper}.
     * @param mapper error translation, should keep identity of the error it wraps
     * @param <R2> new error type
     * @return wrapping decider
     */
    default <R2> Decider<C, S, E, R2> mapError(Function<? super R, ? extends R2> mapper) {
        return new MappedErrorDecider<>(this, mapper);
    }

    /**
     * Product of two deciders. Commands and events are tagged with {@link Sum}, the state is a {@link Pair} whose
     * halves are only ever seen by their own decider.
     * @param first decider handling {@link Sum.First} commands and events
     * @param second decider handling {@link Sum.Second} commands and events
     * @return combined decider
     */
    static <C1, S1, E1, C2, S2, E2, R> Decider<Sum<C1, C2>, Pair<S1, S2>, Sum<E1, E2>, R> combine(
            Decider<C1, S1, E1, R> first, Decider<C2, S2, E2, R> second) {
        return new CombinedDecider<>(first, second);
    }

    /**
     * Create decider out of three functions.
     * @param decide decision function
     * @param evolve evolution function
     * @param initialState initial state
     * @return decider delegating to the functions
     */
    static <C, S, E, R> Decider<C, S, E, R> of(DecideFunction<C, S, E, R> decide, EvolveFunction<S, E> evolve,
            S initialState) {
        Objects.requireNonNull(decide, "Decide function must be specified");
        Objects.requireNonNull(evolve, "Evolve function must be specified");
        return new Decider<C, S, E, R>() {
            @Override
            public Decision<E, R> decide(C command, S state) {
                return decide.decide(command, state);
            }

            @Override
            public S evolve(S state, E event) {
                return evolve.evolve(state, event);
            }

            @Override
            public S initialState() {
                return initialState;
            }
        };
    }

    @FunctionalInterface
    interface DecideFunction<C, S, E, R> {
        Decision<E, R> decide(C command, S state);
    }

    @FunctionalInterface
    interface EvolveFunction<S, E> {
        S evolve(S state, E event);
    }
}
