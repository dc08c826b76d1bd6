package io.github.goodees.decider.core.view;

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
import java.util.function.BiFunction;

/**
 * Read model derived purely from events. Evolution must be total: events the view is not interested in leave the
 * state unchanged.
 * @param <S> state of the view
 * @param <E> event type
 */
public interface View<S, E> {

    S initialState();

    S evolve(S state, E event);

    /**
     * Fold events from initial state.
     * @param events events in order they were stored
     * @return the state of the view
     */
    default S compute(Iterable<? extends E> events) {
        return computeFrom(initialState(), events);
    }

    /**
     * Continue folding from already computed state. {@code computeFrom(compute(a), b)} equals
     * {@code compute(a ++ b)}.
     * @param state state computed from earlier events
     * @param events subsequent events
     * @return the state of the view
     */
    default S computeFrom(S state, Iterable<? extends E> events) {
        S result = state;
        for (E event : events) {
            result = evolve(result, event);
        }
        return result;
    }

    static <S, E> View<S, E> of(S initialState, BiFunction<S, E, S> evolve) {
        Objects.requireNonNull(evolve, "Evolve function must be specified");
        return new View<S, E>() {
            @Override
            public S initialState() {
                return initialState;
            }

            @Override
            public S evolve(S state, E event) {
                return evolve.apply(state, event);
            }
        };
    }
}
