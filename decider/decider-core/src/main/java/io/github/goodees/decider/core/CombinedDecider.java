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

/**
 * Product of two deciders sharing an error type. Each half of the state is only passed to its own decider, and
 * events of one side never touch the other side of the pair.
 * @see Decider#combine(Decider, Decider)
 */
final class CombinedDecider<C1, S1, E1, C2, S2, E2, R>
        implements Decider<Sum<C1, C2>, Pair<S1, S2>, Sum<E1, E2>, R> {
    private final Decider<C1, S1, E1, R> first;
    private final Decider<C2, S2, E2, R> second;

    CombinedDecider(Decider<C1, S1, E1, R> first, Decider<C2, S2, E2, R> second) {
        this.first = Objects.requireNonNull(first, "First decider must be specified");
        this.second = Objects.requireNonNull(second, "Second decider must be specified");
    }

    @Override
    public Decision<Sum<E1, E2>, R> decide(Sum<C1, C2> command, Pair<S1, S2> state) {
        return command.fold(
            c1 -> first.decide(c1, state.first()).<Sum<E1, E2>>mapEvents(Sum::first),
            c2 -> second.decide(c2, state.second()).<Sum<E1, E2>>mapEvents(Sum::second));
    }

    @Override
    public Pair<S1, S2> evolve(Pair<S1, S2> state, Sum<E1, E2> event) {
        return event.fold(
            e1 -> state.withFirst(first.evolve(state.first(), e1)),
            e2 -> state.withSecond(second.evolve(state.second(), e2)));
    }

    @Override
    public Pair<S1, S2> initialState() {
        return Pair.of(first.initialState(), second.initialState());
    }
}
