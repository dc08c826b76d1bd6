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
 * Decider translating errors of a wrapped decider. Commands, state and events pass through untouched.
 * @see Decider#mapError(Function)
 */
final class MappedErrorDecider<C, S, E, R, R2> implements Decider<C, S, E, R2> {
    private final Decider<C, S, E, R> delegate;
    private final Function<? super R, ? extends R2> mapper;

    MappedErrorDecider(Decider<C, S, E, R> delegate, Function<? super R, ? extends R2> mapper) {
        this.delegate = Objects.requireNonNull(delegate, "Decider must be specified");
        this.mapper = Objects.requireNonNull(mapper, "Error mapper must be specified");
    }

    @Override
    public Decision<E, R2> decide(C command, S state) {
        return delegate.decide(command, state).mapError(mapper);
    }

    @Override
    public S evolve(S state, E event) {
        return delegate.evolve(state, event);
    }

    @Override
    public S initialState() {
        return delegate.initialState();
    }
}
