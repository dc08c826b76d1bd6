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

import io.github.goodees.decider.core.Sum;

import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the stream a command targets. This is all the runtime needs to know about the shape of commands.
 * @param <C> command type
 */
@FunctionalInterface
public interface StreamIdentity<C> {

    StreamId streamOf(C command);

    /**
     * Identity of commands of single aggregate type, whose id is extracted by {@code idOf}.
     * @param aggregateType the type of all streams
     * @param idOf extraction of the aggregate id
     * @return stream identity
     */
    static <C> StreamIdentity<C> of(String aggregateType, Function<? super C, String> idOf) {
        Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        Objects.requireNonNull(idOf, "Id extractor must be specified");
        return command -> StreamId.of(aggregateType, idOf.apply(command));
    }

    /**
     * Identity of commands of a combined decider, delegating to the identity of the tagged half.
     */
    static <C1, C2> StreamIdentity<Sum<C1, C2>> combine(StreamIdentity<C1> first, StreamIdentity<C2> second) {
        Objects.requireNonNull(first, "First identity must be specified");
        Objects.requireNonNull(second, "Second identity must be specified");
        return command -> command.fold(first::streamOf, second::streamOf);
    }
}
