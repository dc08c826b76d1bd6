package io.github.goodees.decider.core.spawn;

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

/**
 * The external computation performed by a spawned execution. It may block; it should respond to interruption,
 * which is how executions exceeding their timeout are cancelled.
 * @param <P> parameters
 * @param <T> result
 */
@FunctionalInterface
public interface QueryWork<P, T> {

    T execute(P params) throws Exception;
}
