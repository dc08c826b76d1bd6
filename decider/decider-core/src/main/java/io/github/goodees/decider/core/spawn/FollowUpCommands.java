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

import java.time.Duration;
import java.time.Instant;

/**
 * Factory of commands a spawned execution sends back through the host aggregate. Timestamps are supplied by the
 * spawner's clock, deciders never read a clock themselves.
 * @param <P> parameters of the work
 * @param <T> result of the work
 * @param <C> command type of the host aggregate
 */
public interface FollowUpCommands<P, T, C> {

    C begin(P params, Instant beganAt);

    C complete(P params, T result, Duration duration, Instant completedAt);

    C fail(P params, String error, Instant failedAt);
}
