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

import io.github.goodees.decider.core.store.StoredEvent;

import java.util.Optional;

/**
 * Selects the start events that require background work and copies the data the work needs out of them. The work
 * never gets a reference to the event itself.
 * @param <E> event type
 * @param <P> parameters of the work
 */
@FunctionalInterface
public interface ParamsExtractor<E, P> {

    /**
     * @param event a persisted event, with the stream it belongs to
     * @return parameters of the work, or empty if the event does not start any
     */
    Optional<P> extract(StoredEvent<? extends E> event);
}
