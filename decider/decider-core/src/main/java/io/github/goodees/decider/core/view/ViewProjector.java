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

import io.github.goodees.decider.core.store.EventStore;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.StoredEvent;
import io.github.goodees.decider.core.store.StreamId;

import java.util.List;
import java.util.Objects;

/**
 * Computes a {@link View} from the current contents of an event store. Every call replays; caching is left to
 * callers, see {@link io.github.goodees.decider.core.cache.QueryResultCache}.
 * @param <S> state of the view
 * @param <E> event type
 */
public class ViewProjector<S, E> {
    private final View<S, ? super E> view;
    private final EventStore<E> eventStore;

    public ViewProjector(View<S, ? super E> view, EventStore<E> eventStore) {
        this.view = Objects.requireNonNull(view, "View must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
    }

    public S forStream(StreamId streamId) throws EventStoreException {
        return project(eventStore.fetchEvents(streamId));
    }

    public S forAggregateType(String aggregateType) throws EventStoreException {
        return project(eventStore.fetchAllEvents(aggregateType));
    }

    private S project(List<StoredEvent<E>> stored) {
        S state = view.initialState();
        for (StoredEvent<E> event : stored) {
            state = view.evolve(state, event.getEvent());
        }
        return state;
    }
}
