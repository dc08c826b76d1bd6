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

import io.github.goodees.decider.core.bus.BusMessage;
import io.github.goodees.decider.core.bus.EventBus;
import io.github.goodees.decider.core.bus.EventBusException;
import io.github.goodees.decider.core.bus.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Bus that only records what was published. Can be switched to fail.
 */
public class RecordingEventBus implements EventBus {
    private final List<BusMessage> published = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void publish(BusMessage message) throws EventBusException {
        if (failing) {
            throw EventBusException.unavailable("test", null);
        }
        published.add(message);
    }

    @Override
    public Subscription subscribe(String pattern, Consumer<BusMessage> listener) throws EventBusException {
        throw EventBusException.unavailable("subscriptions not supported", null);
    }

    public List<BusMessage> getPublished() {
        return published;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void close() {
    }
}
