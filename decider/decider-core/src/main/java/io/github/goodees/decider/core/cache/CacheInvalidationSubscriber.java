package io.github.goodees.decider.core.cache;

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
import io.github.goodees.decider.core.bus.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Feeds topics of all published events into a {@link CacheInvalidationRegistry}.
 * <p>Invalidation starts with {@link #start()}. Events published before that are not seen, entries cached before
 * them stay until they expire. When subscription fails, the process continues without automatic invalidation and
 * relies on expiration alone.</p>
 */
public class CacheInvalidationSubscriber implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheInvalidationSubscriber.class);

    private final CacheInvalidationRegistry registry;
    private final EventBus bus;
    private final String pattern;
    private volatile Subscription subscription;

    public CacheInvalidationSubscriber(CacheInvalidationRegistry registry, EventBus bus) {
        this(registry, bus, Topics.ALL_EVENTS);
    }

    public CacheInvalidationSubscriber(CacheInvalidationRegistry registry, EventBus bus, String pattern) {
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        this.bus = Objects.requireNonNull(bus, "Event bus must be specified");
        this.pattern = Objects.requireNonNull(pattern, "Pattern must be specified");
    }

    /**
     * Subscribe to the bus.
     * @return false if subscription failed and invalidation is disabled
     */
    public synchronized boolean start() {
        if (subscription != null) {
            return true;
        }
        try {
            subscription = bus.subscribe(pattern, this::onMessage);
            logger.info("Cache invalidation subscribed to {} with {} dependencies", pattern,
                registry.getDependencies().size());
            return true;
        } catch (EventBusException e) {
            logger.error("Cache invalidation could not subscribe to {} (error id {}). Cached query results will "
                    + "only expire", pattern, e.getErrorId(), e);
            return false;
        }
    }

    public boolean isActive() {
        Subscription s = subscription;
        return s != null && s.isActive();
    }

    void onMessage(BusMessage message) {
        try {
            registry.processEvent(message.getTopic());
        } catch (RuntimeException e) {
            logger.warn("Cache invalidation for {} failed", message.getTopic(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
