package io.github.goodees.decider.core.bus;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Announces stored events on an {@link EventBus} under topic {@code {root}/{type}/{id}/{sequence}}. The payload is
 * the {@link StoredEvent}.
 * <p>Publication is fire-and-forget: the events are already durable, so failures are logged and reported by return
 * value only.</p>
 * @param <E> event type
 */
public class EventPublisher<E> {
    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final EventBus bus;
    private final String root;

    public EventPublisher(EventBus bus) {
        this(bus, Topics.EVENTS_ROOT);
    }

    public EventPublisher(EventBus bus, String root) {
        this.bus = Objects.requireNonNull(bus, "Event bus must be specified");
        this.root = Topics.literal(root);
    }

    /**
     * Publish single stored event.
     * @param event the event
     * @return true if the bus accepted the message
     */
    public boolean publish(StoredEvent<? extends E> event) {
        String topic = Topics.eventTopic(root, event.getStreamId(), event.getSequence());
        try {
            bus.publish(new BusMessage(topic, event));
            logger.debug("Published {}", topic);
            return true;
        } catch (EventBusException e) {
            logger.warn("Could not publish event {} (error id {})", topic, e.getErrorId(), e);
            return false;
        }
    }
}
