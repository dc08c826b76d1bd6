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

import java.util.function.Consumer;

/**
 * Publish/subscribe transport with hierarchical topics, see {@link KeyExpressions} for pattern syntax.
 * <p>Delivery is best-effort and at-least-once. Ordering is only meaningful within one topic prefix of single
 * stream, there is no ordering across streams.</p>
 */
public interface EventBus extends AutoCloseable {

    /**
     * Hand message over for delivery to all matching subscriptions. Does not wait for listeners.
     * @param message the message
     * @throws EventBusException when the bus cannot accept messages
     */
    void publish(BusMessage message) throws EventBusException;

    /**
     * Register listener for topics matching the pattern.
     * @param pattern topic pattern
     * @param listener receiver of messages
     * @return the subscription
     * @throws EventBusException when the bus cannot accept subscriptions
     */
    Subscription subscribe(String pattern, Consumer<BusMessage> listener) throws EventBusException;

    @Override
    void close();
}
