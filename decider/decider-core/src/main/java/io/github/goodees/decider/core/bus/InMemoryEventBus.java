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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Event bus within single process. Every subscription has its own mailbox, which is drained by at most one task
 * of the bus' executor at a time. Slow listeners therefore never hold up publishers, and each listener sees
 * messages in the order they were published, however many threads the executor has. Listener exceptions are
 * logged.
 */
public class InMemoryEventBus implements EventBus {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final ExecutorService executor;
    private final List<LocalSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public InMemoryEventBus(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "Executor service must be specified");
    }

    @Override
    public void publish(BusMessage message) throws EventBusException {
        Objects.requireNonNull(message, "Message must be specified");
        if (closed) {
            throw EventBusException.closed();
        }
        for (LocalSubscription subscription : subscriptions) {
            if (KeyExpressions.matches(subscription.pattern, message.getTopic())) {
                subscription.enqueue(message);
            }
        }
    }

    @Override
    public Subscription subscribe(String pattern, Consumer<BusMessage> listener) throws EventBusException {
        Objects.requireNonNull(pattern, "Pattern must be specified");
        Objects.requireNonNull(listener, "Listener must be specified");
        if (closed) {
            throw EventBusException.closed();
        }
        LocalSubscription subscription = new LocalSubscription(pattern, listener);
        subscriptions.add(subscription);
        logger.debug("Subscribed to {}", pattern);
        return subscription;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Stop accepting messages and subscriptions. The executor is owned by the caller and is not shut down.
     */
    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
    }

    private class LocalSubscription implements Subscription, Runnable {
        private final String pattern;
        private final Consumer<BusMessage> listener;
        private final Queue<BusMessage> mailbox = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean();
        private volatile boolean active = true;

        LocalSubscription(String pattern, Consumer<BusMessage> listener) {
            this.pattern = pattern;
            this.listener = listener;
        }

        /**
         * Add message to the mailbox, and schedule draining unless it is already scheduled or running.
         */
        void enqueue(BusMessage message) throws EventBusException {
            mailbox.add(message);
            if (scheduled.compareAndSet(false, true)) {
                try {
                    executor.execute(this);
                } catch (RejectedExecutionException e) {
                    scheduled.set(false);
                    mailbox.remove(message);
                    throw EventBusException.unavailable("delivery of " + message.getTopic() + " rejected", e);
                }
            }
        }

        @Override
        public void run() {
            do {
                BusMessage message;
                while ((message = mailbox.poll()) != null) {
                    deliver(message);
                }
                scheduled.set(false);
                // a message added between the last poll and clearing the flag was not scheduled by its publisher
            } while (!mailbox.isEmpty() && scheduled.compareAndSet(false, true));
        }

        private void deliver(BusMessage message) {
            if (!active) {
                return;
            }
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                logger.warn("Listener of {} failed to process {}", pattern, message, e);
            }
        }

        @Override
        public String getPattern() {
            return pattern;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            subscriptions.remove(this);
            mailbox.clear();
        }
    }
}
