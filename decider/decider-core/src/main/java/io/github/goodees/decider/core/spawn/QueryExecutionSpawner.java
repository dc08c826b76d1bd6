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

import io.github.goodees.decider.core.aggregate.EventSourcedAggregate;
import io.github.goodees.decider.core.error.CommandRejectedException;
import io.github.goodees.decider.core.error.Futures;
import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Commit-then-execute: the start command is persisted first and the caller gets its events right away, the actual
 * work runs in background.
 *
 * <h2>Execution</h2>
 * For every persisted event the {@link ParamsExtractor} accepts, one execution is spawned on the work executor:
 * <ol>
 * <li>The begin command is handled by the host aggregate. If it is rejected or conflicts, the execution stops
 * with {@link Outcome#ABANDONED}</li>
 * <li>{@link QueryWork} computes the result</li>
 * <li>On success the complete command is handled, on failure the fail command with the error description</li>
 * <li>When the work does not finish within the timeout, it is interrupted and the fail command reports the
 * timeout</li>
 * <li>When the work cannot be scheduled after execution began, the fail command reports that</li>
 * </ol>
 * <p>Nothing of this is reported to the caller of {@link #startAndSpawn(Object)}; failures are logged. Observers
 * learn about progress from the host aggregate's events.</p>
 *
 * @param <C> command type of host aggregate
 * @param <E> event type of host aggregate
 * @param <P> parameters of the work
 * @param <T> result of the work
 */
public class QueryExecutionSpawner<C, E, P, T> {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutionSpawner.class);

    private final EventSourcedAggregate<C, ?, E, ?> aggregate;
    private final ParamsExtractor<? super E, P> extractor;
    private final FollowUpCommands<P, T, C> commands;
    private final QueryWork<? super P, ? extends T> work;
    private final ExecutorService workExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration timeout;

    private QueryExecutionSpawner(Builder<C, E, P, T> builder) {
        this.aggregate = Objects.requireNonNull(builder.aggregate, "Host aggregate must be specified");
        this.extractor = Objects.requireNonNull(builder.extractor, "Params extractor must be specified");
        this.commands = Objects.requireNonNull(builder.commands, "Follow-up commands must be specified");
        this.work = Objects.requireNonNull(builder.work, "Work must be specified");
        this.workExecutor = Objects.requireNonNull(builder.workExecutor, "Work executor must be specified");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "Scheduler must be specified");
        this.clock = Objects.requireNonNull(builder.clock, "Clock must be specified");
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout must be specified");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, was " + timeout);
        }
    }

    public static <C, E, P, T> Builder<C, E, P, T> builder(EventSourcedAggregate<C, ?, E, ?> aggregate) {
        return new Builder<>(aggregate);
    }

    /**
     * Handle the start command and spawn executions for the events it produced.
     * @param startCommand the command
     * @return the persisted events and the spawned executions
     * @throws CommandRejectedException when the start command is rejected, nothing is spawned then
     * @throws EventStoreException when the start events could not be stored, nothing is spawned then
     */
    public Started<E> startAndSpawn(C startCommand) throws CommandRejectedException, EventStoreException {
        List<StoredEvent<E>> events = aggregate.handleNow(startCommand);
        List<CompletableFuture<Outcome>> executions = new ArrayList<>();
        for (StoredEvent<E> event : events) {
            Optional<P> params = extractor.extract(event);
            params.ifPresent(p -> executions.add(spawn(p)));
        }
        return new Started<>(events, executions);
    }

    /**
     * Spawn execution directly, e. g. when resuming executions after restart.
     * @param params parameters of the work
     * @return future outcome. It never completes exceptionally
     */
    public CompletableFuture<Outcome> spawn(P params) {
        logger.debug("Spawning execution for {}", params);
        try {
            return CompletableFuture.supplyAsync(() -> issue("begin", params, () -> commands.begin(params, now())),
                workExecutor).thenCompose(begun -> begun ? execute(params) : abandoned())
                    .exceptionally(t -> {
                        logger.error("Execution for {} could not be run", params, Futures.unwrap(t));
                        return Outcome.ABANDONED;
                    });
        } catch (RejectedExecutionException e) {
            logger.error("Execution for {} could not be spawned", params, e);
            return abandoned();
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static CompletableFuture<Outcome> abandoned() {
        return CompletableFuture.completedFuture(Outcome.ABANDONED);
    }

    private CompletableFuture<Outcome> execute(P params) {
        Instant start = clock.instant();
        try {
            return compute(params).handleAsync((result, failure) -> finish(params, start, result, failure),
                workExecutor);
        } catch (RejectedExecutionException e) {
            // execution already began, so it must not stay in progress
            logger.error("Work for {} could not be scheduled", params, e);
            issue("fail", params, () -> commands.fail(params, "execution could not be scheduled: " + describe(e),
                now()));
            return CompletableFuture.completedFuture(Outcome.FAILED);
        }
    }

    private CompletableFuture<T> compute(P params) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task = workExecutor.submit(() -> {
            try {
                result.complete(work.execute(params));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(() -> {
                if (result.completeExceptionally(new TimeoutException("execution timed out after " + timeout))) {
                    task.cancel(true);
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            task.cancel(true);
            throw e;
        }
        result.whenComplete((r, t) -> timer.cancel(false));
        return result;
    }

    private Outcome finish(P params, Instant start, T result, Throwable failure) {
        if (failure == null) {
            Duration duration = Duration.between(start, clock.instant());
            if (issue("complete", params, () -> commands.complete(params, result, duration, now()))) {
                logger.info("Execution for {} completed in {} ms", params, duration.toMillis());
                return Outcome.COMPLETED;
            }
            return Outcome.ABANDONED;
        }
        Throwable cause = Futures.unwrap(failure);
        if (cause instanceof TimeoutException) {
            logger.warn("Execution for {} timed out after {}", params, timeout);
            issue("fail", params, () -> commands.fail(params, cause.getMessage(), now()));
            return Outcome.TIMED_OUT;
        }
        logger.warn("Execution for {} failed", params, cause);
        issue("fail", params, () -> commands.fail(params, describe(cause), now()));
        return Outcome.FAILED;
    }

    private boolean issue(String stage, P params, Supplier<C> command) {
        try {
            aggregate.handleNow(command.get());
            logger.debug("Execution for {}: {} recorded", params, stage);
            return true;
        } catch (CommandRejectedException | EventStoreException e) {
            logger.error("Execution for {}: {} command failed with {} (error id {})", params, stage, e.getCode(),
                e.getErrorId(), e);
        } catch (RuntimeException e) {
            logger.error("Execution for {}: {} command failed", params, stage, e);
        }
        return false;
    }

    private Instant now() {
        return clock.instant();
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    /**
     * Result of the start: what was persisted and what was spawned.
     * @param <E> event type
     */
    public static class Started<E> {
        private final List<StoredEvent<E>> events;
        private final List<CompletableFuture<Outcome>> executions;

        Started(List<StoredEvent<E>> events, List<CompletableFuture<Outcome>> executions) {
            this.events = events;
            this.executions = Collections.unmodifiableList(executions);
        }

        public List<StoredEvent<E>> getEvents() {
            return events;
        }

        public List<CompletableFuture<Outcome>> getExecutions() {
            return executions;
        }

        /**
         * Future completing when all spawned executions ended.
         */
        public CompletableFuture<Void> allFinished() {
            return CompletableFuture.allOf(executions.toArray(new CompletableFuture[0]));
        }
    }

    public static class Builder<C, E, P, T> {
        private final EventSourcedAggregate<C, ?, E, ?> aggregate;
        private ParamsExtractor<? super E, P> extractor;
        private FollowUpCommands<P, T, C> commands;
        private QueryWork<? super P, ? extends T> work;
        private ExecutorService workExecutor;
        private ScheduledExecutorService scheduler;
        private Clock clock = Clock.systemUTC();
        private Duration timeout = DEFAULT_TIMEOUT;

        Builder(EventSourcedAggregate<C, ?, E, ?> aggregate) {
            this.aggregate = aggregate;
        }

        public Builder<C, E, P, T> extractor(ParamsExtractor<? super E, P> extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder<C, E, P, T> commands(FollowUpCommands<P, T, C> commands) {
            this.commands = commands;
            return this;
        }

        public Builder<C, E, P, T> work(QueryWork<? super P, ? extends T> work) {
            this.work = work;
            return this;
        }

        public Builder<C, E, P, T> workExecutor(ExecutorService workExecutor) {
            this.workExecutor = workExecutor;
            return this;
        }

        public Builder<C, E, P, T> scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder<C, E, P, T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<C, E, P, T> timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public QueryExecutionSpawner<C, E, P, T> build() {
            return new QueryExecutionSpawner<>(this);
        }
    }
}
