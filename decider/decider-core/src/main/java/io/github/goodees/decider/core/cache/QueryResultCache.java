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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Cache of computed query results, keyed by strings. Keys are expected to be hierarchical, e. g.
 * {@code todo:count:abc}, so that whole families of results can be evicted by {@link #invalidatePrefix(String)}.
 */
public class QueryResultCache {
    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;
    public static final Duration DEFAULT_EXPIRE_AFTER_WRITE = Duration.ofMinutes(5);
    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofSeconds(60);

    private final Cache<String, Object> cache;

    private QueryResultCache(Builder builder) {
        Caffeine<Object, Object> caffeine = Caffeine.newBuilder()
                .maximumSize(builder.maximumSize)
                .expireAfterWrite(builder.expireAfterWrite)
                .expireAfterAccess(builder.expireAfterAccess);
        if (builder.ticker != null) {
            caffeine.ticker(builder.ticker);
        }
        if (builder.executor != null) {
            caffeine.executor(builder.executor);
        }
        this.cache = caffeine.build();
    }

    public static QueryResultCache withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public void put(String key, Object value) {
        cache.put(Objects.requireNonNull(key, "Key must be specified"),
            Objects.requireNonNull(value, "Value must be specified"));
    }

    /**
     * Return cached value, or compute, store and return it. Concurrent callers for the same key wait for single
     * computation.
     */
    public <T> T getOrCompute(String key, Function<String, ? extends T> computation) {
        return (T) cache.get(key, computation);
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /**
     * Evict every entry whose key starts with the prefix.
     * @param prefix key prefix
     * @return number of evicted entries
     */
    public int invalidatePrefix(String prefix) {
        int evicted = 0;
        for (Iterator<String> it = cache.asMap().keySet().iterator(); it.hasNext();) {
            if (it.next().startsWith(prefix)) {
                it.remove();
                evicted++;
            }
        }
        return evicted;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Number of live entries, after pending expirations and evictions are performed.
     */
    public long entryCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static class Builder {
        private long maximumSize = DEFAULT_MAXIMUM_SIZE;
        private Duration expireAfterWrite = DEFAULT_EXPIRE_AFTER_WRITE;
        private Duration expireAfterAccess = DEFAULT_EXPIRE_AFTER_ACCESS;
        private Ticker ticker;
        private Executor executor;

        public Builder maximumSize(long maximumSize) {
            if (maximumSize < 0) {
                throw new IllegalArgumentException("Maximum size cannot be negative");
            }
            this.maximumSize = maximumSize;
            return this;
        }

        public Builder expireAfterWrite(Duration duration) {
            this.expireAfterWrite = Objects.requireNonNull(duration, "Duration must be specified");
            return this;
        }

        public Builder expireAfterAccess(Duration duration) {
            this.expireAfterAccess = Objects.requireNonNull(duration, "Duration must be specified");
            return this;
        }

        /**
         * Time source for expiration, meant for tests.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Executor for maintenance tasks. {@code Runnable::run} makes evictions happen on caller threads.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public QueryResultCache build() {
            return new QueryResultCache(this);
        }
    }
}
