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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed set of {@link CacheDependency cache dependencies} over a {@link QueryResultCache}. The set is determined at
 * construction and never changes afterwards, so processing needs no synchronization.
 */
public class CacheInvalidationRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CacheInvalidationRegistry.class);

    private final QueryResultCache cache;
    private final List<CacheDependency> dependencies;

    private CacheInvalidationRegistry(QueryResultCache cache, List<CacheDependency> dependencies) {
        this.cache = cache;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public static Builder builder(QueryResultCache cache) {
        return new Builder(cache);
    }

    public List<CacheDependency> getDependencies() {
        return dependencies;
    }

    public QueryResultCache getCache() {
        return cache;
    }

    /**
     * Evict entries under every dependency matching the topic.
     * @param topic topic of an event
     * @return number of dependencies that matched
     */
    public int processEvent(String topic) {
        int matched = 0;
        int evicted = 0;
        for (CacheDependency dependency : dependencies) {
            if (dependency.matches(topic)) {
                matched++;
                evicted += cache.invalidatePrefix(dependency.getCacheKey());
            }
        }
        if (matched > 0) {
            logger.debug("Event {} matched {} dependencies, evicted {} entries", topic, matched, evicted);
        }
        return matched;
    }

    public static class Builder {
        private final QueryResultCache cache;
        private final List<CacheDependency> dependencies = new ArrayList<>();

        Builder(QueryResultCache cache) {
            this.cache = Objects.requireNonNull(cache, "Cache must be specified");
        }

        public Builder register(CacheDependency dependency) {
            dependencies.add(Objects.requireNonNull(dependency, "Dependency must be specified"));
            return this;
        }

        public Builder registerAll(Collection<CacheDependency> dependencies) {
            dependencies.forEach(this::register);
            return this;
        }

        public CacheInvalidationRegistry build() {
            return new CacheInvalidationRegistry(cache, dependencies);
        }
    }
}
