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

import io.github.goodees.decider.core.bus.KeyExpressions;
import io.github.goodees.decider.core.bus.Topics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declares that cached entries under a key prefix depend on events matching topic patterns.
 * <pre>
 * CacheDependency.forKey("todo:").dependsOnAggregate("Todo")
 * </pre>
 * Instances are immutable, each {@code dependsOn...} method returns a new one.
 */
public final class CacheDependency {
    private final String cacheKey;
    private final List<String> dependsOn;

    private CacheDependency(String cacheKey, List<String> dependsOn) {
        this.cacheKey = cacheKey;
        this.dependsOn = dependsOn;
    }

    public static CacheDependency forKey(String cacheKey) {
        Objects.requireNonNull(cacheKey, "Cache key must be specified");
        return new CacheDependency(cacheKey, Collections.emptyList());
    }

    public CacheDependency dependsOnAggregate(String aggregateType) {
        return dependsOn(Topics.aggregatePattern(aggregateType));
    }

    public CacheDependency dependsOnInstance(String aggregateType, String aggregateId) {
        return dependsOn(Topics.instancePattern(aggregateType, aggregateId));
    }

    public CacheDependency dependsOn(String pattern) {
        Objects.requireNonNull(pattern, "Pattern must be specified");
        List<String> patterns = new ArrayList<>(dependsOn);
        patterns.add(pattern);
        return new CacheDependency(cacheKey, Collections.unmodifiableList(patterns));
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public boolean matches(String topic) {
        for (String pattern : dependsOn) {
            if (KeyExpressions.matches(pattern, topic)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        CacheDependency that = (CacheDependency) o;
        return cacheKey.equals(that.cacheKey) && dependsOn.equals(that.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cacheKey, dependsOn);
    }

    @Override
    public String toString() {
        return "CacheDependency{" + cacheKey + " <- " + dependsOn + '}';
    }
}
