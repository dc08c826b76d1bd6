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

/**
 * Matching of concrete topics against patterns.
 * <ul>
 * <li>{@code prefix/**} matches {@code prefix} itself and any topic below it</li>
 * <li>{@code prefix/*} matches topics exactly one non-empty segment below {@code prefix}</li>
 * <li>any other pattern matches only the identical topic</li>
 * </ul>
 * Wildcards are recognized only as the last segment.
 */
public final class KeyExpressions {
    private static final String MULTI = "/**";
    private static final String SINGLE = "/*";

    private KeyExpressions() {

    }

    public static boolean matches(String pattern, String topic) {
        if (pattern.endsWith(MULTI)) {
            String prefix = pattern.substring(0, pattern.length() - MULTI.length());
            return topic.equals(prefix) || topic.startsWith(prefix + "/");
        } else if (pattern.endsWith(SINGLE)) {
            String prefix = pattern.substring(0, pattern.length() - SINGLE.length()) + "/";
            if (!topic.startsWith(prefix)) {
                return false;
            }
            String rest = topic.substring(prefix.length());
            return !rest.isEmpty() && rest.indexOf('/') < 0;
        } else {
            return pattern.equals(topic);
        }
    }
}
