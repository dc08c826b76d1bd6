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

import org.junit.Test;

import static io.github.goodees.decider.core.bus.KeyExpressions.matches;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KeyExpressionsTest {

    @Test
    public void multi_segment_wildcard_matches_prefix_and_everything_below() {
        String pattern = "events/Todo/**";
        assertTrue(matches(pattern, "events/Todo"));
        assertTrue(matches(pattern, "events/Todo/abc"));
        assertTrue(matches(pattern, "events/Todo/abc/5"));
        assertFalse(matches(pattern, "events/Session/abc/1"));
        assertFalse(matches(pattern, "events/TodoList/abc/1"));
    }

    @Test
    public void single_segment_wildcard_matches_exactly_one_segment() {
        String pattern = "events/Todo/abc/*";
        assertTrue(matches(pattern, "events/Todo/abc/5"));
        assertFalse(matches(pattern, "events/Todo/abc"));
        assertFalse(matches(pattern, "events/Todo/abc/"));
        assertFalse(matches(pattern, "events/Todo/abc/5/6"));
        assertFalse(matches(pattern, "events/Todo/abcd/5"));
    }

    @Test
    public void pattern_without_wildcard_matches_identical_topic() {
        assertTrue(matches("events/Todo/abc/1", "events/Todo/abc/1"));
        assertFalse(matches("events/Todo/abc/1", "events/Todo/abc/10"));
        assertFalse(matches("events/Todo/abc", "events/Todo/abc/1"));
    }

    @Test
    public void topics_are_built_from_segments() {
        assertEquals("events/Todo/abc/5", Topics.eventTopic("Todo", "abc", 5));
        assertEquals("events/Todo/**", Topics.aggregatePattern("Todo"));
        assertEquals("events/Todo/abc/*", Topics.instancePattern("Todo", "abc"));
        assertEquals("custom/**", Topics.allEvents("custom"));
        assertTrue(matches(Topics.ALL_EVENTS, Topics.eventTopic("Session", "s", 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void wildcards_are_not_allowed_in_topic_segments() {
        Topics.eventTopic("Todo", "**", 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty_segments_are_not_allowed() {
        Topics.aggregatePattern("");
    }
}
