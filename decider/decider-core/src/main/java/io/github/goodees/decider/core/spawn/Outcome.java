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

/**
 * How a spawned execution ended, from the spawner's point of view.
 */
public enum Outcome {
    /** Work succeeded and completion was recorded. */
    COMPLETED,
    /** Work failed and failure was recorded. */
    FAILED,
    /** Work exceeded timeout, was cancelled and failure was recorded. */
    TIMED_OUT,
    /** A follow-up command was rejected or could not be stored. The aggregate is left in its last recorded state. */
    ABANDONED
}
