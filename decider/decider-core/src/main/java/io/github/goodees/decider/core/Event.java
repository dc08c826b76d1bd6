package io.github.goodees.decider.core;

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
 * Optional marker for domain events. Events do not need to implement it, but those who do can name their type
 * explicitly. The type is stored alongside the payload and used to deserialize it.
 */
public interface Event {

    /**
     * The type of event. Must be unique within an aggregate type. If in future an event is removed, the store
     * must be able to translate it to an equivalent event in new model.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }
}
