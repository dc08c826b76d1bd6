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

import java.util.Objects;

/**
 * Message exchanged over an {@link EventBus}: a concrete topic and an opaque payload.
 */
public final class BusMessage {
    private final String topic;
    private final Object payload;

    public BusMessage(String topic, Object payload) {
        this.topic = Objects.requireNonNull(topic, "Topic must be specified");
        this.payload = payload;
    }

    public String getTopic() {
        return topic;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "BusMessage{" + topic + ", payload=" + payload + '}';
    }
}
