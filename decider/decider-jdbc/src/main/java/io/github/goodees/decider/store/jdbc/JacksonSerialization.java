package io.github.goodees.decider.store.jdbc;

/*-
 * #%L
 * decider-jdbc
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.decider.core.store.Serialization;
import io.github.goodees.decider.immutables.ImmutableEvent;
import io.github.goodees.decider.immutables.ImmutableEventTypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON serialization of events sharing a polymorphic base type, such as descendants of {@link ImmutableEvent}.
 * <p>For {@code ImmutableEvent} descendants the stored event type selects the class to read, and the type
 * discriminator within the payload has to agree with it. An event whose type no longer has a class is not
 * deserialized. Other base types rely on the payload alone.</p>
 * @param <E> base type of events
 */
public class JacksonSerialization<E> implements Serialization<E> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonSerialization.class);

    private final Class<E> baseType;
    private final int payloadVersion;
    private final ObjectMapper mapper;
    private final ImmutableEventTypeResolver typeResolver;

    public JacksonSerialization(Class<E> baseType) {
        this(baseType, 1);
    }

    public JacksonSerialization(Class<E> baseType, int payloadVersion) {
        this(baseType, payloadVersion, createMapper());
    }

    public JacksonSerialization(Class<E> baseType, int payloadVersion, ObjectMapper mapper) {
        this.baseType = baseType;
        this.payloadVersion = payloadVersion;
        this.mapper = mapper;
        this.typeResolver = ImmutableEvent.class.isAssignableFrom(baseType)
                ? new ImmutableEventTypeResolver(baseType.asSubclass(ImmutableEvent.class))
                : null;
    }

    /**
     * Mapper configuration used by default. Supports {@code Optional} and {@code java.time} types, writes dates as
     * ISO-8601 strings and ignores unknown properties.
     * @return new object mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public int payloadVersion(E object) {
        return payloadVersion;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String type) {
        if (payloadVersion > this.payloadVersion) {
            logger.warn("Payload version {} of {} is newer than supported version {}", payloadVersion, type,
                this.payloadVersion);
            return null;
        }
        Class<? extends E> target = targetClass(type);
        if (target == null) {
            logger.warn("No event class for type {}", type);
            return null;
        }
        try {
            return mapper.readValue(payload, target);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.warn("Cannot deserialize event of type {}", type, e);
            return null;
        }
    }

    private Class<? extends E> targetClass(String type) {
        if (typeResolver == null || type == null) {
            return baseType;
        }
        return typeResolver.eventClass(type)
                .filter(baseType::isAssignableFrom)
                .map(c -> c.asSubclass(baseType))
                .orElse(null);
    }

    @Override
    public E toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
