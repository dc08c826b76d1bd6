package io.github.goodees.decider.immutables;

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

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import io.github.goodees.decider.core.EventType;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps event type names to generated Immutables classes and back. Type {@code TodoCreated} of base interface
 * {@code com.example.TodoEvent} is implemented by {@code com.example.ImmutableTodoCreatedEvent}, i. e.
 *
 * <ul>
 * <li>all events are defined in same package as their base interface</li>
 * <li>event interfaces have suffix {@value #SUFFIX}, which is not part of type name</li>
 * <li>implementation is generated with prefix {@value #PREFIX}</li>
 * </ul>
 * <p>Jackson creates the resolver for {@link ImmutableEvent}'s polymorphic {@code type} property. Event stores
 * create it with {@link #ImmutableEventTypeResolver(Class)} to pick the class for a type stored alongside the
 * payload.</p>
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {
    public static final String PREFIX = "Immutable";
    public static final String SUFFIX = "Event";

    private final ConcurrentMap<String, Optional<Class<?>>> classes = new ConcurrentHashMap<>();
    private Class<?> baseType;

    public ImmutableEventTypeResolver() {
    }

    public ImmutableEventTypeResolver(Class<? extends ImmutableEvent> baseType) {
        this.baseType = Objects.requireNonNull(baseType, "Base type must be specified");
    }

    /**
     * Type name of an event class. Strips both the implementation prefix and the event suffix.
     * @param eventClass interface of the event or its generated implementation
     * @return type name
     */
    public static String typeOf(Class<?> eventClass) {
        return EventType.fromClassStripping(eventClass, PREFIX, SUFFIX);
    }

    @Override
    public void init(JavaType bt) {
        this.baseType = bt.getRawClass();
    }

    /**
     * Find the generated implementation for type name.
     * @param type the type name
     * @return the class, or empty when no event of that type exists next to the base type
     */
    public Optional<Class<?>> eventClass(String type) {
        return classes.computeIfAbsent(type, this::loadClass);
    }

    private Optional<Class<?>> loadClass(String type) {
        String className = baseType.getPackage().getName() + "." + PREFIX + type + SUFFIX;
        try {
            Class<?> eventClass = Class.forName(className, false, baseType.getClassLoader());
            return baseType.isAssignableFrom(eventClass) ? Optional.of(eventClass) : Optional.empty();
        } catch (ClassNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
        Optional<Class<?>> eventClass = eventClass(id);
        if (eventClass.isPresent()) {
            return context.constructType(eventClass.get());
        }
        throw ((DeserializationContext) context).invalidTypeIdException(context.constructType(baseType), id,
            "no event class " + PREFIX + id + SUFFIX + " in package " + baseType.getPackage().getName());
    }

    @Override
    public String idFromValue(Object value) {
        if (value instanceof ImmutableEvent) {
            return EventType.of(value);
        } else {
            throw new IllegalArgumentException(
                "This type resolver is only for non-null descendants of ImmutableEvent, was given " + value);
        }
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (suggestedType != null && !ImmutableEvent.class.isAssignableFrom(suggestedType)) {
            throw new IllegalArgumentException("Type " + suggestedType.getName() + " is not an ImmutableEvent");
        }
        return idFromValue(value);
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
