package io.github.goodees.esa.immutables;

/*-
 * #%L
 * esa
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
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.esa.core.Event;

import java.io.IOException;

/**
 * Automatic JSON event type names and their instantiation for ImmutableEvent descendants.
 *
 * The convention is consistent with {@link ImmutableEvent#getType()}:
 * <ul>
 * <li>All events are defined in same package as the type being deserialized</li>
 * <li>All events have suffix Event, and type name is the simple name without it</li>
 * <li>Immutables generates implementation with prefix Immutable next to them</li>
 * </ul>
 * Type ids resolving to a class that doesn't implement the deserialized type are refused.
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {
    static final String PREFIX = "Immutable";
    static final String SUFFIX = "Event";

    private Class<?> baseType;
    private String basePackage;

    @Override
    public void init(JavaType bt) {
        this.baseType = bt.getRawClass();
        String className = baseType.getName();
        this.basePackage = className.substring(0, className.lastIndexOf('.'));
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
        return typeFromId(id, context.getTypeFactory());
    }

    JavaType typeFromId(String id, TypeFactory typeFactory) {
        String className = basePackage + "." + PREFIX + id + SUFFIX;
        Class<?> eventClass;
        try {
            eventClass = typeFactory.findClass(className);
        } catch (ClassNotFoundException ex) {
            throw new IllegalStateException("Could not find event class for type " + id + " in " + basePackage, ex);
        }
        if (!baseType.isAssignableFrom(eventClass)) {
            throw new IllegalStateException("Event type " + id + " resolved to " + className
                    + ", which is not a " + baseType.getName());
        }
        return typeFactory.constructType(eventClass);
    }

    @Override
    public String idFromValue(Object value) {
        if (value instanceof ImmutableEvent) {
            return ((Event) value).getType();
        }
        throw new IllegalArgumentException(
            "This type resolver is only for non-null descendants of ImmutableEvent, was given " + value);
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (value instanceof ImmutableEvent && ImmutableEvent.class.isAssignableFrom(suggestedType)) {
            return ((Event) value).getType();
        }
        throw new IllegalArgumentException("This type resolver is only for non-null descendants of ImmutableEvent, "
                + "was given " + suggestedType.getName() + " " + value);
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }
}
