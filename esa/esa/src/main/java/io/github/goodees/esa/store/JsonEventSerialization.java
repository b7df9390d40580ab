package io.github.goodees.esa.store;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.esa.core.Event;
import io.github.goodees.esa.core.EventType;
import io.github.goodees.esa.immutables.ImmutableEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Jackson serialization of {@link ImmutableEvent immutable events}. Every event type that may be stored is registered
 * with its current payload version. Payloads of older versions are brought to the current shape by upcasters, which
 * transform the JSON tree one version at a time.
 * <pre>
 * JsonEventSerialization serialization = new JsonEventSerialization(JsonEventSerialization.defaultMapper())
 *         .register(RecordingCreatedEvent.class, 2)
 *         .upcaster(RecordingCreatedEvent.class, 1, json -&gt; json.put("duration", 0));
 * </pre>
 */
public class JsonEventSerialization implements Serialization<Event> {
    private static final Logger logger = LoggerFactory.getLogger(JsonEventSerialization.class);

    private final ObjectMapper mapper;
    private final Map<String, Registration> types = new HashMap<>();

    public JsonEventSerialization(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
    }

    /**
     * Object mapper with JDK 8 types and ISO-8601 date support.
     * @return new mapper
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public JsonEventSerialization register(Class<? extends ImmutableEvent> eventType) {
        return register(eventType, 1);
    }

    /**
     * Register an event type.
     * @param eventType the interface of the event
     * @param currentPayloadVersion version new events of this type are written with
     * @return this serialization
     */
    public JsonEventSerialization register(Class<? extends ImmutableEvent> eventType, int currentPayloadVersion) {
        String type = EventType.defaultTypeName(eventType);
        if (types.containsKey(type)) {
            throw new IllegalArgumentException("Event type " + type + " is already registered");
        }
        types.put(type, new Registration(eventType, currentPayloadVersion));
        return this;
    }

    /**
     * Register transformation of payload from given version to the next one.
     * @param eventType registered event type
     * @param fromVersion version of the payload the upcaster reads
     * @param upcaster transformation of the JSON tree
     * @return this serialization
     */
    public JsonEventSerialization upcaster(Class<? extends ImmutableEvent> eventType, int fromVersion,
            UnaryOperator<ObjectNode> upcaster) {
        Registration registration = registration(EventType.defaultTypeName(eventType));
        if (fromVersion >= registration.currentVersion) {
            throw new IllegalArgumentException("Upcaster from version " + fromVersion + " of " + eventType
                    + " is not older than current version " + registration.currentVersion);
        }
        registration.upcasters.put(fromVersion, upcaster);
        return this;
    }

    @Override
    public int payloadVersion(Event object) {
        return registration(object.getType()).currentVersion;
    }

    @Override
    public String serialize(Event object) {
        registration(object.getType());
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + object, e);
        }
    }

    @Override
    public Event deserialize(int payloadVersion, String payload, String type) {
        Registration registration = registration(type);
        try {
            if (payloadVersion == registration.currentVersion) {
                return mapper.readValue(payload, registration.eventType);
            }
            ObjectNode tree = (ObjectNode) mapper.readTree(payload);
            for (int v = payloadVersion; v < registration.currentVersion; v++) {
                UnaryOperator<ObjectNode> upcaster = registration.upcasters.get(v);
                if (upcaster == null) {
                    throw new IllegalStateException("No upcaster of " + type + " from payload version " + v);
                }
                tree = upcaster.apply(tree);
            }
            logger.trace("Upcasted {} from payload version {}", type, payloadVersion);
            return mapper.treeToValue(tree, registration.eventType);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot deserialize " + type + " version " + payloadVersion, e);
        }
    }

    @Override
    public Event toSerializable(Object o) {
        if (o instanceof ImmutableEvent && types.containsKey(((ImmutableEvent) o).getType())) {
            return (Event) o;
        }
        return null;
    }

    private Registration registration(String type) {
        Registration registration = types.get(type);
        if (registration == null) {
            throw new IllegalArgumentException("Event type " + type + " is not registered");
        }
        return registration;
    }

    private static class Registration {
        final Class<? extends ImmutableEvent> eventType;
        final int currentVersion;
        final Map<Integer, UnaryOperator<ObjectNode>> upcasters = new HashMap<>();

        Registration(Class<? extends ImmutableEvent> eventType, int currentVersion) {
            this.eventType = eventType;
            this.currentVersion = currentVersion;
        }
    }
}
