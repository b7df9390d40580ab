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

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.esa.core.Event;
import io.github.goodees.esa.example.recording.RecordingCreatedEvent;
import io.github.goodees.esa.example.recording.RecordingUpdatedEvent;
import io.github.goodees.esa.example.release.ReleaseCreatedEvent;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class JsonEventSerializationTest {
    private final RecordingCreatedEvent created = new RecordingCreatedEvent.Builder()
            .title("Sledge Hammer")
            .artist("Peter Gabriel")
            .duration(313)
            .build();

    private JsonEventSerialization serialization() {
        return new JsonEventSerialization(JsonEventSerialization.defaultMapper())
                .register(RecordingCreatedEvent.class)
                .register(RecordingUpdatedEvent.class);
    }

    @Test
    public void payload_carries_type_and_fields() {
        String json = serialization().serialize(created);
        assertThat(json, containsString("\"type\":\"RecordingCreated\""));
        assertThat(json, containsString("\"title\":\"Sledge Hammer\""));
        assertThat(json, containsString("\"duration\":313"));
    }

    @Test
    public void payload_reads_back_as_equal_event() {
        JsonEventSerialization serialization = serialization();
        Event read = serialization.deserialize(1, serialization.serialize(created), "RecordingCreated");
        assertThat(read, instanceOf(RecordingCreatedEvent.class));
        assertEquals(created, read);
    }

    @Test
    public void unknown_properties_are_ignored() {
        Event read = serialization().deserialize(1, "{\"type\":\"RecordingCreated\",\"title\":\"Sledge Hammer\","
                + "\"artist\":\"Peter Gabriel\",\"duration\":313,\"label\":\"Charisma\"}", "RecordingCreated");
        assertEquals(created, read);
    }

    @Test
    public void old_payload_is_upcast_to_current_version() {
        JsonEventSerialization serialization = new JsonEventSerialization(JsonEventSerialization.defaultMapper())
                .register(RecordingCreatedEvent.class, 2)
                .upcaster(RecordingCreatedEvent.class, 1, json -> {
                    json.set("duration", json.remove("length"));
                    return json;
                });
        String v1 = "{\"type\":\"RecordingCreated\",\"title\":\"Sledge Hammer\",\"artist\":\"Peter Gabriel\","
                + "\"length\":313}";

        assertEquals(created, serialization.deserialize(1, v1, "RecordingCreated"));
        assertEquals(2, serialization.payloadVersion(created));
    }

    @Test(expected = IllegalStateException.class)
    public void payload_without_upcaster_path_fails() {
        JsonEventSerialization serialization = new JsonEventSerialization(JsonEventSerialization.defaultMapper())
                .register(RecordingCreatedEvent.class, 3)
                .upcaster(RecordingCreatedEvent.class, 2, (ObjectNode json) -> json);
        serialization.deserialize(1, "{\"type\":\"RecordingCreated\"}", "RecordingCreated");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unregistered_type_cannot_be_read() {
        serialization().deserialize(1, "{}", "ReleaseCreated");
    }

    @Test(expected = IllegalArgumentException.class)
    public void type_cannot_be_registered_twice() {
        serialization().register(RecordingCreatedEvent.class);
    }

    @Test
    public void only_registered_events_are_serializable() {
        JsonEventSerialization serialization = serialization();
        assertSame(created, serialization.toSerializable(created));
        assertNull(serialization.toSerializable(new ReleaseCreatedEvent.Builder().title("So")
                .recordingIds(Arrays.asList("r1")).build()));
        assertNull(serialization.toSerializable(new Event() {
        }));
    }
}
