package io.github.goodees.esa.core.store;

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

import io.github.goodees.esa.core.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, append-only history of events of a single aggregate.
 * <p>The version of the stream is the number of events in it, 0 for a newly created stream. Events are never removed
 * or reordered.</p>
 * <p>The stream is not synchronized. Stores own their streams and guard concurrent access to them.</p>
 */
public final class EventStream {
    private final String aggregateId;
    private final List<Event> events = new ArrayList<>();

    public EventStream(String aggregateId) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long version() {
        return events.size();
    }

    public void append(Event... newEvents) {
        append(Arrays.asList(newEvents));
    }

    /**
     * Append events in order given. A batch containing null is refused as whole.
     * @param newEvents events to append
     */
    public void append(List<? extends Event> newEvents) {
        for (Event event : newEvents) {
            Objects.requireNonNull(event, "Cannot append null event");
        }
        events.addAll(newEvents);
    }

    /**
     * Copy of the events in the order they were appended. Later appends are not reflected in the returned list.
     * @return unmodifiable copy of the stream
     */
    public List<Event> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    @Override
    public String toString() {
        return "EventStream{" + "aggregateId=" + aggregateId + ", version=" + events.size() + '}';
    }
}
