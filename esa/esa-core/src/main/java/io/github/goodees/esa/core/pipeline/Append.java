package io.github.goodees.esa.core.pipeline;

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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single write passing through the {@link EventStorePipeline}. Creating a stream is an append that
 * {@linkplain #createsStream() creates the stream} first, optionally with initial events.
 */
public final class Append {
    private final String aggregateId;
    private final long expectedVersion;
    private final List<Event> events;
    private final boolean createsStream;

    private Append(String aggregateId, long expectedVersion, List<? extends Event> events, boolean createsStream) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative, was " + expectedVersion);
        }
        this.expectedVersion = expectedVersion;
        Objects.requireNonNull(events, "Events must be specified");
        for (Event event : events) {
            Objects.requireNonNull(event, "Cannot append null event");
        }
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.createsStream = createsStream;
    }

    /**
     * Create a stream and append the initial events in single guarded operation.
     * @param aggregateId id of new aggregate
     * @param initialEvents events to append right after creation, may be empty
     * @return the append
     */
    public static Append create(String aggregateId, List<? extends Event> initialEvents) {
        return new Append(aggregateId, 0, initialEvents, true);
    }

    /**
     * Append to existing stream.
     * @param aggregateId id of the aggregate
     * @param expectedVersion version the stream must be at for the append to succeed
     * @param events events to append, at least one
     * @return the append
     */
    public static Append to(String aggregateId, long expectedVersion, List<? extends Event> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("At least one event must be appended to " + aggregateId);
        }
        return new Append(aggregateId, expectedVersion, events, false);
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public List<Event> events() {
        return events;
    }

    public boolean createsStream() {
        return createsStream;
    }

    @Override
    public String toString() {
        return "Append{" + "aggregateId=" + aggregateId + ", expectedVersion=" + expectedVersion + ", events="
                + events + ", createsStream=" + createsStream + '}';
    }
}
