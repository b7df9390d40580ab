package io.github.goodees.esa.core.store.inmemory;

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
import io.github.goodees.esa.core.store.EventStore;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventStream;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event store keeping its streams in memory for the lifetime of the process.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, EventStream> storage = new ConcurrentHashMap<>();

    @Override
    public void create(String aggregateId, List<? extends Event> initialEvents) throws EventStoreException {
        EventStream stream = new EventStream(aggregateId);
        stream.append(initialEvents);
        if (storage.putIfAbsent(aggregateId, stream) != null) {
            throw EventStoreException.duplicateStream(aggregateId);
        }
    }

    @Override
    public void append(String aggregateId, List<? extends Event> events) throws EventStoreException {
        EventStream stream = storage.get(aggregateId);
        if (stream == null) {
            throw EventStoreException.unknownAggregate(aggregateId);
        }
        // streams are not synchronized, readers lock on the same monitor
        synchronized (stream) {
            stream.append(events);
        }
    }

    @Override
    public Optional<List<Event>> read(String aggregateId) {
        EventStream stream = storage.get(aggregateId);
        if (stream == null) {
            return Optional.empty();
        }
        synchronized (stream) {
            return Optional.of(stream.snapshot());
        }
    }

    @Override
    public long versionOf(String aggregateId) {
        EventStream stream = storage.get(aggregateId);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.version();
        }
    }

    @Override
    public boolean exists(String aggregateId) {
        return storage.containsKey(aggregateId);
    }
}
