package io.github.goodees.esa.store.inmemory;

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
import io.github.goodees.esa.store.EventRecord;
import io.github.goodees.esa.store.Serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory event store that keeps events only in serialized form, so that every read goes through deserialization.
 * Useful for verifying serialization of events the way a durable store would.
 */
public class SerializingInMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, List<EventRecord>> records = new ConcurrentHashMap<>();
    private final Serialization<Event> serialization;

    public SerializingInMemoryEventStore(Serialization<Event> serialization) {
        this.serialization = serialization;
    }

    @Override
    public void create(String aggregateId, List<? extends Event> initialEvents) throws EventStoreException {
        // the stream is bound only once all events are serialized
        List<EventRecord> stream = toRecords(aggregateId, 0, initialEvents);
        if (records.putIfAbsent(aggregateId, stream) != null) {
            throw EventStoreException.duplicateStream(aggregateId);
        }
    }

    @Override
    public void append(String aggregateId, List<? extends Event> events) throws EventStoreException {
        List<EventRecord> stream = records.get(aggregateId);
        if (stream == null) {
            throw EventStoreException.unknownAggregate(aggregateId);
        }
        synchronized (stream) {
            // serialize all first, so that failure leaves the stream untouched
            stream.addAll(toRecords(aggregateId, stream.size(), events));
        }
    }

    private List<EventRecord> toRecords(String aggregateId, long baseVersion, List<? extends Event> events)
            throws EventStoreException {
        List<EventRecord> serialized = new ArrayList<>(events.size());
        long version = baseVersion;
        for (Event event : events) {
            serialized.add(toRecord(aggregateId, ++version, event));
        }
        return serialized;
    }

    private EventRecord toRecord(String aggregateId, long version, Event event) throws EventStoreException {
        Event serializable = serialization.toSerializable(event);
        if (serializable == null) {
            throw EventStoreException.storeFailed(aggregateId,
                new IllegalArgumentException("Event " + event + " is not supported by the serialization"));
        }
        try {
            return new EventRecord(aggregateId, version, serializable.getType(),
                serialization.payloadVersion(serializable), serialization.serialize(serializable));
        } catch (RuntimeException e) {
            throw EventStoreException.storeFailed(aggregateId, e);
        }
    }

    @Override
    public Optional<List<Event>> read(String aggregateId) {
        return getSerializedEvents(aggregateId).map(stream -> {
            List<Event> result = new ArrayList<>(stream.size());
            for (EventRecord record : stream) {
                result.add(serialization.deserialize(record.getPayloadVersion(), record.getPayload(),
                    record.getType()));
            }
            return result;
        });
    }

    /**
     * Serialized records of a stream.
     * @param aggregateId the aggregate
     * @return copy of the records, or empty if no stream exists
     */
    public Optional<List<EventRecord>> getSerializedEvents(String aggregateId) {
        List<EventRecord> stream = records.get(aggregateId);
        if (stream == null) {
            return Optional.empty();
        }
        synchronized (stream) {
            return Optional.of(Collections.unmodifiableList(new ArrayList<>(stream)));
        }
    }

    /**
     * Put a record directly, as a migration or import would.
     * @param record the record, must have the next version of its stream
     * @throws EventStoreException when the stream doesn't exist
     */
    public void storeRecord(EventRecord record) throws EventStoreException {
        List<EventRecord> stream = records.get(record.getAggregateId());
        if (stream == null) {
            throw EventStoreException.unknownAggregate(record.getAggregateId());
        }
        synchronized (stream) {
            if (record.getVersion() != stream.size() + 1) {
                throw EventStoreException.concurrencyConflict(record.getAggregateId(), record.getVersion() - 1,
                    stream.size());
            }
            stream.add(record);
        }
    }

    @Override
    public long versionOf(String aggregateId) {
        List<EventRecord> stream = records.get(aggregateId);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.size();
        }
    }

    @Override
    public boolean exists(String aggregateId) {
        return records.containsKey(aggregateId);
    }
}
