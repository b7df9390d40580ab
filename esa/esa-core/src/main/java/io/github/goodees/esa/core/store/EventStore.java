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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Storage for aggregate event streams.
 *
 * <p>This is the backend sitting at the end of an {@link io.github.goodees.esa.core.pipeline.EventStorePipeline}.
 * It holds at most one stream per aggregate id, and once created a stream is never removed. The backend does not
 * implement optimistic locking itself, that is the responsibility of the pipeline in front of it. It must however
 * be safe to read a stream while another thread appends to it.</p>
 * <p>An in-memory implementation is {@link io.github.goodees.esa.core.store.inmemory.InMemoryEventStore}. A durable
 * backend can be substituted without changing any component above this interface.</p>
 */
public interface EventStore {

    /**
     * Bind a new, empty stream to an aggregate id.
     * @param aggregateId the id of the aggregate
     * @throws EventStoreException with fault {@link EventStoreException.Fault#DUPLICATE_STREAM} if a stream exists
     */
    default void create(String aggregateId) throws EventStoreException {
        create(aggregateId, Collections.emptyList());
    }

    /**
     * Bind a new stream holding the initial events to an aggregate id. Either the stream becomes visible with all of
     * the events, or no stream is bound at all.
     * @param aggregateId the id of the aggregate
     * @param initialEvents first events of the stream, may be empty
     * @throws EventStoreException with fault {@link EventStoreException.Fault#DUPLICATE_STREAM} if a stream exists,
     * or {@link EventStoreException.Fault#STORE_FAILED} when the backend fails to store the events
     */
    void create(String aggregateId, List<? extends Event> initialEvents) throws EventStoreException;

    /**
     * Append events to existing stream, in order given.
     * @param aggregateId the id of the aggregate
     * @param events events to append
     * @throws EventStoreException with fault {@link EventStoreException.Fault#UNKNOWN_AGGREGATE} if there is no stream
     * for the id, or {@link EventStoreException.Fault#STORE_FAILED} when the backend fails to store them
     */
    void append(String aggregateId, List<? extends Event> events) throws EventStoreException;

    /**
     * Read all events of an aggregate.
     * @param aggregateId the id of the aggregate
     * @return copy of the stream in append order, or empty if no stream exists
     */
    Optional<List<Event>> read(String aggregateId);

    /**
     * Current version of a stream.
     * @param aggregateId the id of the aggregate
     * @return number of events in the stream, 0 for unknown aggregates
     */
    long versionOf(String aggregateId);

    /**
     * Check if a stream was created for the id.
     * @param aggregateId the id of the aggregate
     * @return true if a stream exists
     */
    boolean exists(String aggregateId);
}
