package io.github.goodees.esa.core;

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

import io.github.goodees.esa.core.pipeline.EventStorePipeline;
import io.github.goodees.esa.core.store.EventStoreException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Writes of a single command against single aggregate.
 *
 * <p>The unit of work captures the version of the aggregate's stream when it is created. All appends made through it
 * expect the stream to still be at that version, advanced only by the unit's own appends. If anyone else appended in
 * the meantime, the append fails with
 * {@link io.github.goodees.esa.core.store.EventStoreException.Fault#CONCURRENCY_CONFLICT}, and the command should be
 * retried with a fresh unit of work after reloading the aggregate.</p>
 *
 * <p>Therefore a unit of work is opened before the aggregate is loaded for decision, and is not reused for another
 * command. It is not thread safe.</p>
 */
public class UnitOfWork {
    private final EventStorePipeline store;
    private final String aggregateId;
    private long expectedVersion;

    public UnitOfWork(EventStorePipeline store, String aggregateId) {
        this.store = Objects.requireNonNull(store, "Store must be specified");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.expectedVersion = store.versionOf(aggregateId);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * Create the stream of the aggregate.
     * @throws EventStoreException with fault DUPLICATE_STREAM if it exists
     */
    public void create() throws EventStoreException {
        store.create(aggregateId);
    }

    /**
     * Create the stream together with its initial events.
     * @param initialEvents first events of the aggregate
     * @throws EventStoreException with fault DUPLICATE_STREAM if it exists
     */
    public void createWith(Event... initialEvents) throws EventStoreException {
        store.create(aggregateId, initialEvents);
        expectedVersion = initialEvents.length;
    }

    public void append(Event... events) throws EventStoreException {
        append(Arrays.asList(events));
    }

    public void append(List<? extends Event> events) throws EventStoreException {
        store.append(aggregateId, expectedVersion, events);
        expectedVersion += events.size();
    }

    @Override
    public String toString() {
        return "UnitOfWork{" + "aggregateId=" + aggregateId + ", expectedVersion=" + expectedVersion + '}';
    }
}
