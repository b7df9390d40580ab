package io.github.goodees.esa.core.aggregate;

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
import io.github.goodees.esa.core.UnitOfWork;
import io.github.goodees.esa.core.pipeline.EventStorePipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads aggregates of one type by replaying their streams.
 * @param <T> type of aggregate state
 */
public class Repository<T> {
    private final EventStorePipeline store;
    private final AggregateType<T> type;

    public Repository(EventStorePipeline store, AggregateType<T> type) {
        this.store = Objects.requireNonNull(store, "Store must be specified");
        this.type = Objects.requireNonNull(type, "Aggregate type must be specified");
    }

    /**
     * Load current state of an aggregate.
     * @param aggregateId the aggregate
     * @return the state, or empty if the stream is unknown or has no events yet
     * @throws IllegalStateException when the stream contains event the aggregate type cannot apply
     */
    public Optional<T> find(String aggregateId) {
        Optional<List<Event>> events = store.read(aggregateId);
        if (!events.isPresent() || events.get().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(type.replay(aggregateId, events.get()));
    }

    public UnitOfWork unitOfWork(String aggregateId) {
        return store.unitOfWork(aggregateId);
    }

    public long versionOf(String aggregateId) {
        return store.versionOf(aggregateId);
    }

    public boolean exists(String aggregateId) {
        return store.exists(aggregateId);
    }

    public AggregateType<T> getType() {
        return type;
    }
}
