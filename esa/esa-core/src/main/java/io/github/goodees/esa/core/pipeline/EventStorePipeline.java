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
import io.github.goodees.esa.core.UnitOfWork;
import io.github.goodees.esa.core.store.EventStore;
import io.github.goodees.esa.core.store.EventStoreException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Facade to the event store used by repositories and command handlers.
 *
 * <p>The pipeline is assembled once, at startup, from an ordered list of {@link StoreMiddleware} in front of an
 * {@link EventStore} backend. Every create and append passes through the middleware in the order they were added,
 * reads go straight to the backend. The usual assembly, provided by {@link #standard(EventStore, EventPublisher)} is:</p>
 * <ol>
 *     <li>{@link LoggingMiddleware}</li>
 *     <li>{@link OptimisticConcurrencyGuard}, so everything after it runs under the aggregate's write lock</li>
 *     <li>{@link EventPublisher}, so subscribers see events of an aggregate in the order they were appended</li>
 * </ol>
 */
public class EventStorePipeline {
    private final EventStore backend;
    private final List<StoreMiddleware> middleware;
    private final Chain head;

    private EventStorePipeline(Builder builder) {
        this.backend = builder.backend;
        this.middleware = Collections.unmodifiableList(new ArrayList<>(builder.middleware));
        this.head = new Chain(0);
    }

    public static Builder builder(EventStore backend) {
        return new Builder(backend);
    }

    /**
     * Pipeline with logging, blocking concurrency guard and publisher in front of given backend.
     * @param backend the storage
     * @param publisher publisher to notify subscribers
     * @return assembled pipeline
     */
    public static EventStorePipeline standard(EventStore backend, EventPublisher publisher) {
        return builder(backend)
                .use(new LoggingMiddleware())
                .use(new OptimisticConcurrencyGuard(GuardConfiguration.blocking()))
                .use(publisher)
                .build();
    }

    /**
     * Create an empty stream.
     * @param aggregateId the aggregate
     * @throws EventStoreException with fault DUPLICATE_STREAM if the stream exists
     */
    public void create(String aggregateId) throws EventStoreException {
        head.proceed(Append.create(aggregateId, Collections.emptyList()));
    }

    /**
     * Create a stream and append its initial events as single operation. No other write to the aggregate can
     * happen in between.
     * @param aggregateId the aggregate
     * @param initialEvents events to start the stream with
     * @throws EventStoreException with fault DUPLICATE_STREAM if the stream exists
     */
    public void create(String aggregateId, Event... initialEvents) throws EventStoreException {
        head.proceed(Append.create(aggregateId, Arrays.asList(initialEvents)));
    }

    public void create(String aggregateId, List<? extends Event> initialEvents) throws EventStoreException {
        head.proceed(Append.create(aggregateId, initialEvents));
    }

    /**
     * Append events to existing stream.
     * @param aggregateId the aggregate
     * @param expectedVersion version of the stream the events were decided upon
     * @param events events to append
     * @throws EventStoreException with fault CONCURRENCY_CONFLICT when the stream is at a different version, or
     * UNKNOWN_AGGREGATE when there's no stream
     */
    public void append(String aggregateId, long expectedVersion, Event... events) throws EventStoreException {
        head.proceed(Append.to(aggregateId, expectedVersion, Arrays.asList(events)));
    }

    public void append(String aggregateId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        head.proceed(Append.to(aggregateId, expectedVersion, events));
    }

    public Optional<List<Event>> read(String aggregateId) {
        return backend.read(aggregateId);
    }

    public long versionOf(String aggregateId) {
        return backend.versionOf(aggregateId);
    }

    public boolean exists(String aggregateId) {
        return backend.exists(aggregateId);
    }

    /**
     * Start a unit of work for single command against an aggregate.
     * @param aggregateId the aggregate
     * @return unit of work, that captured current version of the stream
     */
    public UnitOfWork unitOfWork(String aggregateId) {
        return new UnitOfWork(this, aggregateId);
    }

    public List<StoreMiddleware> getMiddleware() {
        return middleware;
    }

    private class Chain implements StoreMiddleware.Chain {
        private final int index;

        Chain(int index) {
            this.index = index;
        }

        @Override
        public void proceed(Append append) throws EventStoreException {
            if (index < middleware.size()) {
                middleware.get(index).append(append, new Chain(index + 1));
            } else {
                write(append);
            }
        }

        @Override
        public long currentVersion(String aggregateId) {
            return backend.versionOf(aggregateId);
        }

        @Override
        public boolean exists(String aggregateId) {
            return backend.exists(aggregateId);
        }
    }

    private void write(Append append) throws EventStoreException {
        if (append.createsStream()) {
            backend.create(append.aggregateId(), append.events());
        } else {
            backend.append(append.aggregateId(), append.events());
        }
    }

    public static class Builder {
        private final EventStore backend;
        private final List<StoreMiddleware> middleware = new ArrayList<>();

        Builder(EventStore backend) {
            this.backend = Objects.requireNonNull(backend, "Backend must be specified");
        }

        /**
         * Add next middleware. Writes will pass middleware in the order they were added.
         * @param step the middleware
         * @return this builder
         */
        public Builder use(StoreMiddleware step) {
            this.middleware.add(Objects.requireNonNull(step, "Middleware cannot be null"));
            return this;
        }

        public EventStorePipeline build() {
            return new EventStorePipeline(this);
        }
    }
}
