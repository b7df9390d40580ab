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
import io.github.goodees.esa.core.matching.TypeSwitch;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Description of an aggregate: how its state is seeded from the first event of the stream, and how each later event
 * transforms the state. States are expected to be immutable values, an apply step returns the new state.
 *
 * <pre>
 * AggregateType&lt;Recording&gt; RECORDING = AggregateType.&lt;Recording&gt;builder("recording")
 *         .createdBy(RecordingCreatedEvent.class, Recording::from)
 *         .on(RecordingUpdatedEvent.class, Recording::update)
 *         .build();
 * </pre>
 * @param <T> type of the state
 */
public class AggregateType<T> {
    private final String name;
    private final TypeSwitch<Function<Event, T>> seeds;
    private final TypeSwitch<BiFunction<T, Event, T>> appliers;

    private AggregateType(Builder<T> builder) {
        this.name = builder.name;
        this.seeds = builder.seeds.build();
        this.appliers = builder.appliers.build();
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Fold events of a stream into state.
     * @param aggregateId id of the aggregate, for error reporting
     * @param events the stream, not empty
     * @return the state after last event
     * @throws IllegalStateException when an event has no seed or apply step registered
     */
    public T replay(String aggregateId, List<? extends Event> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot replay empty stream of " + name + " " + aggregateId);
        }
        Event first = events.get(0);
        T state = seeds.lookup(first.getClass())
                .orElseThrow(() -> new IllegalStateException(
                    "Stream of " + name + " " + aggregateId + " starts with " + first.getType()
                            + ", which doesn't create the aggregate"))
                .apply(first);
        for (Event event : events.subList(1, events.size())) {
            state = apply(aggregateId, state, event);
        }
        return state;
    }

    /**
     * Apply single event to a state.
     * @param aggregateId id of the aggregate, for error reporting
     * @param state current state
     * @param event the event
     * @return new state
     */
    public T apply(String aggregateId, T state, Event event) {
        return appliers.lookup(event.getClass())
                .orElseThrow(() -> new IllegalStateException(
                    "No apply step for " + event.getType() + " in " + name + " " + aggregateId))
                .apply(state, event);
    }

    @Override
    public String toString() {
        return "AggregateType[" + name + "]";
    }

    public static class Builder<T> {
        private final String name;
        private final TypeSwitch.Builder<Function<Event, T>> seeds = TypeSwitch.builder();
        private final TypeSwitch.Builder<BiFunction<T, Event, T>> appliers = TypeSwitch.builder();

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "Aggregate name must be specified");
        }

        /**
         * Register event that starts the stream.
         * @param type event type
         * @param seed creates the initial state
         * @param <E> event type
         * @return this builder
         */
        public <E extends Event> Builder<T> createdBy(Class<E> type, Function<? super E, T> seed) {
            Objects.requireNonNull(seed, "Seed function must be specified");
            seeds.on(type, event -> seed.apply(type.cast(event)));
            return this;
        }

        /**
         * Register state transition.
         * @param type event type
         * @param apply computes new state from current state and the event
         * @param <E> event type
         * @return this builder
         */
        public <E extends Event> Builder<T> on(Class<E> type, BiFunction<T, ? super E, T> apply) {
            Objects.requireNonNull(apply, "Apply function must be specified");
            appliers.on(type, (state, event) -> apply.apply(state, type.cast(event)));
            return this;
        }

        public AggregateType<T> build() {
            return new AggregateType<>(this);
        }
    }
}
