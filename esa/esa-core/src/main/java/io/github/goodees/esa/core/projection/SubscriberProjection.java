package io.github.goodees.esa.core.projection;

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
import io.github.goodees.esa.core.StoredEvent;
import io.github.goodees.esa.core.matching.TypeSwitch;
import io.github.goodees.esa.core.pipeline.EventPublisher;
import io.github.goodees.esa.core.pipeline.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Projection maintained incrementally from published events. It keeps one view per aggregate in memory.
 *
 * <p>Every event is passed to the handler registered for its type, events without handler are ignored as the
 * projection receives events of all aggregates. Handlers modify views through {@link Views}, which also allows
 * updating views of other aggregates that denormalize data of the event's aggregate.</p>
 *
 * <p>Views should be immutable values, so that a view returned by {@link #find(String)} cannot change the
 * projection.</p>
 * @param <V> type of view
 */
public class SubscriberProjection<V> implements Projection<V>, EventSubscriber {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberProjection.class);

    private final String name;
    private final TypeSwitch<ViewHandler<Event, V>> handlers;
    private final ConcurrentMap<String, V> views = new ConcurrentHashMap<>();
    private final Views<V> access = new MapViews();

    private SubscriberProjection(Builder<V> builder) {
        this.name = builder.name;
        this.handlers = builder.handlers.build();
    }

    public static <V> Builder<V> builder(String name) {
        return new Builder<>(name);
    }

    @Override
    public void apply(StoredEvent event) {
        Optional<ViewHandler<Event, V>> handler = handlers.lookup(event.getEvent().getClass());
        if (handler.isPresent()) {
            handler.get().handle(event.getAggregateId(), event.getEvent(), access);
        } else {
            logger.trace("{} ignores {}", name, event);
        }
    }

    @Override
    public Optional<V> find(String aggregateId) {
        return Optional.ofNullable(views.get(aggregateId));
    }

    /**
     * Ids of aggregates that have a view.
     * @return snapshot of the ids
     */
    public Set<String> ids() {
        return Collections.unmodifiableSet(new HashSet<>(views.keySet()));
    }

    /**
     * Discard all views and compute them again from given events. The projection should not receive events from
     * a publisher meanwhile.
     * @param events all events, in the order they were stored
     */
    public void rebuild(Iterable<StoredEvent> events) {
        views.clear();
        for (StoredEvent event : events) {
            apply(event);
        }
        logger.info("Rebuilt {} with {} views", name, views.size());
    }

    @Override
    public String toString() {
        return "SubscriberProjection[" + name + "]";
    }

    /**
     * Computes new views upon an event.
     * @param <E> type of event
     * @param <V> type of view
     */
    @FunctionalInterface
    public interface ViewHandler<E extends Event, V> {
        void handle(String aggregateId, E event, Views<V> views);
    }

    /**
     * Views of the projection, as modifiable by a {@link ViewHandler}.
     * @param <V> type of view
     */
    public interface Views<V> {
        void put(String aggregateId, V view);

        Optional<V> get(String aggregateId);

        /**
         * Replace the view of an aggregate by merging the event into it.
         * @param aggregateId the aggregate
         * @param merge computes new view from current one
         * @return false if there's no view for the aggregate
         */
        boolean update(String aggregateId, UnaryOperator<V> merge);

        /**
         * Replace all views matching a condition.
         * @param condition which views to refresh
         * @param refresh computes new view from current one
         * @return number of refreshed views
         */
        int refresh(Predicate<? super V> condition, UnaryOperator<V> refresh);
    }

    private class MapViews implements Views<V> {

        @Override
        public void put(String aggregateId, V view) {
            views.put(aggregateId, Objects.requireNonNull(view, "View cannot be null"));
        }

        @Override
        public Optional<V> get(String aggregateId) {
            return Optional.ofNullable(views.get(aggregateId));
        }

        @Override
        public boolean update(String aggregateId, UnaryOperator<V> merge) {
            V result = views.computeIfPresent(aggregateId, (id, current) -> merge.apply(current));
            if (result == null) {
                logger.warn("{} has no view for {} to update", name, aggregateId);
                return false;
            }
            return true;
        }

        @Override
        public int refresh(Predicate<? super V> condition, UnaryOperator<V> refresh) {
            int count = 0;
            for (String id : views.keySet()) {
                boolean[] matched = new boolean[1];
                views.computeIfPresent(id, (k, current) -> {
                    if (condition.test(current)) {
                        matched[0] = true;
                        return refresh.apply(current);
                    }
                    return current;
                });
                if (matched[0]) {
                    count++;
                }
            }
            return count;
        }
    }

    public static class Builder<V> {
        private final String name;
        private final TypeSwitch.Builder<ViewHandler<Event, V>> handlers = TypeSwitch.builder();

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "Projection name must be specified");
        }

        public <E extends Event> Builder<V> on(Class<E> type, ViewHandler<? super E, V> handler) {
            Objects.requireNonNull(handler, "Handler must be specified");
            handlers.on(type, (id, event, views) -> handler.handle(id, type.cast(event), views));
            return this;
        }

        public SubscriberProjection<V> build() {
            return new SubscriberProjection<>(this);
        }

        /**
         * Build the projection and subscribe it to the publisher.
         * @param publisher publisher of appended events
         * @return subscribed projection
         */
        public SubscriberProjection<V> subscribeTo(EventPublisher publisher) {
            SubscriberProjection<V> projection = build();
            publisher.subscribe(projection);
            return projection;
        }
    }
}
