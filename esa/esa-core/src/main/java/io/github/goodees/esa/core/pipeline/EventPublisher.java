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
import io.github.goodees.esa.core.StoredEvent;
import io.github.goodees.esa.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Notifies subscribers of every event that was successfully appended.
 *
 * <p>Notification happens after the rest of the pipeline stored the events, within the same call. Events are delivered
 * in the order they were appended, and each event to all subscribers in the order they subscribed before the next
 * event is delivered. The command that caused the append doesn't complete before all subscribers processed the new
 * events.</p>
 *
 * <p>When a subscriber throws, the {@link SubscriberFailurePolicy} decides whether the caller gets to know.</p>
 */
public class EventPublisher implements StoreMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final SubscriberFailurePolicy failurePolicy;
    private final Clock clock;

    public EventPublisher(SubscriberFailurePolicy failurePolicy, Clock clock) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "Failure policy must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    public EventPublisher(SubscriberFailurePolicy failurePolicy) {
        this(failurePolicy, Clock.systemUTC());
    }

    public EventPublisher() {
        this(SubscriberFailurePolicy.PROPAGATE);
    }

    /**
     * Register a subscriber for events appended from now on.
     * @param subscriber the subscriber
     */
    public void subscribe(EventSubscriber subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "Subscriber must be specified"));
        logger.debug("Subscribed {}", subscriber);
    }

    public boolean unsubscribe(EventSubscriber subscriber) {
        return subscribers.remove(subscriber);
    }

    public SubscriberFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    @Override
    public void append(Append append, Chain next) throws EventStoreException {
        long baseVersion = append.createsStream() ? 0 : next.currentVersion(append.aggregateId());
        next.proceed(append);
        if (append.events().isEmpty()) {
            return;
        }
        publish(toStored(append, baseVersion));
    }

    private List<StoredEvent> toStored(Append append, long baseVersion) {
        Instant now = clock.instant();
        List<StoredEvent> result = new ArrayList<>(append.events().size());
        long version = baseVersion;
        for (Event event : append.events()) {
            result.add(new StoredEvent(append.aggregateId(), ++version, now, event));
        }
        return result;
    }

    private void publish(List<StoredEvent> events) throws EventStoreException {
        for (StoredEvent event : events) {
            for (EventSubscriber subscriber : subscribers) {
                try {
                    subscriber.apply(event);
                } catch (RuntimeException e) {
                    if (failurePolicy == SubscriberFailurePolicy.PROPAGATE) {
                        logger.info("Subscriber {} failed on {}", subscriber, event, e);
                        throw EventStoreException.subscriberFailed(event.getAggregateId(), subscriber, e);
                    }
                    logger.error("Subscriber {} failed on {}, continuing with remaining subscribers", subscriber,
                        event, e);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "EventPublisher[" + failurePolicy + ", subscribers=" + subscribers.size() + "]";
    }
}
