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

import java.time.Instant;
import java.util.Objects;

/**
 * An event together with its position in the aggregate's stream. This is what subscribers of the store receive.
 */
public final class StoredEvent {
    private final String aggregateId;
    private final long version;
    private final Instant timestamp;
    private final Event event;

    public StoredEvent(String aggregateId, long version, Instant timestamp, Event event) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Stored event version starts at 1, was " + version);
        }
        this.version = version;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.event = Objects.requireNonNull(event, "Event must be specified");
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Version of the stream after this event was appended, i.e. its 1-based position in the stream.
     * @return stream version this event produced
     */
    public long getVersion() {
        return version;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Event getEvent() {
        return event;
    }

    public String getType() {
        return event.getType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredEvent)) {
            return false;
        }
        StoredEvent that = (StoredEvent) o;
        return version == that.version && aggregateId.equals(that.aggregateId) && timestamp.equals(that.timestamp)
                && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, timestamp, event);
    }

    @Override
    public String toString() {
        return "StoredEvent{" + "aggregateId=" + aggregateId + ", version=" + version + ", timestamp=" + timestamp
                + ", event=" + event + '}';
    }
}
