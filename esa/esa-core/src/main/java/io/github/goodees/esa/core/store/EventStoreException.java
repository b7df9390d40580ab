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

/**
 * Exception generated when creating, appending to or publishing a stream fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;
    private final String aggregateId;

    public enum Fault {
        DUPLICATE_STREAM, UNKNOWN_AGGREGATE, CONCURRENCY_CONFLICT, LOCK_TIMEOUT, SUBSCRIBER_FAILED, STORE_FAILED
    }

    protected EventStoreException(Fault type, String aggregateId, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
        this.aggregateId = aggregateId;
    }

    public Fault getFault() {
        return fault;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Whether the caller may reload the aggregate and retry the operation with a fresh unit of work.
     * @return true for conflicts and lock timeouts
     */
    public boolean isRecoverable() {
        return fault == Fault.CONCURRENCY_CONFLICT || fault == Fault.LOCK_TIMEOUT;
    }

    public static EventStoreException duplicateStream(String aggregateId) {
        return new EventStoreException(Fault.DUPLICATE_STREAM, aggregateId, "Stream for aggregate " + aggregateId
                + " already exists", null);
    }

    public static EventStoreException unknownAggregate(String aggregateId) {
        return new EventStoreException(Fault.UNKNOWN_AGGREGATE, aggregateId, "No stream exists for aggregate "
                + aggregateId, null);
    }

    public static EventStoreException concurrencyConflict(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.CONCURRENCY_CONFLICT, aggregateId, "Aggregate " + aggregateId
                + " appending at version " + expectedVersion + " attempted while current version is "
                + actualVersion, null);
    }

    public static EventStoreException lockTimeout(String aggregateId, long timeoutMillis, Throwable cause) {
        return new EventStoreException(Fault.LOCK_TIMEOUT, aggregateId, "Could not acquire write lock of aggregate "
                + aggregateId + " within " + timeoutMillis + " ms", cause);
    }

    public static EventStoreException subscriberFailed(String aggregateId, Object subscriber, Throwable cause) {
        return new EventStoreException(Fault.SUBSCRIBER_FAILED, aggregateId, "Subscriber " + subscriber
                + " failed to apply events of aggregate " + aggregateId + ". " + cause.getMessage(), cause);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.STORE_FAILED, aggregateId,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }
}
