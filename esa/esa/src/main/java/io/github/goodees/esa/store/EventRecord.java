package io.github.goodees.esa.store;

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

import java.util.Objects;

/**
 * Serialized form of a stored event.
 */
public final class EventRecord {
    private final String aggregateId;
    private final long version;
    private final String type;
    private final int payloadVersion;
    private final String payload;

    public EventRecord(String aggregateId, long version, String type, int payloadVersion, String payload) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.version = version;
        this.type = Objects.requireNonNull(type);
        this.payloadVersion = payloadVersion;
        this.payload = Objects.requireNonNull(payload);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    public String getType() {
        return type;
    }

    public int getPayloadVersion() {
        return payloadVersion;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "EventRecord{" + aggregateId + "@" + version + ", type=" + type + ", payloadVersion=" + payloadVersion
                + '}';
    }
}
