/**
 * Copyright (C) 2020  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.mediasearch.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.math.NumberUtils;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionKey;

/**
 * POJO that encapsulates one user interaction event of the search logs.
 *
 * Events are supplied by an event log and never modified. Attributes hold
 * the schema specific fields (filter type and value, click position,
 * namespace, ...) as strings, numbers or booleans.
 */
public class Event {
    private final Instant timestamp;
    private final String sessionId;
    private final String action;
    private final Map<String, Object> attributes;
    private final PartitionKey partitionKey;

    public Event(Instant timestamp, String sessionId, String action, Map<String, Object> attributes) {
        this(timestamp, sessionId, action, attributes, null);
    }

    /**
     * @param partitionKey partition the event was read from; when null the
     *                     partition is derived from the timestamp
     */
    public Event(Instant timestamp, String sessionId, String action,
                 Map<String, Object> attributes, PartitionKey partitionKey) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.sessionId = sessionId;
        this.action = action;

        if (attributes == null || attributes.isEmpty()) {
            this.attributes = Collections.emptyMap();
        } else {
            this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        this.partitionKey = partitionKey != null ? partitionKey : PartitionKey.fromTimestamp(timestamp);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public PartitionKey getPartitionKey() {
        return partitionKey;
    }

    public boolean hasAttribute(String name) {
        return attributes.get(name) != null;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * @return the attribute as a string, null if the event does not have it
     */
    public String getStringAttribute(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    /**
     * Numeric view of an attribute. Numbers are returned as is, numeric
     * strings are parsed.
     *
     * @return the value, or null if missing or not numeric
     */
    public Double getNumericAttribute(String name) {
        Object value = attributes.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && NumberUtils.isCreatable((String) value)) {
            return NumberUtils.createNumber((String) value).doubleValue();
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event event = (Event) o;
        return timestamp.equals(event.timestamp)
            && Objects.equals(sessionId, event.sessionId)
            && Objects.equals(action, event.action)
            && attributes.equals(event.attributes)
            && partitionKey.equals(event.partitionKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, sessionId, action, attributes, partitionKey);
    }

    @Override
    public String toString() {
        return "Event{"
            + "timestamp=" + timestamp
            + ", sessionId='" + sessionId + '\''
            + ", action='" + action + '\''
            + ", attributes=" + attributes
            + ", partition=" + partitionKey
            + '}';
    }
}
