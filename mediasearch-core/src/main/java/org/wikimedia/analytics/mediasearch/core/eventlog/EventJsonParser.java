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

package org.wikimedia.analytics.mediasearch.core.eventlog;

import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.Timestamps;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionKey;

/**
 * Parses one JSON event record.
 *
 * Expected fields are dt (timestamp), session_id and action. Partition
 * fields year, month and day are optional. Every other field becomes an
 * attribute; the fields of a nested "attributes" object are flattened.
 * Objects and arrays are kept as their JSON text.
 */
public class EventJsonParser {

    public static final String TIMESTAMP_FIELD = "dt";
    public static final String SESSION_ID_FIELD = "session_id";
    public static final String ACTION_FIELD = "action";
    public static final String ATTRIBUTES_FIELD = "attributes";

    // Make sure to reuse, expensive to create.
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws IOException if the record is not JSON or lacks a valid timestamp
     */
    public Event parse(String json) throws IOException {
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new IOException("Event record is not a JSON object: " + json);
        }
        return parse(node);
    }

    public Event parse(JsonNode node) throws IOException {
        Instant timestamp;
        try {
            timestamp = Timestamps.parse(node.path(TIMESTAMP_FIELD).asText(null));
        } catch (IllegalArgumentException e) {
            throw new IOException("Event has an invalid " + TIMESTAMP_FIELD + ": " + node, e);
        }
        if (timestamp == null) {
            throw new IOException("Event has no " + TIMESTAMP_FIELD + ": " + node);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (isReserved(name)) {
                continue;
            }
            if (ATTRIBUTES_FIELD.equals(name) && field.getValue().isObject()) {
                Iterator<Map.Entry<String, JsonNode>> nested = field.getValue().fields();
                while (nested.hasNext()) {
                    Map.Entry<String, JsonNode> attribute = nested.next();
                    putValue(attributes, attribute.getKey(), attribute.getValue());
                }
            } else {
                putValue(attributes, name, field.getValue());
            }
        }

        return new Event(
            timestamp,
            node.path(SESSION_ID_FIELD).asText(null),
            node.path(ACTION_FIELD).asText(null),
            attributes,
            partitionKey(node)
        );
    }

    private static boolean isReserved(String name) {
        return TIMESTAMP_FIELD.equals(name)
            || SESSION_ID_FIELD.equals(name)
            || ACTION_FIELD.equals(name)
            || "year".equals(name)
            || "month".equals(name)
            || "day".equals(name);
    }

    private static PartitionKey partitionKey(JsonNode node) {
        JsonNode year = node.get("year");
        JsonNode month = node.get("month");
        JsonNode day = node.get("day");
        if (year == null || month == null || day == null
            || !year.canConvertToInt() || !month.canConvertToInt() || !day.canConvertToInt()) {
            return null;
        }
        return new PartitionKey(year.asInt(), month.asInt(), day.asInt());
    }

    private static void putValue(Map<String, Object> attributes, String name, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        if (value.isTextual()) {
            attributes.put(name, value.textValue());
        } else if (value.isIntegralNumber()) {
            attributes.put(name, value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue());
        } else if (value.isNumber()) {
            attributes.put(name, value.doubleValue());
        } else if (value.isBoolean()) {
            attributes.put(name, value.booleanValue());
        } else {
            attributes.put(name, value.toString());
        }
    }
}
