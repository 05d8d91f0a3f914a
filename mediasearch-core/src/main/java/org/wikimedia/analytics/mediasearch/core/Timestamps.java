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
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Static functions to read the timestamp formats found in event data:
 * ISO-8601 with a zone (2021-03-10T12:00:00Z, 2021-03-10T12:00:00+00:00),
 * and zone-less ISO or SQL timestamps (2021-03-10 12:00:00) read as UTC.
 */
public class Timestamps {

    private static final Pattern SQL_SEPARATOR = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) ");

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private Timestamps() {
    }

    /**
     * @param value timestamp text
     * @return the instant, or null if value is empty
     * @throws IllegalArgumentException if the value is not a known timestamp format
     */
    public static Instant parse(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String text = SQL_SEPARATOR.matcher(value.trim()).replaceFirst("$1T");
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException withZone) {
            try {
                return LocalDateTime.parse(text, LOCAL_FORMAT).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException withoutZone) {
                throw new IllegalArgumentException("Unparseable timestamp '" + value + "'", withoutZone);
            }
        }
    }
}
