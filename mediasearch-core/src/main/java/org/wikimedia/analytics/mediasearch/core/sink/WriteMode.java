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

package org.wikimedia.analytics.mediasearch.core.sink;

import java.io.IOException;

import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;

/**
 * How a daily run writes its rows.
 */
public enum WriteMode {
    /**
     * Blind append. Re-running a date duplicates its rows.
     */
    APPEND {
        @Override
        public void write(AggregateSink sink, AggregateTable table) throws IOException {
            sink.append(table);
        }
    },
    /**
     * Rows of the log date are replaced, re-running a date is idempotent.
     */
    REPLACE {
        @Override
        public void write(AggregateSink sink, AggregateTable table) throws IOException {
            sink.replace(table);
        }
    };

    public abstract void write(AggregateSink sink, AggregateTable table) throws IOException;

    public static WriteMode fromName(String name) {
        return valueOf(name.trim().toUpperCase());
    }
}
