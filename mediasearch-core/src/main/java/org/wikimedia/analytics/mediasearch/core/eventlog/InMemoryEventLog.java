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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;

/**
 * Event log backed by a collection, pruned with the partition predicate
 * like a partitioned table would be.
 */
public class InMemoryEventLog implements EventLog {

    private final List<Event> events;

    public InMemoryEventLog(Collection<Event> events) {
        this.events = new ArrayList<>(events);
    }

    @Override
    public List<Event> scan(PartitionPredicate predicate) {
        List<Event> selected = new ArrayList<>();
        for (Event event : events) {
            if (predicate.matches(event.getPartitionKey())) {
                selected.add(event);
            }
        }
        return selected;
    }
}
