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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionKey;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;

/**
 * Event log stored as JSON lines files.
 *
 * The location is either a single file, whose events are pruned on their
 * partition key, or a directory laid out as
 * year=YYYY/month=M/day=D/*.json, of which only the selected partition
 * directories are read.
 */
public class JsonLinesEventLog implements EventLog {

    private static final Logger log = Logger.getLogger(JsonLinesEventLog.class.getName());

    private final File location;
    private final boolean requireAllPartitions;
    private final EventJsonParser parser = new EventJsonParser();

    public JsonLinesEventLog(File location) {
        this(location, false);
    }

    /**
     * @param requireAllPartitions fail when a selected partition directory is missing
     */
    public JsonLinesEventLog(File location, boolean requireAllPartitions) {
        this.location = location;
        this.requireAllPartitions = requireAllPartitions;
    }

    public static File partitionDirectory(File root, PartitionKey key) {
        return new File(root, "year=" + key.getYear() + File.separator
            + "month=" + key.getMonth() + File.separator
            + "day=" + key.getDay());
    }

    @Override
    public List<Event> scan(PartitionPredicate predicate) throws InputUnavailableException {
        if (!location.exists()) {
            throw new InputUnavailableException("Event log " + location + " does not exist");
        }

        List<Event> events = new ArrayList<>();
        if (location.isFile()) {
            for (Event event : read(location)) {
                if (predicate.matches(event.getPartitionKey())) {
                    events.add(event);
                }
            }
        } else {
            for (PartitionKey key : predicate.partitions()) {
                File directory = partitionDirectory(location, key);
                if (!directory.isDirectory()) {
                    if (requireAllPartitions) {
                        throw new InputUnavailableException("Partition " + key + " is missing from " + location);
                    }
                    log.warn("Partition " + key + " is missing from " + location);
                    continue;
                }
                File[] files = directory.listFiles((dir, name) -> name.endsWith(".json") || name.endsWith(".jsonl"));
                if (files == null) {
                    throw new InputUnavailableException("Can not list partition directory " + directory);
                }
                Arrays.sort(files);
                for (File file : files) {
                    for (Event event : read(file)) {
                        // events read from a partition directory belong to that partition
                        events.add(new Event(event.getTimestamp(), event.getSessionId(), event.getAction(),
                            event.getAttributes(), key));
                    }
                }
            }
        }

        log.info("Read " + events.size() + " events from " + location + " for " + predicate);
        return events;
    }

    private List<Event> read(File file) throws InputUnavailableException {
        List<Event> events = new ArrayList<>();
        int lineNumber = 0;
        try (LineIterator lines = FileUtils.lineIterator(file, StandardCharsets.UTF_8.name())) {
            while (lines.hasNext()) {
                String line = lines.nextLine();
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                events.add(parser.parse(line));
            }
        } catch (IOException e) {
            throw new InputUnavailableException("Failed reading events from " + file + " at line " + lineNumber, e);
        }
        return events;
    }
}
