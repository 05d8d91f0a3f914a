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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateRow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;

/**
 * Writes each table to &lt;directory&gt;/&lt;table&gt;.tsv, with a header line.
 *
 * Tabs and line breaks inside values are replaced by spaces.
 */
public class TsvAggregateSink implements AggregateSink {

    private static final Logger log = Logger.getLogger(TsvAggregateSink.class.getName());

    private static final Joiner TAB = Joiner.on('\t').useForNull("");

    private final File directory;

    public TsvAggregateSink(File directory) {
        this.directory = directory;
    }

    public File fileOf(String table) {
        return new File(directory, table + ".tsv");
    }

    @Override
    public void append(AggregateTable table) throws IOException {
        File file = fileOf(table.getName());
        List<String> lines = new ArrayList<>();
        if (file.exists()) {
            checkHeader(file, table);
        } else {
            lines.add(header(table));
        }
        lines.addAll(format(table.getRows()));
        FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), lines, "\n", true);
        log.info("Appended " + table.getRows().size() + " rows to " + file);
    }

    @Override
    public void replace(AggregateTable table) throws IOException {
        File file = fileOf(table.getName());
        List<String> lines = new ArrayList<>();
        lines.add(header(table));

        if (file.exists()) {
            checkHeader(file, table);
            String datePrefix = table.getLogDate() + "\t";
            List<String> existing = FileUtils.readLines(file, StandardCharsets.UTF_8);
            int dropped = 0;
            for (String line : existing.subList(1, existing.size())) {
                if (line.startsWith(datePrefix)) {
                    dropped++;
                } else {
                    lines.add(line);
                }
            }
            log.info("Dropping " + dropped + " rows of " + table.getLogDate() + " from " + file);
        }

        lines.addAll(format(table.getRows()));
        FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), lines, "\n", false);
        log.info("Wrote " + table.getRows().size() + " rows of " + table.getLogDate() + " to " + file);
    }

    private static String header(AggregateTable table) {
        return TAB.join(table.getColumns());
    }

    private static void checkHeader(File file, AggregateTable table) throws IOException {
        List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
        String expected = header(table);
        if (lines.isEmpty() || !lines.get(0).equals(expected)) {
            throw new IOException("Columns of " + file + " do not match table " + table.getName()
                + ", expected '" + expected + "'");
        }
    }

    private static List<String> format(List<AggregateRow> rows) {
        List<String> lines = new ArrayList<>(rows.size());
        for (AggregateRow row : rows) {
            List<String> values = new ArrayList<>();
            for (Object value : row.getValues()) {
                values.add(value == null ? null : value.toString().replaceAll("[\t\r\n]", " "));
            }
            lines.add(TAB.join(values));
        }
        return lines;
    }
}
