/*
 * SF Bulk - Salesforce Bulk API job orchestrator
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.sfbulk.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link Dataset} and the CSV dialect used by the Bulk API
 * (header row, comma separated, double-quote quoting, LF line endings).
 */
public class CsvCodec {
    private static final Logger log = LoggerFactory.getLogger(CsvCodec.class);

    // Body Salesforce returns instead of CSV when a query matched nothing
    static final String NO_RECORDS_BODY = "Records not found for this query";

    private final CsvMapper csvMapper = new CsvMapper();

    public String write(Dataset dataset) {
        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : dataset.getColumns()) {
            schemaBuilder.addColumn(column);
        }
        CsvSchema schema = schemaBuilder.build()
                .withHeader()
                .withLineSeparator("\n");

        List<Map<String, String>> rows = new ArrayList<>(dataset.size());
        for (Map<String, String> row : dataset.getRows()) {
            Map<String, String> complete = new LinkedHashMap<>();
            for (String column : dataset.getColumns()) {
                complete.put(column, row.getOrDefault(column, ""));
            }
            rows.add(complete);
        }

        try {
            if (rows.isEmpty()) {
                // Jackson only emits the header together with the first row
                return csvMapper.writer(schema.withoutHeader()).writeValueAsString(List.of(headerRow(dataset)));
            }
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV for " + dataset, e);
        }
    }

    public Dataset read(String csv) {
        if (csv == null || csv.isBlank()) {
            return Dataset.empty();
        }
        if (csv.strip().equals(NO_RECORDS_BODY)) {
            log.debug("Result body reports no records");
            return Dataset.empty();
        }

        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(csv)) {
            while (iterator.hasNext()) {
                lines.add(iterator.next());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse CSV response", e);
        }

        if (lines.isEmpty()) {
            return Dataset.empty();
        }
        Dataset.Builder builder = Dataset.builder(Arrays.asList(lines.get(0)));
        int columnCount = lines.get(0).length;
        for (String[] line : lines.subList(1, lines.size())) {
            if (line.length > columnCount) {
                throw new IllegalArgumentException(String.format(
                        "CSV row has %d values but header has %d columns", line.length, columnCount));
            }
            builder.addRow(line);
        }
        return builder.build();
    }

    private static Map<String, String> headerRow(Dataset dataset) {
        Map<String, String> header = new LinkedHashMap<>();
        for (String column : dataset.getColumns()) {
            header.put(column, column);
        }
        return header;
    }
}
