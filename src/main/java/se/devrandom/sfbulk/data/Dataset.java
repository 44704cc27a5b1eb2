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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of string values: an ordered column list and ordered rows.
 * Used for data sent to Salesforce as well as for downloaded results.
 */
public final class Dataset {
    private final List<String> columns;
    private final List<Map<String, String>> rows;

    private Dataset(List<String> columns, List<Map<String, String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    /**
     * Concatenates the given datasets row-wise, keeping the order of the parts and of the rows
     * inside each part. Columns are the union of all parts in first-seen order.
     */
    public static Dataset concat(List<Dataset> parts) {
        Set<String> columns = new LinkedHashSet<>();
        int totalRows = 0;
        for (Dataset part : parts) {
            columns.addAll(part.columns);
            totalRows += part.rows.size();
        }
        List<Map<String, String>> rows = new ArrayList<>(totalRows);
        for (Dataset part : parts) {
            rows.addAll(part.rows);
        }
        return new Dataset(List.copyOf(columns), Collections.unmodifiableList(rows));
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public Map<String, String> getRow(int index) {
        return rows.get(index);
    }

    /** Values of one column, empty string where a row has no value. */
    public List<String> getColumn(String column) {
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            values.add(row.getOrDefault(column, ""));
        }
        return values;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Rows {@code [from, to)} as a new dataset with the same columns. */
    public Dataset slice(int from, int to) {
        return new Dataset(columns, List.copyOf(rows.subList(from, to)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + '}';
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<Map<String, String>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            if (new LinkedHashSet<>(columns).size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        /** Adds a row from positional values; missing trailing values become empty strings. */
        public Builder addRow(String... values) {
            return addRow(Arrays.asList(values));
        }

        public Builder addRow(List<String> values) {
            if (values.size() > columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d values but dataset has %d columns", values.size(), columns.size()));
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                String value = i < values.size() ? values.get(i) : null;
                row.put(columns.get(i), value == null ? "" : value);
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        public Builder addRow(Map<String, String> values) {
            List<String> ordered = new ArrayList<>(columns.size());
            for (String column : columns) {
                ordered.add(values.get(column));
            }
            for (String key : values.keySet()) {
                if (!columns.contains(key)) {
                    throw new IllegalArgumentException("Unknown column: " + key);
                }
            }
            return addRow(ordered);
        }

        public Dataset build() {
            return new Dataset(columns, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }
}
