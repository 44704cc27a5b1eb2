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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void concatKeepsRowOrderAndUnionsColumns() {
        Dataset first = Dataset.builder("Id", "Name").addRow("1", "A").addRow("2", "B").build();
        Dataset second = Dataset.builder("Id", "Error").addRow("3", "DUPLICATE_VALUE").build();

        Dataset all = Dataset.concat(List.of(first, Dataset.empty(), second));

        assertThat(all.getColumns()).containsExactly("Id", "Name", "Error");
        assertThat(all.getColumn("Id")).containsExactly("1", "2", "3");
        assertThat(all.getColumn("Error")).containsExactly("", "", "DUPLICATE_VALUE");
    }

    @Test
    void concatDoesNotDeduplicate() {
        Dataset part = Dataset.builder("Id").addRow("1").build();

        assertThat(Dataset.concat(List.of(part, part)).size()).isEqualTo(2);
    }

    @Test
    void shortRowsArePaddedWithEmptyValues() {
        Dataset dataset = Dataset.builder("Id", "Name", "Phone").addRow("1").addRow("2", null, "555").build();

        assertThat(dataset.getRow(0)).containsExactly(
                Map.entry("Id", "1"), Map.entry("Name", ""), Map.entry("Phone", ""));
        assertThat(dataset.getRow(1).get("Name")).isEmpty();
    }

    @Test
    void invalidRowsAndColumnsAreRejected() {
        assertThatThrownBy(() -> Dataset.builder("Id", "Id")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Dataset.builder("Id").addRow("1", "2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Dataset.builder("Id").addRow(Map.of("Name", "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rowsAreImmutable() {
        Dataset dataset = Dataset.builder("Id").addRow("1").build();

        assertThatThrownBy(() -> dataset.getRows().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> dataset.getRow(0).put("Id", "2")).isInstanceOf(UnsupportedOperationException.class);
    }
}
