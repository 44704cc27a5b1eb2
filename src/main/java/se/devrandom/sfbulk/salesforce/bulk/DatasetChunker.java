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
package se.devrandom.sfbulk.salesforce.bulk;

import se.devrandom.sfbulk.data.Dataset;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a dataset into contiguous chunks of at most {@code batchSize} rows, one per batch.
 * An empty dataset yields no chunks.
 */
public class DatasetChunker {

    public List<Dataset> chunk(Dataset dataset, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        int rowCount = dataset.size();
        int chunkCount = rowCount / batchSize + (rowCount % batchSize == 0 ? 0 : 1);

        List<Dataset> chunks = new ArrayList<>(chunkCount);
        for (int i = 0; i < chunkCount; i++) {
            int from = i * batchSize;
            int to = from + Math.min(batchSize, rowCount - from);
            chunks.add(dataset.slice(from, to));
        }
        return chunks;
    }
}
