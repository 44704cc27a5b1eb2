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
package se.devrandom.sfbulk.salesforce.bulk.errors;

/**
 * A batch ended in Failed or Not Processed.
 */
public class BatchFailedException extends BulkJobException {
    private final String jobId;
    private final String batchId;
    private final String stateMessage;

    public BatchFailedException(String jobId, String batchId, String stateMessage) {
        super(String.format("Batch %s of job %s failed: %s", batchId, jobId, stateMessage));
        this.jobId = jobId;
        this.batchId = batchId;
        this.stateMessage = stateMessage;
    }

    public String getJobId() {
        return jobId;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getStateMessage() {
        return stateMessage;
    }
}
