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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.sfbulk.salesforce.bulk.errors.DuplicateJobException;
import se.devrandom.sfbulk.salesforce.bulk.errors.UnknownBatchException;
import se.devrandom.sfbulk.salesforce.bulk.errors.UnknownJobException;
import se.devrandom.sfbulk.salesforce.objects.BulkJob;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jobs known to one orchestrator and the batches submitted to each, in submission order.
 * Batch lists are append-only and a batch id belongs to exactly one job.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, BulkJob> jobs = new LinkedHashMap<>();
    // job id => [batch id, batch id, ...]
    private final Map<String, List<String>> batchesByJob = new HashMap<>();
    private final Map<String, String> jobByBatch = new HashMap<>();

    public synchronized void registerJob(BulkJob job) {
        if (jobs.containsKey(job.getId())) {
            log.error("Job id {} registered twice", job.getId());
            throw new DuplicateJobException(job.getId());
        }
        jobs.put(job.getId(), job);
        batchesByJob.put(job.getId(), new ArrayList<>());
    }

    public synchronized void appendBatch(String jobId, String batchId) {
        List<String> batches = batchesByJob.get(jobId);
        if (batches == null) {
            log.error("Cannot add batch {} to unknown job {}", batchId, jobId);
            throw new UnknownJobException(jobId);
        }
        String owner = jobByBatch.get(batchId);
        if (owner != null) {
            log.error("Batch {} already belongs to job {}", batchId, owner);
            throw new IllegalStateException(String.format(
                    "Batch id '%s' is already registered to job '%s'", batchId, owner));
        }
        batches.add(batchId);
        jobByBatch.put(batchId, jobId);
    }

    public synchronized String lookupJobForBatch(String batchId) {
        String jobId = jobByBatch.get(batchId);
        if (jobId == null) {
            log.error("Batch id {} is not registered to any job", batchId);
            throw new UnknownBatchException(batchId);
        }
        return jobId;
    }

    /** Snapshot of the job's batch ids in submission order. */
    public synchronized List<String> batchesOf(String jobId) {
        List<String> batches = batchesByJob.get(jobId);
        if (batches == null) {
            log.error("Job id {} is not registered", jobId);
            throw new UnknownJobException(jobId);
        }
        return List.copyOf(batches);
    }

    public synchronized BulkJob getJob(String jobId) {
        return findJob(jobId).orElseThrow(() -> {
            log.error("Job id {} is not registered", jobId);
            return new UnknownJobException(jobId);
        });
    }

    public synchronized Optional<BulkJob> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public synchronized List<BulkJob> getJobs() {
        return List.copyOf(jobs.values());
    }
}
