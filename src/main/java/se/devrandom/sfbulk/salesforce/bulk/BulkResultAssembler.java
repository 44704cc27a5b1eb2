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
import se.devrandom.sfbulk.config.BulkJobProperties;
import se.devrandom.sfbulk.data.CsvCodec;
import se.devrandom.sfbulk.data.Dataset;
import se.devrandom.sfbulk.salesforce.bulk.errors.BulkJobTimeoutException;
import se.devrandom.sfbulk.salesforce.bulk.errors.JobHasNoBatchesException;
import se.devrandom.sfbulk.salesforce.objects.StatusKind;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;
import se.devrandom.sfbulk.salesforce.objects.WaitOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Downloads the results of a finished job and concatenates them into one dataset.
 * Row order is kept as delivered: query segments in the order the API lists them,
 * operation results in batch submission order.
 */
public class BulkResultAssembler {
    private static final Logger log = LoggerFactory.getLogger(BulkResultAssembler.class);

    private final BulkApiClient client;
    private final JobRegistry jobRegistry;
    private final StatusCache statusCache;
    private final StatusPoller statusPoller;
    private final CsvCodec csvCodec;
    private final BulkJobProperties properties;

    public BulkResultAssembler(BulkApiClient client, JobRegistry jobRegistry, StatusCache statusCache,
                               StatusPoller statusPoller, CsvCodec csvCodec, BulkJobProperties properties) {
        this.client = client;
        this.jobRegistry = jobRegistry;
        this.statusCache = statusCache;
        this.statusPoller = statusPoller;
        this.csvCodec = csvCodec;
        this.properties = properties;
    }

    public Dataset collectQueryResults(String jobId) {
        List<String> batches = jobRegistry.batchesOf(jobId);
        if (batches.isEmpty()) {
            log.error("Query job {} has no batch to collect", jobId);
            throw new JobHasNoBatchesException(jobId);
        }
        // a query job runs as a single batch
        String batchId = batches.get(0);

        WaitOutcome outcome = statusPoller.waitForBatch(
                batchId, properties.getBatchWaitTimeout(), properties.getBatchPollInterval());
        if (!outcome.isCompleted()) {
            log.error("Query batch {} of job {} still running after {}", batchId, jobId, properties.getBatchWaitTimeout());
            throw new BulkJobTimeoutException("Batch", batchId, properties.getBatchWaitTimeout());
        }

        List<String> resultIds = client.getQueryResultIds(jobId, batchId);
        log.debug("Query batch {} has {} result segment(s): {}", batchId, resultIds.size(), resultIds);
        List<Dataset> segments = new ArrayList<>(resultIds.size());
        for (String resultId : resultIds) {
            log.debug("Downloading result {} of batch {}", resultId, batchId);
            segments.add(csvCodec.read(client.getQueryResult(jobId, batchId, resultId)));
        }
        Dataset results = Dataset.concat(segments);

        StatusRecord jobStatus = statusCache.get(jobId, StatusKind.JOB, true);
        log.info("Query job {} finished: {} rows in {} segment(s), {}",
                jobId, results.size(), segments.size(), jobSummary(jobStatus));
        return results;
    }

    public Dataset collectOperationResults(String jobId) {
        WaitOutcome outcome = statusPoller.waitForJob(
                jobId, properties.getJobWaitTimeout(), properties.getJobPollInterval());
        if (!outcome.isCompleted()) {
            log.error("Job {} still running after {}", jobId, properties.getJobWaitTimeout());
            throw new BulkJobTimeoutException("Job", jobId, properties.getJobWaitTimeout());
        }

        List<String> batches = jobRegistry.batchesOf(jobId);
        List<Dataset> parts = new ArrayList<>(batches.size());
        for (String batchId : batches) {
            Optional<StatusRecord> batchStatus = statusCache.peek(batchId, StatusKind.BATCH);
            batchStatus.ifPresent(status -> log.info("Batch {}: {}", batchId, batchSummary(status)));
            parts.add(csvCodec.read(client.getBatchResult(jobId, batchId)));
        }
        Dataset results = Dataset.concat(parts);

        StatusRecord jobStatus = statusCache.get(jobId, StatusKind.JOB, true);
        log.info("Job {} finished: {} result rows from {} batch(es), {}",
                jobId, results.size(), batches.size(), jobSummary(jobStatus));
        return results;
    }

    private static String jobSummary(StatusRecord status) {
        return String.format("state=%s processed=%s failed=%s processingTime=%sms",
                status.getState(),
                status.get("numberRecordsProcessed"),
                status.get("numberRecordsFailed"),
                status.get("totalProcessingTime"));
    }

    private static String batchSummary(StatusRecord status) {
        return String.format("state=%s processed=%s failed=%s",
                status.getState(),
                status.get("numberRecordsProcessed"),
                status.get("numberRecordsFailed"));
    }
}
