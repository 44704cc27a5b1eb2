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
import se.devrandom.sfbulk.salesforce.objects.BatchOutcome;
import se.devrandom.sfbulk.salesforce.objects.BulkJob;
import se.devrandom.sfbulk.salesforce.objects.ContentType;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.JobState;
import se.devrandom.sfbulk.salesforce.objects.Operation;
import se.devrandom.sfbulk.salesforce.objects.StatusKind;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;
import se.devrandom.sfbulk.salesforce.objects.WaitOutcome;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for running Bulk API 1.0 jobs.
 *
 * <p>Creates jobs, splits input data into batches, tracks which batch belongs to which job,
 * polls until the work is done and assembles the results. Each instance keeps its own
 * registry and status cache; jobs created through one orchestrator are unknown to another.
 *
 * <pre>
 * String jobId = orchestrator.createInsertJob("Account");
 * orchestrator.submitData(jobId, accounts);
 * Dataset results = orchestrator.collectOperationResults(jobId);
 * </pre>
 */
public class BulkJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BulkJobOrchestrator.class);

    private static final Pattern FROM_CLAUSE = Pattern.compile("\\bFROM\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private final BulkApiClient client;
    private final BulkJobProperties properties;
    private final JobRegistry jobRegistry = new JobRegistry();
    private final StatusCache statusCache;
    private final StatusPoller statusPoller;
    private final BulkResultAssembler resultAssembler;
    private final DatasetChunker chunker = new DatasetChunker();
    private final CsvCodec csvCodec = new CsvCodec();

    public BulkJobOrchestrator(BulkApiClient client, BulkJobProperties properties) {
        this(client, properties, Sleeper.THREAD);
    }

    public BulkJobOrchestrator(BulkApiClient client, BulkJobProperties properties, Sleeper sleeper) {
        this.client = client;
        this.properties = properties;
        this.statusCache = new StatusCache(this::fetchStatus);
        this.statusPoller = new StatusPoller(statusCache, jobRegistry, sleeper);
        this.resultAssembler = new BulkResultAssembler(
                client, jobRegistry, statusCache, statusPoller, csvCodec, properties);
    }

    private StatusRecord fetchStatus(StatusKind kind, String id) {
        if (kind == StatusKind.JOB) {
            return client.getJobInfo(id);
        }
        return client.getBatchInfo(jobRegistry.lookupJobForBatch(id), id);
    }

    /** Creates the job remotely and registers it. Returns the id assigned by Salesforce. */
    public String createJob(JobSpec spec) {
        StatusRecord jobInfo = client.createJob(spec);
        String jobId = jobInfo.getId();
        if (jobId == null || jobId.isEmpty()) {
            log.error("Create job response for {} carried no id: {}", spec, jobInfo);
            throw new IllegalStateException("Bulk API returned no job id for " + spec);
        }
        jobRegistry.registerJob(new BulkJob(jobId, spec));
        log.info("Created {} job {} on {}", spec.getOperation().apiValue(), jobId, spec.getObject());
        return jobId;
    }

    public String createQueryJob(String object) {
        return createCsvJob(Operation.QUERY, object);
    }

    public String createInsertJob(String object) {
        return createCsvJob(Operation.INSERT, object);
    }

    public String createUpsertJob(String object, String externalIdFieldName) {
        return createJob(JobSpec.builder(Operation.UPSERT, object)
                .externalIdFieldName(externalIdFieldName)
                .contentType(ContentType.CSV)
                .build());
    }

    public String createUpdateJob(String object) {
        return createCsvJob(Operation.UPDATE, object);
    }

    public String createDeleteJob(String object) {
        return createCsvJob(Operation.DELETE, object);
    }

    public String createHardDeleteJob(String object) {
        return createCsvJob(Operation.HARD_DELETE, object);
    }

    private String createCsvJob(Operation operation, String object) {
        return createJob(JobSpec.builder(operation, object).contentType(ContentType.CSV).build());
    }

    /**
     * Creates a query job for the object named in the FROM clause and submits the statement.
     *
     * @return the job id
     */
    public String query(String soql) {
        Matcher matcher = FROM_CLAUSE.matcher(soql);
        if (!matcher.find()) {
            log.error("No FROM clause in query: {}", soql);
            throw new IllegalArgumentException("Query has no FROM clause: " + soql);
        }
        String jobId = createQueryJob(matcher.group(1));
        submitQuery(jobId, soql);
        return jobId;
    }

    /** Adds the statement as the job's only batch and closes the job. Returns the batch id. */
    public String submitQuery(String jobId, String soql) {
        BulkJob job = jobRegistry.getJob(jobId);
        if (!job.getOperation().isQuery()) {
            log.error("Cannot submit a query to {} job {}", job.getOperation().apiValue(), jobId);
            throw new IllegalArgumentException("Job " + jobId + " is not a query job");
        }
        String batchId = client.addBatch(jobId, soql).getId();
        jobRegistry.appendBatch(jobId, batchId);
        log.info("Submitted query batch {} to job {}", batchId, jobId);
        closeJob(jobId);
        return batchId;
    }

    public List<String> submitData(String jobId, Dataset dataset) {
        return submitData(jobId, dataset, true);
    }

    /**
     * Posts the dataset in batches of the configured size, in row order.
     *
     * @return batch ids in submission order
     */
    public List<String> submitData(String jobId, Dataset dataset, boolean closeWhenDone) {
        BulkJob job = jobRegistry.getJob(jobId);
        if (job.getOperation().isQuery()) {
            log.error("Cannot submit data to query job {}", jobId);
            throw new IllegalArgumentException("Job " + jobId + " is a query job, use submitQuery");
        }

        List<Dataset> chunks = chunker.chunk(dataset, properties.getBatchSize());
        if (chunks.isEmpty()) {
            log.warn("No rows to submit to job {}", jobId);
        }
        List<String> batchIds = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Dataset chunk = chunks.get(i);
            String batchId = client.addBatch(jobId, csvCodec.write(chunk)).getId();
            jobRegistry.appendBatch(jobId, batchId);
            batchIds.add(batchId);
            log.debug("Submitted batch {} ({}/{}, {} rows) to job {}", batchId, i + 1, chunks.size(), chunk.size(), jobId);
        }
        log.info("Submitted {} rows in {} batch(es) to job {}", dataset.size(), batchIds.size(), jobId);

        if (closeWhenDone) {
            closeJob(jobId);
        }
        return batchIds;
    }

    public StatusRecord closeJob(String jobId) {
        return changeState(jobId, JobState.CLOSED);
    }

    public StatusRecord abortJob(String jobId) {
        return changeState(jobId, JobState.ABORTED);
    }

    private StatusRecord changeState(String jobId, JobState state) {
        StatusRecord jobInfo = client.updateJobState(jobId, state);
        jobRegistry.findJob(jobId).ifPresent(job -> job.setState(state));
        log.info("Job {} is now {}", jobId, state.apiValue());
        return jobInfo;
    }

    public StatusRecord getStatus(String id, StatusKind kind, boolean forceReload) {
        return statusCache.get(id, kind, forceReload);
    }

    public BatchOutcome checkBatch(String batchId) {
        return statusPoller.checkBatch(batchId);
    }

    public boolean isBatchDone(String batchId) {
        return statusPoller.isBatchDone(batchId);
    }

    public boolean isJobDone(String jobId) {
        return statusPoller.isJobDone(jobId);
    }

    public WaitOutcome waitForBatch(String batchId) {
        return waitForBatch(batchId, properties.getBatchWaitTimeout());
    }

    public WaitOutcome waitForBatch(String batchId, Duration timeout) {
        return statusPoller.waitForBatch(batchId, timeout, properties.getBatchPollInterval());
    }

    public WaitOutcome waitForJob(String jobId) {
        return waitForJob(jobId, properties.getJobWaitTimeout());
    }

    public WaitOutcome waitForJob(String jobId, Duration timeout) {
        return statusPoller.waitForJob(jobId, timeout, properties.getJobPollInterval());
    }

    public Dataset collectQueryResults(String jobId) {
        return resultAssembler.collectQueryResults(jobId);
    }

    public Dataset collectOperationResults(String jobId) {
        return resultAssembler.collectOperationResults(jobId);
    }

    public BulkJob getJob(String jobId) {
        return jobRegistry.getJob(jobId);
    }

    public List<String> batchesOf(String jobId) {
        return jobRegistry.batchesOf(jobId);
    }
}
