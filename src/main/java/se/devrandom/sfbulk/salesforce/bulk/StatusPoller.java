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
import se.devrandom.sfbulk.salesforce.bulk.errors.BatchFailedException;
import se.devrandom.sfbulk.salesforce.bulk.errors.JobHasNoBatchesException;
import se.devrandom.sfbulk.salesforce.objects.BatchOutcome;
import se.devrandom.sfbulk.salesforce.objects.BatchState;
import se.devrandom.sfbulk.salesforce.objects.StatusKind;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;
import se.devrandom.sfbulk.salesforce.objects.WaitOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Done-checks and wait loops for batches and jobs.
 *
 * <p>A batch that has been seen as Completed is answered from the cache; anything else is
 * reloaded on every check. Failed and Not Processed batches end the check with a
 * {@link BatchFailedException}. Wait loops return {@link WaitOutcome#TIMED_OUT} when the
 * timeout elapses, they never throw for it.
 */
public class StatusPoller {
    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final StatusCache statusCache;
    private final JobRegistry jobRegistry;
    private final Sleeper sleeper;

    public StatusPoller(StatusCache statusCache, JobRegistry jobRegistry, Sleeper sleeper) {
        this.statusCache = statusCache;
        this.jobRegistry = jobRegistry;
        this.sleeper = sleeper;
    }

    public BatchOutcome checkBatch(String batchId) {
        String jobId = jobRegistry.lookupJobForBatch(batchId);

        Optional<StatusRecord> cached = statusCache.peek(batchId, StatusKind.BATCH);
        if (cached.isPresent() && cached.get().getBatchState().isCompleted()) {
            log.debug("Batch id {} completed previously.", batchId);
            return new BatchOutcome(jobId, batchId, BatchState.COMPLETED, null);
        }

        StatusRecord status = statusCache.get(batchId, StatusKind.BATCH, true);
        BatchState state = status.getBatchState();
        if (state == BatchState.UNKNOWN) {
            log.debug("Batch id {} reported unrecognised state '{}', treating as pending", batchId, status.getState());
        }
        return new BatchOutcome(jobId, batchId, state, status.getStateMessage());
    }

    public boolean isBatchDone(String batchId) {
        BatchOutcome outcome = checkBatch(batchId);
        if (outcome.isFailed()) {
            log.error("Batch {} of job {} failed ({}): {}",
                    batchId, outcome.jobId(), outcome.state().apiValue(), outcome.stateMessage());
            throw new BatchFailedException(outcome.jobId(), batchId, outcome.stateMessage());
        }
        log.debug("Batch id {} is {}complete.", batchId, outcome.isCompleted() ? "" : "not ");
        return outcome.isCompleted();
    }

    /**
     * True once every batch of the job is Completed. Stops at the first batch that is still
     * pending, later batches are not polled in that call.
     */
    public boolean isJobDone(String jobId) {
        List<String> batches = jobRegistry.batchesOf(jobId);
        if (batches.isEmpty()) {
            log.error("Job id {} has no batches to check", jobId);
            throw new JobHasNoBatchesException(jobId);
        }
        for (int i = 0; i < batches.size(); i++) {
            String batchId = batches.get(i);
            log.debug("Checking status of batch id {}... ({}/{})", batchId, i + 1, batches.size());
            if (!isBatchDone(batchId)) {
                return false;
            }
        }
        return true;
    }

    public WaitOutcome waitForBatch(String batchId, Duration timeout, Duration interval) {
        return waitUntil(() -> isBatchDone(batchId), "batch " + batchId, timeout, interval);
    }

    public WaitOutcome waitForJob(String jobId, Duration timeout, Duration interval) {
        return waitUntil(() -> isJobDone(jobId), "job " + jobId, timeout, interval);
    }

    private WaitOutcome waitUntil(BooleanSupplier done, String target, Duration timeout, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive, was " + interval);
        }
        Duration waited = Duration.ZERO;
        while (true) {
            if (done.getAsBoolean()) {
                return WaitOutcome.COMPLETED;
            }
            if (waited.compareTo(timeout) >= 0) {
                log.info("Gave up waiting for {} after {}", target, waited);
                return WaitOutcome.TIMED_OUT;
            }
            log.debug("Waiting {} for {}...", interval, target);
            sleeper.sleep(interval);
            waited = waited.plus(interval);
        }
    }
}
