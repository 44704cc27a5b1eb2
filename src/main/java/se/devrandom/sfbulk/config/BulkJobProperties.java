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
package se.devrandom.sfbulk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Batch sizing, polling and retry settings for bulk jobs.
 */
@Configuration
@ConfigurationProperties(prefix = "sfbulk.bulk")
public class BulkJobProperties {
    // Rows per batch, the Bulk API accepts at most 10,000
    private int batchSize = 5000;

    private Duration batchWaitTimeout = Duration.ofMinutes(10);
    private Duration batchPollInterval = Duration.ofSeconds(10);
    private Duration jobWaitTimeout = Duration.ofHours(1);
    private Duration jobPollInterval = Duration.ofSeconds(30);

    // Only applies to GETs that fail before a response arrives
    private int maxRetryAttempts = 3;
    private Duration retryInitialDelay = Duration.ofSeconds(1);

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getBatchWaitTimeout() {
        return batchWaitTimeout;
    }

    public void setBatchWaitTimeout(Duration batchWaitTimeout) {
        this.batchWaitTimeout = batchWaitTimeout;
    }

    public Duration getBatchPollInterval() {
        return batchPollInterval;
    }

    public void setBatchPollInterval(Duration batchPollInterval) {
        this.batchPollInterval = batchPollInterval;
    }

    public Duration getJobWaitTimeout() {
        return jobWaitTimeout;
    }

    public void setJobWaitTimeout(Duration jobWaitTimeout) {
        this.jobWaitTimeout = jobWaitTimeout;
    }

    public Duration getJobPollInterval() {
        return jobPollInterval;
    }

    public void setJobPollInterval(Duration jobPollInterval) {
        this.jobPollInterval = jobPollInterval;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public void setMaxRetryAttempts(int maxRetryAttempts) {
        this.maxRetryAttempts = maxRetryAttempts;
    }

    public Duration getRetryInitialDelay() {
        return retryInitialDelay;
    }

    public void setRetryInitialDelay(Duration retryInitialDelay) {
        this.retryInitialDelay = retryInitialDelay;
    }
}
