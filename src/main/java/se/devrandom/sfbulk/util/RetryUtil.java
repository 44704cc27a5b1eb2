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
package se.devrandom.sfbulk.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries an operation with exponential backoff when it fails before any HTTP response was
 * received (connection refused or reset, timeouts). Anything else, HTTP error statuses
 * included, is rethrown on the first attempt.
 */
public class RetryUtil {
    private static final Logger log = LoggerFactory.getLogger(RetryUtil.class);

    private RetryUtil() {
    }

    /**
     * @param operation     the call to make
     * @param maxAttempts   total attempts including the first one
     * @param initialDelay  delay before the second attempt, doubled after each failure
     * @param operationName used in log messages
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            int maxAttempts,
            Duration initialDelay,
            String operationName) {

        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts", operationName, attempt, e);
                    throw e;
                }

                // 1s, 2s, 4s, ...
                long delayMs = initialDelay.toMillis() * (1L << (attempt - 1));
                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                        operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Retry of " + operationName + " interrupted", ie);
                }
            }
        }
    }

    /**
     * Retryable: WebClient request failures (no response received) and I/O errors, directly or
     * as the cause of a runtime exception.
     */
    static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientRequestException || e instanceof UncheckedIOException) {
            return true;
        }
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
            return true;
        }
        log.debug("Non-retryable exception type: {}", e.getClass().getName());
        return false;
    }
}
