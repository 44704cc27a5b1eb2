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
import se.devrandom.sfbulk.salesforce.SalesforceSession;
import se.devrandom.sfbulk.salesforce.bulk.errors.BulkApiException;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.JobState;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;
import se.devrandom.sfbulk.util.RetryUtil;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The job and batch resources of the Bulk API (async endpoint, API 1.0).
 * Every response with a status of 400 or above becomes a {@link BulkApiException}.
 */
public class BulkApiClient {
    private static final Logger log = LoggerFactory.getLogger(BulkApiClient.class);

    static final String SESSION_HEADER = "X-SFDC-Session";
    static final String CONTENT_TYPE_HEADER = "Content-Type";
    static final String XML_CONTENT_TYPE = "application/xml; charset=UTF-8";
    static final String CSV_CONTENT_TYPE = "text/csv; charset=UTF-8";

    private final BulkTransport transport;
    private final BulkXmlCodec xmlCodec;
    private final String sessionId;
    private final String endpoint;
    private final int maxRetryAttempts;
    private final Duration retryInitialDelay;

    public BulkApiClient(BulkTransport transport, BulkXmlCodec xmlCodec, SalesforceSession session,
                         String apiVersion, int maxRetryAttempts, Duration retryInitialDelay) {
        this.transport = transport;
        this.xmlCodec = xmlCodec;
        this.sessionId = session.sessionId();
        this.endpoint = session.asyncEndpoint(apiVersion);
        this.maxRetryAttempts = maxRetryAttempts;
        this.retryInitialDelay = retryInitialDelay;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** Creates a job and returns its jobInfo, which carries the new id. */
    public StatusRecord createJob(JobSpec spec) {
        String body = post(endpoint + "/job", XML_CONTENT_TYPE, xmlCodec.jobDocument(spec));
        return xmlCodec.parseInfo(body);
    }

    public StatusRecord updateJobState(String jobId, JobState state) {
        String body = post(endpoint + "/job/" + jobId, XML_CONTENT_TYPE, xmlCodec.stateDocument(state));
        return xmlCodec.parseInfo(body);
    }

    public StatusRecord getJobInfo(String jobId) {
        return xmlCodec.parseInfo(get(endpoint + "/job/" + jobId));
    }

    /**
     * Adds a batch to an open job. The content is CSV for data operations and the SOQL text
     * for query jobs; both are sent as text/csv.
     */
    public StatusRecord addBatch(String jobId, String content) {
        String body = post(endpoint + "/job/" + jobId + "/batch", CSV_CONTENT_TYPE, content);
        return xmlCodec.parseInfo(body);
    }

    public StatusRecord getBatchInfo(String jobId, String batchId) {
        return xmlCodec.parseInfo(get(batchUrl(jobId, batchId)));
    }

    /** Result segment ids of a completed query batch, in the order the API lists them. */
    public List<String> getQueryResultIds(String jobId, String batchId) {
        return xmlCodec.parseResultIds(get(batchUrl(jobId, batchId) + "/result"));
    }

    public String getQueryResult(String jobId, String batchId, String resultId) {
        return get(batchUrl(jobId, batchId) + "/result/" + resultId);
    }

    /** Per-row outcome CSV of a data batch. */
    public String getBatchResult(String jobId, String batchId) {
        return get(batchUrl(jobId, batchId) + "/result");
    }

    private String batchUrl(String jobId, String batchId) {
        return endpoint + "/job/" + jobId + "/batch/" + batchId;
    }

    private String get(String url) {
        Map<String, String> headers = headers(XML_CONTENT_TYPE);
        BulkResponse response = RetryUtil.executeWithRetry(
                () -> transport.get(url, headers), maxRetryAttempts, retryInitialDelay, "GET " + url);
        return checkStatus(url, response);
    }

    // POSTs create state on the server and are never retried
    private String post(String url, String contentType, String body) {
        BulkResponse response = transport.post(url, headers(contentType), body);
        return checkStatus(url, response);
    }

    private Map<String, String> headers(String contentType) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(SESSION_HEADER, sessionId);
        headers.put(CONTENT_TYPE_HEADER, contentType);
        return headers;
    }

    private String checkStatus(String url, BulkResponse response) {
        if (!response.isError()) {
            return response.body();
        }
        BulkApiException exception = xmlCodec.parseError(response.body())
                .map(error -> new BulkApiException(response.statusCode(), response.body(),
                        error.exceptionCode(), error.exceptionMessage()))
                .orElseGet(() -> new BulkApiException(response.statusCode(), response.body()));
        log.error("Bulk API call {} failed: {}", url, exception.getMessage());
        throw exception;
    }
}
