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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory stand-in for the Bulk API async endpoint. Jobs and batches get sequential ids;
 * batch states can be scripted per batch, otherwise a batch reports Completed.
 */
class FakeBulkApi implements BulkTransport {
    static final String INSTANCE = "acme.my.salesforce.com";
    static final String ENDPOINT = "https://" + INSTANCE + "/services/async/61.0";

    private static final String NS = "http://www.force.com/2009/06/asyncapi/dataload";

    private final Map<String, Map<String, String>> jobs = new LinkedHashMap<>();
    private final Map<String, String> batchJob = new HashMap<>();
    private final Map<String, String> batchBodies = new HashMap<>();
    private final Map<String, Deque<String>> scriptedStates = new HashMap<>();
    private final Map<String, String> stateMessages = new HashMap<>();
    private final Map<String, List<String>> resultIds = new HashMap<>();
    private final Map<String, String> segments = new HashMap<>();
    private final List<String> requests = new ArrayList<>();
    private final List<Map<String, String>> requestHeaders = new ArrayList<>();
    private final List<String> requestBodies = new ArrayList<>();

    private int jobSequence = 0;
    private int batchSequence = 0;
    private String defaultBatchState = "Completed";

    /** States reported by successive polls of the batch; the last one sticks. */
    FakeBulkApi scriptBatch(String batchId, String... states) {
        scriptedStates.put(batchId, new ArrayDeque<>(List.of(states)));
        return this;
    }

    FakeBulkApi failBatch(String batchId, String state, String message) {
        scriptBatch(batchId, state);
        stateMessages.put(batchId, message);
        return this;
    }

    FakeBulkApi defaultBatchState(String state) {
        this.defaultBatchState = state;
        return this;
    }

    FakeBulkApi querySegment(String batchId, String resultId, String csv) {
        resultIds.computeIfAbsent(batchId, id -> new ArrayList<>()).add(resultId);
        segments.put(resultId, csv);
        return this;
    }

    List<String> requests() {
        return requests;
    }

    List<Map<String, String>> requestHeaders() {
        return requestHeaders;
    }

    List<String> requestBodies() {
        return requestBodies;
    }

    long count(String request) {
        return requests.stream().filter(request::equals).count();
    }

    String jobField(String jobId, String field) {
        return jobs.get(jobId).get(field);
    }

    String batchBody(String batchId) {
        return batchBodies.get(batchId);
    }

    static String jobId(int n) {
        return String.format("750A0000000%04d", n);
    }

    static String batchId(int n) {
        return String.format("751A0000000%04d", n);
    }

    @Override
    public BulkResponse get(String url, Map<String, String> headers) {
        String[] path = path("GET", url, headers, null);
        if (path.length == 2) {
            return ok(jobInfo(path[1]));
        }
        String jobId = path[1];
        String batchId = path[3];
        if (path.length == 4) {
            return ok(batchInfo(jobId, batchId, nextState(batchId)));
        }
        if (path.length == 5) {
            if (isQueryJob(jobId)) {
                StringBuilder xml = new StringBuilder("<result-list xmlns=\"" + NS + "\">");
                for (String id : resultIds.getOrDefault(batchId, List.of())) {
                    xml.append("<result>").append(id).append("</result>");
                }
                return ok(xml.append("</result-list>").toString());
            }
            return ok(operationResult(batchId));
        }
        return ok(segments.get(path[5]));
    }

    @Override
    public BulkResponse post(String url, Map<String, String> headers, String body) {
        String[] path = path("POST", url, headers, body);
        if (path.length == 1) {
            String jobId = jobId(++jobSequence);
            Map<String, String> job = new LinkedHashMap<>();
            job.put("id", jobId);
            job.put("operation", element(body, "operation"));
            job.put("object", element(body, "object"));
            job.put("state", "Open");
            jobs.put(jobId, job);
            return ok(jobInfo(jobId));
        }
        String jobId = path[1];
        if (path.length == 2) {
            jobs.get(jobId).put("state", element(body, "state"));
            return ok(jobInfo(jobId));
        }
        String batchId = batchId(++batchSequence);
        batchJob.put(batchId, jobId);
        batchBodies.put(batchId, body);
        return ok(batchInfo(jobId, batchId, "Queued"));
    }

    private String[] path(String method, String url, Map<String, String> headers, String body) {
        if (!url.startsWith(ENDPOINT + "/")) {
            throw new IllegalArgumentException("Unexpected URL " + url);
        }
        String relative = url.substring(ENDPOINT.length());
        requests.add(method + " " + relative);
        requestHeaders.add(Map.copyOf(headers));
        requestBodies.add(body);
        return relative.substring(1).split("/");
    }

    private String nextState(String batchId) {
        Deque<String> states = scriptedStates.get(batchId);
        if (states == null) {
            return defaultBatchState;
        }
        return states.size() > 1 ? states.poll() : states.peek();
    }

    private boolean isQueryJob(String jobId) {
        return jobs.get(jobId).get("operation").startsWith("query");
    }

    // one result row per submitted row, ids derived from the batch number
    private String operationResult(String batchId) {
        String[] lines = batchBodies.get(batchId).split("\n");
        StringBuilder csv = new StringBuilder("\"Id\",\"Success\",\"Created\",\"Error\"\n");
        for (int i = 1; i < lines.length; i++) {
            csv.append(String.format("\"001%s%03d\",\"true\",\"true\",\"\"\n", batchId.substring(11), i));
        }
        return csv.toString();
    }

    private String jobInfo(String jobId) {
        Map<String, String> job = jobs.get(jobId);
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><jobInfo xmlns=\"" + NS + "\">"
                + "<id>" + jobId + "</id>"
                + "<operation>" + job.get("operation") + "</operation>"
                + "<object>" + job.get("object") + "</object>"
                + "<state>" + job.get("state") + "</state>"
                + "<numberBatchesTotal>" + batchJob.values().stream().filter(jobId::equals).count() + "</numberBatchesTotal>"
                + "<numberRecordsProcessed>0</numberRecordsProcessed>"
                + "<numberRecordsFailed>0</numberRecordsFailed>"
                + "<totalProcessingTime>0</totalProcessingTime>"
                + "</jobInfo>";
    }

    private String batchInfo(String jobId, String batchId, String state) {
        String message = stateMessages.get(batchId);
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><batchInfo xmlns=\"" + NS + "\">"
                + "<id>" + batchId + "</id>"
                + "<jobId>" + jobId + "</jobId>"
                + "<state>" + state + "</state>"
                + (message == null ? "" : "<stateMessage>" + message + "</stateMessage>")
                + "<numberRecordsProcessed>0</numberRecordsProcessed>"
                + "<numberRecordsFailed>0</numberRecordsFailed>"
                + "</batchInfo>";
    }

    private static String element(String xml, String name) {
        Matcher matcher = Pattern.compile("<" + name + ">(.*?)</" + name + ">").matcher(xml);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static BulkResponse ok(String body) {
        return new BulkResponse(200, body);
    }
}
