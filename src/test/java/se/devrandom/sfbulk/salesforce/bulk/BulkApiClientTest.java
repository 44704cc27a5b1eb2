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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import se.devrandom.sfbulk.salesforce.SalesforceSession;
import se.devrandom.sfbulk.salesforce.bulk.errors.BulkApiException;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.JobState;
import se.devrandom.sfbulk.salesforce.objects.Operation;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkApiClientTest {

    private static final String ENDPOINT = "https://acme.my.salesforce.com/services/async/61.0";
    private static final String JOB_INFO = "<jobInfo xmlns=\"http://www.force.com/2009/06/asyncapi/dataload\">"
            + "<id>750A1</id><state>Open</state></jobInfo>";
    private static final String SESSION_ERROR = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<error xmlns=\"http://www.force.com/2009/06/asyncapi/dataload\">"
            + "<exceptionCode>InvalidSessionId</exceptionCode>"
            + "<exceptionMessage>Invalid session id</exceptionMessage></error>";

    @Mock
    private BulkTransport transport;

    private BulkApiClient client;

    @BeforeEach
    void setUp() {
        SalesforceSession session = new SalesforceSession("SESSION", "https://acme.my.salesforce.com/");
        client = new BulkApiClient(transport, new BulkXmlCodec(), session, "v61.0", 3, Duration.ofMillis(1));
    }

    private static WebClientRequestException connectionRefused(String url) {
        return new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.GET, URI.create(url), new HttpHeaders());
    }

    @Test
    void endpointIsDerivedFromInstanceAndVersion() {
        assertThat(client.getEndpoint()).isEqualTo(ENDPOINT);
    }

    @Test
    void createJobPostsXmlWithSessionHeader() {
        when(transport.post(eq(ENDPOINT + "/job"), anyMap(), anyString())).thenReturn(new BulkResponse(201, JOB_INFO));

        assertThat(client.createJob(JobSpec.builder(Operation.INSERT, "Account").build()).getId()).isEqualTo("750A1");

        verify(transport).post(eq(ENDPOINT + "/job"),
                eq(Map.of("X-SFDC-Session", "SESSION", "Content-Type", "application/xml; charset=UTF-8")),
                anyString());
    }

    @Test
    void errorStatusBecomesBulkApiExceptionWithParsedCode() {
        when(transport.post(eq(ENDPOINT + "/job/750A1"), anyMap(), anyString()))
                .thenReturn(new BulkResponse(400, SESSION_ERROR));

        assertThatThrownBy(() -> client.updateJobState("750A1", JobState.CLOSED))
                .isInstanceOfSatisfying(BulkApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(400);
                    assertThat(e.getExceptionCode()).isEqualTo("InvalidSessionId");
                    assertThat(e.getExceptionMessage()).isEqualTo("Invalid session id");
                    assertThat(e.getResponseBody()).isEqualTo(SESSION_ERROR);
                    assertThat(e.getMessage()).isEqualTo("[400] Bulk API HTTP error InvalidSessionId: Invalid session id");
                });
    }

    @Test
    void errorStatusWithoutErrorDocumentKeepsRawBody() {
        when(transport.get(eq(ENDPOINT + "/job/750A1"), anyMap())).thenReturn(new BulkResponse(503, "Service Unavailable"));

        assertThatThrownBy(() -> client.getJobInfo("750A1"))
                .isInstanceOf(BulkApiException.class)
                .hasMessage("[503] Bulk API HTTP error result: Service Unavailable");
        verify(transport, times(1)).get(anyString(), anyMap());
    }

    @Test
    void getIsRetriedOnConnectionFailure() {
        String url = ENDPOINT + "/job/750A1/batch/751B1";
        when(transport.get(eq(url), anyMap()))
                .thenThrow(connectionRefused(url))
                .thenThrow(connectionRefused(url))
                .thenReturn(new BulkResponse(200, "<batchInfo><id>751B1</id><state>Completed</state></batchInfo>"));

        assertThat(client.getBatchInfo("750A1", "751B1").getState()).isEqualTo("Completed");
        verify(transport, times(3)).get(eq(url), anyMap());
    }

    @Test
    void getGivesUpAfterMaxAttempts() {
        String url = ENDPOINT + "/job/750A1";
        when(transport.get(eq(url), anyMap())).thenThrow(connectionRefused(url));

        assertThatThrownBy(() -> client.getJobInfo("750A1")).isInstanceOf(WebClientRequestException.class);
        verify(transport, times(3)).get(eq(url), anyMap());
    }

    @Test
    void postIsNeverRetried() {
        when(transport.post(anyString(), anyMap(), anyString()))
                .thenThrow(new IllegalStateException("reset", new IOException("Connection reset")));

        assertThatThrownBy(() -> client.addBatch("750A1", "Name\nAcme\n")).isInstanceOf(IllegalStateException.class);
        verify(transport, times(1)).post(anyString(), anyMap(), anyString());
    }

    @Test
    void addBatchSendsCsvContentType() {
        when(transport.post(eq(ENDPOINT + "/job/750A1/batch"), anyMap(), eq("Name\nAcme\n")))
                .thenReturn(new BulkResponse(201, "<batchInfo><id>751B1</id><state>Queued</state></batchInfo>"));

        client.addBatch("750A1", "Name\nAcme\n");

        verify(transport).post(eq(ENDPOINT + "/job/750A1/batch"),
                eq(Map.of("X-SFDC-Session", "SESSION", "Content-Type", "text/csv; charset=UTF-8")),
                eq("Name\nAcme\n"));
    }

    @Test
    void resultEndpoints() {
        String batchUrl = ENDPOINT + "/job/750A1/batch/751B1";
        when(transport.get(eq(batchUrl + "/result"), anyMap())).thenReturn(new BulkResponse(200,
                "<result-list><result>752R1</result><result>752R2</result></result-list>"));
        when(transport.get(eq(batchUrl + "/result/752R2"), anyMap())).thenReturn(new BulkResponse(200, "Id\n001\n"));

        assertThat(client.getQueryResultIds("750A1", "751B1")).containsExactly("752R1", "752R2");
        assertThat(client.getQueryResult("750A1", "751B1", "752R2")).isEqualTo("Id\n001\n");
    }
}
