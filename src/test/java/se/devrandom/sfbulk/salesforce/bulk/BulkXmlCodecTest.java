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

import org.junit.jupiter.api.Test;
import se.devrandom.sfbulk.salesforce.objects.ConcurrencyMode;
import se.devrandom.sfbulk.salesforce.objects.ContentType;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.JobState;
import se.devrandom.sfbulk.salesforce.objects.Operation;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkXmlCodecTest {

    private static final String PREFIX = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<jobInfo xmlns=\"http://www.force.com/2009/06/asyncapi/dataload\">";

    private final BulkXmlCodec codec = new BulkXmlCodec();

    @Test
    void jobDocumentWritesFieldsInFixedOrder() {
        JobSpec spec = JobSpec.builder(Operation.UPSERT, "Contact")
                .field("assignmentRuleId", "01QA0000000abcd")
                .contentType(ContentType.CSV)
                .concurrencyMode(ConcurrencyMode.SERIAL)
                .externalIdFieldName("Email__c")
                .build();

        assertThat(codec.jobDocument(spec)).isEqualTo(PREFIX
                + "<operation>upsert</operation>"
                + "<object>Contact</object>"
                + "<externalIdFieldName>Email__c</externalIdFieldName>"
                + "<concurrencyMode>Serial</concurrencyMode>"
                + "<contentType>CSV</contentType>"
                + "<assignmentRuleId>01QA0000000abcd</assignmentRuleId>"
                + "</jobInfo>");
    }

    @Test
    void jobDocumentOmitsUnsetOptionalFields() {
        JobSpec spec = JobSpec.builder(Operation.QUERY_ALL, "Task").build();

        assertThat(codec.jobDocument(spec))
                .isEqualTo(PREFIX + "<operation>queryAll</operation><object>Task</object></jobInfo>");
    }

    @Test
    void jobDocumentEscapesMarkup() {
        JobSpec spec = JobSpec.builder(Operation.INSERT, "Account").field("note", "a<b & c").build();

        assertThat(codec.jobDocument(spec)).contains("<note>a&lt;b &amp; c</note>");
    }

    @Test
    void stateDocumentCarriesOnlyTheState() {
        assertThat(codec.stateDocument(JobState.CLOSED)).isEqualTo(PREFIX + "<state>Closed</state></jobInfo>");
        assertThat(codec.stateDocument(JobState.ABORTED)).isEqualTo(PREFIX + "<state>Aborted</state></jobInfo>");
    }

    @Test
    void parseInfoReducesElementsToLocalNames() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <batchInfo xmlns="http://www.force.com/2009/06/asyncapi/dataload">
                    <id>751A00000001</id>
                    <jobId>750A00000001</jobId>
                    <state>Failed</state>
                    <stateMessage>InvalidBatch : Records not processed</stateMessage>
                    <numberRecordsProcessed>0</numberRecordsProcessed>
                </batchInfo>
                """;

        StatusRecord info = codec.parseInfo(xml);

        assertThat(info.getId()).isEqualTo("751A00000001");
        assertThat(info.get("jobId")).isEqualTo("750A00000001");
        assertThat(info.getState()).isEqualTo("Failed");
        assertThat(info.getStateMessage()).isEqualTo("InvalidBatch : Records not processed");
        assertThat(info.getFields().keySet())
                .containsExactly("id", "jobId", "state", "stateMessage", "numberRecordsProcessed");
    }

    @Test
    void parseInfoReadsNilElementsAsEmpty() {
        String xml = "<batchInfo xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                + "<id>751A00000001</id><stateMessage xsi:nil=\"true\"/><state>Queued</state></batchInfo>";

        StatusRecord info = codec.parseInfo(xml);

        assertThat(info.get("stateMessage")).isEmpty();
        assertThat(info.getStateMessage()).isNull();
        assertThat(info.getState()).isEqualTo("Queued");
    }

    @Test
    void parseResultIdsKeepsDocumentOrder() {
        String many = "<result-list xmlns=\"http://www.force.com/2009/06/asyncapi/dataload\">"
                + "<result>752R2</result><result>752R1</result><result>752R3</result></result-list>";
        String one = "<result-list xmlns=\"http://www.force.com/2009/06/asyncapi/dataload\">"
                + "<result>752R1</result></result-list>";

        assertThat(codec.parseResultIds(many)).containsExactly("752R2", "752R1", "752R3");
        assertThat(codec.parseResultIds(one)).containsExactly("752R1");
    }

    @Test
    void parseErrorReadsExceptionCodeAndMessage() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <error xmlns="http://www.force.com/2009/06/asyncapi/dataload">
                    <exceptionCode>InvalidSessionId</exceptionCode>
                    <exceptionMessage>Invalid session id</exceptionMessage>
                </error>
                """;

        assertThat(codec.parseError(xml))
                .hasValue(new BulkXmlCodec.ErrorDetail("InvalidSessionId", "Invalid session id"));
        assertThat(codec.parseError("Service Unavailable")).isEmpty();
        assertThat(codec.parseError(null)).isEmpty();
    }

    @Test
    void unparseableResponseIsRejected() {
        assertThatThrownBy(() -> codec.parseInfo("<jobInfo><id>")).isInstanceOf(IllegalArgumentException.class);
    }
}
