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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.JobState;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes jobInfo request documents and reads the XML documents returned by the Bulk API.
 * Element names are reduced to their local part when reading.
 */
public class BulkXmlCodec {
    public static final String JOB_NAMESPACE = "http://www.force.com/2009/06/asyncapi/dataload";

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private final XmlMapper xmlMapper = new XmlMapper();
    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    public String jobDocument(JobSpec spec) {
        return jobInfoDocument(spec.toFields());
    }

    public String stateDocument(JobState state) {
        return jobInfoDocument(Map.of("state", state.apiValue()));
    }

    private String jobInfoDocument(Map<String, String> fields) {
        StringWriter out = new StringWriter();
        out.write(XML_DECLARATION);
        try {
            XMLStreamWriter writer = outputFactory.createXMLStreamWriter(out);
            writer.setDefaultNamespace(JOB_NAMESPACE);
            writer.writeStartElement("", "jobInfo", JOB_NAMESPACE);
            writer.writeDefaultNamespace(JOB_NAMESPACE);
            for (Map.Entry<String, String> field : fields.entrySet()) {
                writer.writeStartElement("", field.getKey(), JOB_NAMESPACE);
                writer.writeCharacters(field.getValue());
                writer.writeEndElement();
            }
            writer.writeEndElement();
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write jobInfo document", e);
        }
        return out.toString();
    }

    /** Parses a jobInfo or batchInfo response into a flat field map. */
    public StatusRecord parseInfo(String xml) {
        JsonNode root = readTree(xml);
        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = root.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.put(field.getKey(), textOf(field.getValue()));
        }
        return new StatusRecord(fields);
    }

    /** Result ids of a result-list document, in document order. */
    public List<String> parseResultIds(String xml) {
        JsonNode results = readTree(xml).path("result");
        List<String> ids = new ArrayList<>();
        if (results.isArray()) {
            for (JsonNode result : results) {
                ids.add(result.asText());
            }
        } else if (results.isValueNode() && !results.asText().isEmpty()) {
            ids.add(results.asText());
        }
        return ids;
    }

    /**
     * Reads the exceptionCode and exceptionMessage of a Bulk API error document.
     * Empty when the body is not such a document.
     */
    public Optional<ErrorDetail> parseError(String xml) {
        if (xml == null || !xml.contains("exceptionCode")) {
            return Optional.empty();
        }
        try {
            JsonNode root = xmlMapper.readTree(xml);
            String code = root.path("exceptionCode").asText(null);
            if (code == null) {
                return Optional.empty();
            }
            return Optional.of(new ErrorDetail(code, root.path("exceptionMessage").asText("")));
        } catch (JsonProcessingException e) {
            // not XML, the caller reports the raw body
            return Optional.empty();
        }
    }

    private JsonNode readTree(String xml) {
        try {
            return xmlMapper.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unparseable Bulk API response: " + xml, e);
        }
    }

    public record ErrorDetail(String exceptionCode, String exceptionMessage) {}

    private static String textOf(JsonNode node) {
        // xsi:nil elements
        if (node.isNull()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        // empty elements come back as empty objects
        return node.isEmpty() ? "" : node.toString();
    }
}
