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
package se.devrandom.sfbulk.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.devrandom.sfbulk.data.CsvCodec;
import se.devrandom.sfbulk.data.Dataset;
import se.devrandom.sfbulk.salesforce.bulk.BulkJobOrchestrator;
import se.devrandom.sfbulk.salesforce.objects.ContentType;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.Operation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs one bulk job from the command line, e.g.
 * <pre>
 * --sfbulk.run.operation=query --sfbulk.run.query="SELECT Id, Name FROM Account" --sfbulk.run.output=accounts.csv
 * --sfbulk.run.operation=upsert --sfbulk.run.object=Account --sfbulk.run.external-id-field=Ext_Id__c
 *     --sfbulk.run.input=accounts.csv --sfbulk.run.output=results.csv
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "sfbulk.run", name = "operation")
public class BulkJobRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BulkJobRunner.class);

    private final BulkJobOrchestrator orchestrator;
    private final CsvCodec csvCodec = new CsvCodec();
    private final String operation;
    private final String query;
    private final String object;
    private final String input;
    private final String output;
    private final String externalIdField;

    private int exitCode = 0;

    public BulkJobRunner(BulkJobOrchestrator orchestrator,
                         @Value("${sfbulk.run.operation}") String operation,
                         @Value("${sfbulk.run.query:}") String query,
                         @Value("${sfbulk.run.object:}") String object,
                         @Value("${sfbulk.run.input:}") String input,
                         @Value("${sfbulk.run.output:}") String output,
                         @Value("${sfbulk.run.external-id-field:}") String externalIdField) {
        this.orchestrator = orchestrator;
        this.operation = operation;
        this.query = query;
        this.object = object;
        this.input = input;
        this.output = output;
        this.externalIdField = externalIdField;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("=".repeat(80));
        try {
            Operation op = Operation.fromApiValue(operation);
            Dataset results = op.isQuery() ? runQuery(op) : runDataOperation(op);
            writeOutput(results);
            log.info("Bulk {} finished with {} result rows", op.apiValue(), results.size());
        } catch (RuntimeException | IOException e) {
            log.error("Bulk {} failed: {}", operation, e.getMessage(), e);
            exitCode = 1;
        }
        log.info("=".repeat(80));
    }

    private Dataset runQuery(Operation op) {
        require(query, "sfbulk.run.query");
        String jobId;
        if (op == Operation.QUERY) {
            jobId = orchestrator.query(query);
        } else {
            require(object, "sfbulk.run.object");
            jobId = orchestrator.createJob(JobSpec.builder(op, object).contentType(ContentType.CSV).build());
            orchestrator.submitQuery(jobId, query);
        }
        return orchestrator.collectQueryResults(jobId);
    }

    private Dataset runDataOperation(Operation op) throws IOException {
        require(object, "sfbulk.run.object");
        require(input, "sfbulk.run.input");
        Dataset data = csvCodec.read(Files.readString(Paths.get(input), StandardCharsets.UTF_8));
        log.info("Read {} rows from {}", data.size(), input);

        JobSpec.Builder spec = JobSpec.builder(op, object).contentType(ContentType.CSV);
        if (op == Operation.UPSERT) {
            spec.externalIdFieldName(externalIdField);
        }
        String jobId = orchestrator.createJob(spec.build());
        orchestrator.submitData(jobId, data);
        return orchestrator.collectOperationResults(jobId);
    }

    private void writeOutput(Dataset results) throws IOException {
        if (output.isBlank()) {
            log.info("No sfbulk.run.output configured, results not written");
            return;
        }
        Path path = Paths.get(output);
        Files.writeString(path, csvCodec.write(results), StandardCharsets.UTF_8);
        log.info("Wrote {} rows to {}", results.size(), path.toAbsolutePath());
    }

    private static void require(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must be set");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
