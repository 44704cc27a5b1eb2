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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import se.devrandom.sfbulk.data.Dataset;
import se.devrandom.sfbulk.salesforce.bulk.BulkJobOrchestrator;
import se.devrandom.sfbulk.salesforce.bulk.errors.BatchFailedException;
import se.devrandom.sfbulk.salesforce.objects.JobSpec;
import se.devrandom.sfbulk.salesforce.objects.Operation;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkJobRunnerTest {

    @Mock
    private BulkJobOrchestrator orchestrator;

    @TempDir
    Path tempDir;

    @Test
    void queryResultsAreWrittenToOutput() throws Exception {
        Path output = tempDir.resolve("accounts.csv");
        when(orchestrator.query("SELECT Id FROM Account")).thenReturn("750A1");
        when(orchestrator.collectQueryResults("750A1"))
                .thenReturn(Dataset.builder("Id").addRow("001A1").addRow("001A2").build());

        BulkJobRunner runner = new BulkJobRunner(orchestrator, "query", "SELECT Id FROM Account",
                "", "", output.toString(), "");
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(Files.readString(output)).isEqualTo("Id\n001A1\n001A2\n");
    }

    @Test
    void upsertReadsInputAndUsesExternalId() throws Exception {
        Path input = tempDir.resolve("in.csv");
        Files.writeString(input, "Ext__c,Name\nE1,Acme\n");
        when(orchestrator.createJob(any(JobSpec.class))).thenReturn("750A2");
        when(orchestrator.collectOperationResults("750A2")).thenReturn(Dataset.empty());

        BulkJobRunner runner = new BulkJobRunner(orchestrator, "upsert", "", "Account",
                input.toString(), "", "Ext__c");
        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<JobSpec> spec = ArgumentCaptor.forClass(JobSpec.class);
        verify(orchestrator).createJob(spec.capture());
        assertThat(spec.getValue().getOperation()).isEqualTo(Operation.UPSERT);
        assertThat(spec.getValue().getExternalIdFieldName()).isEqualTo("Ext__c");
        verify(orchestrator).submitData(eq("750A2"), eq(Dataset.builder("Ext__c", "Name").addRow("E1", "Acme").build()));
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void failedJobGivesExitCodeOne() {
        when(orchestrator.query("SELECT Id FROM Account")).thenReturn("750A3");
        when(orchestrator.collectQueryResults("750A3")).thenThrow(new BatchFailedException("750A3", "751B1", "boom"));

        BulkJobRunner runner = new BulkJobRunner(orchestrator, "query", "SELECT Id FROM Account", "", "", "", "");
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void missingObjectGivesExitCodeOne() {
        BulkJobRunner runner = new BulkJobRunner(orchestrator, "insert", "", "", "in.csv", "", "");
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
