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
package se.devrandom.sfbulk.salesforce.objects;

/**
 * Client-side record of a job created through this orchestrator.
 * The batch list lives in the registry; this only holds what was requested and the
 * last state change sent by this client.
 */
public class BulkJob {
    private final String id;
    private final JobSpec spec;
    private volatile JobState state = JobState.OPEN;

    public BulkJob(String id, JobSpec spec) {
        this.id = id;
        this.spec = spec;
    }

    public String getId() {
        return id;
    }

    public JobSpec getSpec() {
        return spec;
    }

    public Operation getOperation() {
        return spec.getOperation();
    }

    public String getObject() {
        return spec.getObject();
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "BulkJob{id='" + id + "', operation=" + spec.getOperation().apiValue()
                + ", object='" + spec.getObject() + "', state=" + state + '}';
    }
}
