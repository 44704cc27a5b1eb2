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
 * Batch lifecycle as reported by the Bulk API:
 * Queued/InProgress until the batch reaches Completed, Failed or Not Processed.
 * Values the client does not recognise map to {@link #UNKNOWN} and are treated as pending.
 */
public enum BatchState {
    QUEUED("Queued"),
    IN_PROGRESS("InProgress"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    NOT_PROCESSED("Not Processed"),
    UNKNOWN("");

    private final String apiValue;

    BatchState(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }

    public boolean isCompleted() {
        return this == COMPLETED;
    }

    public boolean isError() {
        return this == FAILED || this == NOT_PROCESSED;
    }

    public boolean isPending() {
        return !isCompleted() && !isError();
    }

    public static BatchState fromApiValue(String value) {
        if (value == null || value.isEmpty()) {
            return UNKNOWN;
        }
        for (BatchState state : values()) {
            if (state.apiValue.equals(value)) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
