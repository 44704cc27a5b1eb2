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
package se.devrandom.sfbulk.salesforce.bulk.errors;

/**
 * The Bulk API answered with an HTTP error status. Never retried.
 */
public class BulkApiException extends BulkJobException {
    private final int statusCode;
    private final String responseBody;
    private final String exceptionCode;
    private final String exceptionMessage;

    public BulkApiException(int statusCode, String responseBody) {
        this(statusCode, responseBody, null, null);
    }

    public BulkApiException(int statusCode, String responseBody, String exceptionCode, String exceptionMessage) {
        super(buildMessage(statusCode, responseBody, exceptionCode, exceptionMessage));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.exceptionCode = exceptionCode;
        this.exceptionMessage = exceptionMessage;
    }

    private static String buildMessage(int statusCode, String body, String code, String message) {
        if (code != null) {
            return String.format("[%d] Bulk API HTTP error %s: %s", statusCode, code, message);
        }
        return String.format("[%d] Bulk API HTTP error result: %s", statusCode, body);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /** exceptionCode from the Bulk API error document, e.g. InvalidSessionId; null if absent. */
    public String getExceptionCode() {
        return exceptionCode;
    }

    public String getExceptionMessage() {
        return exceptionMessage;
    }
}
