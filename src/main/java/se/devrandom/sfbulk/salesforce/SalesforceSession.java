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
package se.devrandom.sfbulk.salesforce;

/**
 * An authenticated Salesforce session: the token sent as X-SFDC-Session and the instance it
 * belongs to.
 */
public record SalesforceSession(String sessionId, String instanceUrl) {

    public SalesforceSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        if (instanceUrl == null || instanceUrl.isBlank()) {
            throw new IllegalArgumentException("Instance URL is required");
        }
    }

    /**
     * Root of the Bulk API for this instance, e.g.
     * {@code https://acme.my.salesforce.com/services/async/61.0}.
     */
    public String asyncEndpoint(String apiVersion) {
        String host = instanceUrl.startsWith("http") ? instanceUrl : "https://" + instanceUrl;
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        // REST style versions are configured as v61.0, the async path wants 61.0
        String version = apiVersion.startsWith("v") ? apiVersion.substring(1) : apiVersion;
        return host + "/services/async/" + version;
    }

    @Override
    public String toString() {
        return "SalesforceSession{instanceUrl='" + instanceUrl + "'}";
    }
}
