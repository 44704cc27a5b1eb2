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
package se.devrandom.sfbulk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.web.reactive.function.client.WebClient;
import se.devrandom.sfbulk.salesforce.OAuthSessionProvider;
import se.devrandom.sfbulk.salesforce.SalesforceSession;
import se.devrandom.sfbulk.salesforce.SessionProvider;
import se.devrandom.sfbulk.salesforce.StaticSessionProvider;
import se.devrandom.sfbulk.salesforce.bulk.BulkApiClient;
import se.devrandom.sfbulk.salesforce.bulk.BulkJobOrchestrator;
import se.devrandom.sfbulk.salesforce.bulk.BulkXmlCodec;
import se.devrandom.sfbulk.salesforce.bulk.WebClientBulkTransport;

/**
 * Wires the Bulk API client. The session is created lazily so the context starts without
 * logging in until a bulk job is actually run.
 */
@Configuration
public class BulkApiConfiguration {
    private static final Logger log = LoggerFactory.getLogger(BulkApiConfiguration.class);

    @Bean
    public SessionProvider sessionProvider(SalesforceCredentials credentials, WebClient webClient) {
        if (credentials.hasStaticSession()) {
            log.debug("Configured with a static session id");
            return new StaticSessionProvider(credentials.getSessionId(), credentials.getInstanceUrl());
        }
        return new OAuthSessionProvider(webClient, credentials);
    }

    @Bean
    @Lazy
    public SalesforceSession salesforceSession(SessionProvider sessionProvider) {
        return sessionProvider.login();
    }

    @Bean
    @Lazy
    public BulkApiClient bulkApiClient(WebClient webClient, SalesforceSession salesforceSession,
                                       SalesforceCredentials credentials, BulkJobProperties properties) {
        return new BulkApiClient(new WebClientBulkTransport(webClient), new BulkXmlCodec(), salesforceSession,
                credentials.getApiVersion(), properties.getMaxRetryAttempts(), properties.getRetryInitialDelay());
    }

    @Bean
    @Lazy
    public BulkJobOrchestrator bulkJobOrchestrator(BulkApiClient bulkApiClient, BulkJobProperties properties) {
        return new BulkJobOrchestrator(bulkApiClient, properties);
    }
}
