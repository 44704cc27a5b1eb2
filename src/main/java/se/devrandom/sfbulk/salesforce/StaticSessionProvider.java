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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses a session id obtained elsewhere, e.g. from the sf CLI.
 */
public class StaticSessionProvider implements SessionProvider {
    private static final Logger log = LoggerFactory.getLogger(StaticSessionProvider.class);

    private final SalesforceSession session;

    public StaticSessionProvider(String sessionId, String instanceUrl) {
        this.session = new SalesforceSession(sessionId, instanceUrl);
    }

    @Override
    public SalesforceSession login() {
        log.info("Using configured session for {}", session.instanceUrl());
        return session;
    }
}
