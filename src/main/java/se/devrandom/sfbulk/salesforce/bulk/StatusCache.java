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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.sfbulk.salesforce.objects.StatusKind;
import se.devrandom.sfbulk.salesforce.objects.StatusRecord;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last observed status per job and per batch. Job and batch records are kept apart;
 * a fresh remote answer always replaces the previous record for that id.
 */
public class StatusCache {
    private static final Logger log = LoggerFactory.getLogger(StatusCache.class);

    private final StatusSource source;
    private final Map<String, StatusRecord> jobStatuses = new HashMap<>();
    private final Map<String, StatusRecord> batchStatuses = new HashMap<>();

    public StatusCache(StatusSource source) {
        this.source = source;
    }

    public StatusRecord get(String id, StatusKind kind, boolean forceReload) {
        if (!forceReload) {
            Optional<StatusRecord> cached = peek(id, kind);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        log.debug("Fetching {} status for {}", kind, id);
        StatusRecord status = source.fetch(kind, id);
        synchronized (this) {
            statuses(kind).put(id, status);
        }
        return status;
    }

    public synchronized Optional<StatusRecord> peek(String id, StatusKind kind) {
        return Optional.ofNullable(statuses(kind).get(id));
    }

    public synchronized void invalidate(String id, StatusKind kind) {
        statuses(kind).remove(id);
    }

    private Map<String, StatusRecord> statuses(StatusKind kind) {
        return kind == StatusKind.JOB ? jobStatuses : batchStatuses;
    }
}
