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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for a new bulk job. Serialized as a jobInfo document with the fields in the
 * fixed order operation, object, externalIdFieldName, concurrencyMode, contentType,
 * followed by any additional fields in the order they were added.
 */
public final class JobSpec {
    public static final List<String> FIELD_ORDER = List.of(
            "operation", "object", "externalIdFieldName", "concurrencyMode", "contentType");

    private final Operation operation;
    private final String object;
    private final String externalIdFieldName;
    private final ConcurrencyMode concurrencyMode;
    private final ContentType contentType;
    private final Map<String, String> additionalFields;

    private JobSpec(Builder builder) {
        this.operation = builder.operation;
        this.object = builder.object;
        this.externalIdFieldName = builder.externalIdFieldName;
        this.concurrencyMode = builder.concurrencyMode;
        this.contentType = builder.contentType;
        this.additionalFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.additionalFields));
    }

    public static Builder builder(Operation operation, String object) {
        return new Builder(operation, object);
    }

    public Operation getOperation() {
        return operation;
    }

    public String getObject() {
        return object;
    }

    public String getExternalIdFieldName() {
        return externalIdFieldName;
    }

    public ConcurrencyMode getConcurrencyMode() {
        return concurrencyMode;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Map<String, String> getAdditionalFields() {
        return additionalFields;
    }

    /** All populated fields in document order. */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("operation", operation.apiValue());
        fields.put("object", object);
        if (externalIdFieldName != null) {
            fields.put("externalIdFieldName", externalIdFieldName);
        }
        if (concurrencyMode != null) {
            fields.put("concurrencyMode", concurrencyMode.apiValue());
        }
        if (contentType != null) {
            fields.put("contentType", contentType.apiValue());
        }
        fields.putAll(additionalFields);
        return fields;
    }

    @Override
    public String toString() {
        return "JobSpec" + toFields();
    }

    public static final class Builder {
        private final Operation operation;
        private final String object;
        private String externalIdFieldName;
        private ConcurrencyMode concurrencyMode;
        private ContentType contentType;
        private final Map<String, String> additionalFields = new LinkedHashMap<>();

        private Builder(Operation operation, String object) {
            this.operation = operation;
            this.object = object;
        }

        public Builder externalIdFieldName(String externalIdFieldName) {
            this.externalIdFieldName = externalIdFieldName;
            return this;
        }

        public Builder concurrencyMode(ConcurrencyMode concurrencyMode) {
            this.concurrencyMode = concurrencyMode;
            return this;
        }

        public Builder contentType(ContentType contentType) {
            this.contentType = contentType;
            return this;
        }

        /** Extra jobInfo element, e.g. assignmentRuleId. Written after the fixed fields. */
        public Builder field(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank");
            }
            if (FIELD_ORDER.contains(name) || "state".equals(name)) {
                throw new IllegalArgumentException("Field '" + name + "' cannot be set as an additional field");
            }
            if (value == null) {
                throw new IllegalArgumentException("Field '" + name + "' has no value");
            }
            additionalFields.put(name, value);
            return this;
        }

        public JobSpec build() {
            if (operation == null) {
                throw new IllegalArgumentException("Job operation is required");
            }
            if (object == null || object.isBlank()) {
                throw new IllegalArgumentException("Job object is required");
            }
            boolean hasExternalId = externalIdFieldName != null && !externalIdFieldName.isBlank();
            if (operation == Operation.UPSERT && !hasExternalId) {
                throw new IllegalArgumentException("externalIdFieldName is required for upsert jobs on " + object);
            }
            if (operation != Operation.UPSERT && externalIdFieldName != null) {
                throw new IllegalArgumentException(
                        "externalIdFieldName is only valid for upsert jobs, not " + operation.apiValue());
            }
            return new JobSpec(this);
        }
    }
}
