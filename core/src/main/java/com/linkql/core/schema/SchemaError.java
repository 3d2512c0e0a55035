package com.linkql.core.schema;

import com.linkql.core.ResourceName;

/**
 * Reasons a relation field cannot be built. Errors are per field; assembling a schema reports them
 * and carries on with the remaining fields.
 */
public sealed interface SchemaError {

    ResourceName resourceName();

    String message();

    record ResourceNotFound(ResourceName resourceName) implements SchemaError {
        @Override
        public String message() {
            return "Cannot find resource " + resourceName;
        }
    }

    record SchemaMissing(ResourceName resourceName) implements SchemaError {
        @Override
        public String message() {
            return "Cannot find schema for " + resourceName;
        }
    }

    record MissingMultiGetHandler(ResourceName resourceName, String fieldName) implements SchemaError {
        @Override
        public String message() {
            return String.format("Field %s links to %s, which has no multi-get handler", fieldName, resourceName);
        }
    }

    record MissingFinderParameter(ResourceName resourceName, String fieldName) implements SchemaError {
        @Override
        public String message() {
            return String.format("Finder relation %s on %s needs a 'q' argument naming one of its finders",
                    fieldName, resourceName);
        }
    }

    record PaginationNotSupportedForSingleElement(ResourceName resourceName, String fieldName)
            implements SchemaError {
        @Override
        public String message() {
            return "Cannot use a paginated field for a single-element relationship: " + fieldName;
        }
    }
}
