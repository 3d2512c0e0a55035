package com.linkql.core.schema;

/**
 * A scalar field of an element schema.
 */
public record FieldSpec(String name, String type) {
}
