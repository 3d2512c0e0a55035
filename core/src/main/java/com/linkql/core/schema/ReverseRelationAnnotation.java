package com.linkql.core.schema;

import com.linkql.core.ResourceName;

import java.util.Map;

/**
 * Describes how to recover objects related to a parent by querying the target resource. Every key
 * of {@code arguments} is bound by the relation and is never offered to the caller.
 */
public record ReverseRelationAnnotation(
        ResourceName resourceName,
        Map<String, String> arguments,
        RelationType relationType,
        String description
) {
    public ReverseRelationAnnotation {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        relationType = relationType == null ? RelationType.UNKNOWN : relationType;
    }
}
