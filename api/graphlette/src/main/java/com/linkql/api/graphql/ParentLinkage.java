package com.linkql.api.graphql;

import com.linkql.core.ResourceName;
import graphql.language.Field;
import graphql.schema.DataFetchingEnvironment;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Value of a relation field: everything the {@code elements} and {@code paging} fields of its
 * connection need to know about the occurrence they sit under.
 *
 * @param parentValue   the already-resolved parent object; null or empty at the query root
 * @param arguments     arguments bound at this occurrence
 * @param selectionName field name as written in the query
 * @param alias         alias of the occurrence, or null
 * @param resource      resource the connection pages over
 * @param fieldName     name of the relation field in the schema
 */
public record ParentLinkage(
        Map<String, Object> parentValue,
        Map<String, Object> arguments,
        String selectionName,
        String alias,
        ResourceName resource,
        String fieldName
) {
    public ParentLinkage {
        parentValue = parentValue == null ? null : Collections.unmodifiableMap(new HashMap<>(parentValue));
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(arguments));
    }

    @SuppressWarnings("unchecked")
    public static ParentLinkage from(DataFetchingEnvironment env, ResourceName resource, String fieldName) {
        Object source = env.getSource();
        Map<String, Object> parent = source instanceof Map ? (Map<String, Object>) source : null;
        Field field = env.getField();
        return new ParentLinkage(
                parent,
                env.getArguments(),
                field == null ? fieldName : field.getName(),
                field == null ? null : field.getAlias(),
                resource,
                fieldName
        );
    }

    public boolean isTopLevel() {
        return parentValue == null || parentValue.isEmpty();
    }

    /**
     * Key under which the parent holds this occurrence's identifiers.
     */
    public String responseKey() {
        return alias != null ? alias : fieldName;
    }

    public String start() {
        Object start = arguments.get(PaginationField.START);
        return start == null ? null : start.toString();
    }

    public int limit(int defaultLimit) {
        Object limit = arguments.get(PaginationField.LIMIT);
        return limit instanceof Number ? ((Number) limit).intValue() : defaultLimit;
    }
}
