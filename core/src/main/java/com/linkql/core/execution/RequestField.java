package com.linkql.core.execution;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The selection a top-level request was issued for: field name, optional alias and arguments.
 */
public record RequestField(
        String name,
        String alias,
        Map<String, Object> arguments
) {
    public RequestField {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(arguments));
    }

    public static RequestField named(String name) {
        return new RequestField(name, null, Map.of());
    }

    public static RequestField aliased(String name, String alias) {
        return new RequestField(name, alias, Map.of());
    }

    public boolean matches(String selectionName, String selectionAlias) {
        return Objects.equals(name, selectionName) && Objects.equals(alias, selectionAlias);
    }
}
