package com.linkql.core;

import java.util.List;

/**
 * One named server operation on a resource.
 */
public record Handler(
        String name,
        HandlerKind kind,
        List<Parameter> parameters
) {
    public Handler {
        kind = kind == null ? HandlerKind.UNKNOWN : kind;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static Handler of(String name, HandlerKind kind, Parameter... parameters) {
        return new Handler(name, kind, List.of(parameters));
    }
}
