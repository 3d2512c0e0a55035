package com.linkql.core.schema;

import com.linkql.core.ResourceName;

import java.util.function.Function;

/**
 * The parent object stores the target identifiers directly.
 */
public record ForwardRelation(ResourceName resourceName) implements FieldRelation {

    @Override
    public ResourceName target() {
        return resourceName;
    }

    @Override
    public <T> T fold(Function<ForwardRelation, T> forward, Function<ReverseRelation, T> reverse) {
        return forward.apply(this);
    }
}
