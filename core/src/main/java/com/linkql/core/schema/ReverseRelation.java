package com.linkql.core.schema;

import com.linkql.core.ResourceName;

import java.util.function.Function;

/**
 * The target objects refer to the parent; they are found by querying the target resource as the
 * annotation describes.
 */
public record ReverseRelation(ReverseRelationAnnotation annotation) implements FieldRelation {

    @Override
    public ResourceName target() {
        return annotation.resourceName();
    }

    @Override
    public <T> T fold(Function<ForwardRelation, T> forward, Function<ReverseRelation, T> reverse) {
        return reverse.apply(this);
    }
}
