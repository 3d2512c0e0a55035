package com.linkql.core.schema;

import com.linkql.core.ResourceName;

import java.util.function.Function;

/**
 * How a field links its parent to a paginated collection of another resource.
 */
public sealed interface FieldRelation permits ForwardRelation, ReverseRelation {

    ResourceName target();

    /**
     * Applies the function matching this relation's case. New cases must extend this signature, so
     * every caller is revisited by the compiler.
     */
    <T> T fold(Function<ForwardRelation, T> forward, Function<ReverseRelation, T> reverse);
}
