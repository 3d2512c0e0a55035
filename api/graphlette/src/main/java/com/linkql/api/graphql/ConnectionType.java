package com.linkql.api.graphql;

import com.linkql.core.ResourceName;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;

import java.util.List;
import java.util.function.Supplier;

/**
 * The {@code <Resource>Connection} type of a paginated field. Its field list is computed on first
 * request, so resources that link to each other never build one another eagerly.
 */
public class ConnectionType {
    private final String name;
    private final ResourceName resource;
    private final Supplier<List<GraphQLFieldDefinition>> fieldsFn;
    private volatile List<GraphQLFieldDefinition> fields;

    public ConnectionType(String name, ResourceName resource, Supplier<List<GraphQLFieldDefinition>> fieldsFn) {
        this.name = name;
        this.resource = resource;
        this.fieldsFn = fieldsFn;
    }

    public String name() {
        return name;
    }

    public ResourceName resource() {
        return resource;
    }

    public boolean isResolved() {
        return fields != null;
    }

    public List<GraphQLFieldDefinition> fields() {
        List<GraphQLFieldDefinition> resolved = fields;
        if (resolved == null) {
            synchronized (this) {
                resolved = fields;
                if (resolved == null) {
                    resolved = List.copyOf(fieldsFn.get());
                    fields = resolved;
                }
            }
        }
        return resolved;
    }

    public GraphQLObjectType objectType() {
        return GraphQLObjectType.newObject()
                .name(name)
                .fields(fields())
                .build();
    }
}
