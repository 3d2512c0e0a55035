package com.linkql.api.graphql;

import com.linkql.core.Handler;
import com.linkql.core.ResourceName;
import graphql.schema.DataFetcher;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLTypeReference;

import java.util.List;
import java.util.Map;

/**
 * A paginated field ready to be added to a schema. Immutable; one instance serves every query.
 *
 * @param name           field name
 * @param resource       resource the field pages over
 * @param handler        handler of that resource serving the field
 * @param arguments      arguments offered to the caller
 * @param connectionType result type, built lazily
 * @param resolver       resolves the field to its {@link ParentLinkage}
 * @param complexity     cost of the field for a given limit and child cost
 * @param defaultLimit   limit assumed when the caller gives none
 */
public record RelationField(
        String name,
        ResourceName resource,
        Handler handler,
        List<GraphQLArgument> arguments,
        ConnectionType connectionType,
        DataFetcher<ParentLinkage> resolver,
        RelationComplexity complexity,
        int defaultLimit
) {
    public RelationField {
        arguments = List.copyOf(arguments);
    }

    public GraphQLFieldDefinition definition() {
        return GraphQLFieldDefinition.newFieldDefinition()
                .name(name)
                .type(GraphQLTypeReference.typeRef(connectionType.name()))
                .arguments(arguments)
                .build();
    }

    public double cost(Map<String, Object> arguments, double childCost) {
        Object limit = arguments == null ? null : arguments.get(PaginationField.LIMIT);
        return complexity.cost(limit instanceof Number ? ((Number) limit).intValue() : defaultLimit, childCost);
    }

    public boolean hasArgument(String argumentName) {
        return arguments.stream().anyMatch(a -> a.getName().equals(argumentName));
    }
}
