package com.linkql.api.graphql;

import com.linkql.core.execution.ExecutionContext;
import com.linkql.core.execution.ResponsePagination;
import graphql.Scalars;
import graphql.scalars.ExtendedScalars;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code start}/{@code limit} arguments every paginated field takes, and the shared
 * {@code ResponsePagination} type its {@code paging} member renders.
 */
public class PaginationField {
    public static final String START = "start";
    public static final String LIMIT = "limit";
    public static final String TYPE_NAME = "ResponsePagination";

    private final int defaultLimit;
    private final ConnectionResolver resolver;
    private final GraphQLObjectType type;

    public PaginationField(int defaultLimit, ConnectionResolver resolver) {
        this.defaultLimit = defaultLimit;
        this.resolver = resolver;
        this.type = GraphQLObjectType.newObject()
                .name(TYPE_NAME)
                .description("Cursor of the next page and the total number of elements, when known")
                .field(GraphQLFieldDefinition.newFieldDefinition().name("next").type(Scalars.GraphQLString))
                .field(GraphQLFieldDefinition.newFieldDefinition().name("total").type(ExtendedScalars.GraphQLLong))
                .build();
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public GraphQLArgument startArgument() {
        return GraphQLArgument.newArgument()
                .name(START)
                .type(Scalars.GraphQLString)
                .build();
    }

    public GraphQLArgument limitArgument() {
        return GraphQLArgument.newArgument()
                .name(LIMIT)
                .type(Scalars.GraphQLInt)
                .defaultValueProgrammatic(defaultLimit)
                .build();
    }

    public GraphQLObjectType type() {
        return type;
    }

    public Map<String, DataFetcher<?>> dataFetchers() {
        Map<String, DataFetcher<?>> fetchers = new LinkedHashMap<>();
        fetchers.put("next", env -> paging(env).next());
        fetchers.put("total", env -> paging(env).total());
        return fetchers;
    }

    private ResponsePagination paging(DataFetchingEnvironment env) {
        ParentLinkage linkage = env.getSource();
        ExecutionContext context = env.getGraphQlContext().get(ExecutionContext.CONTEXT_KEY);
        return resolver.paging(context, linkage, linkage.fieldName(), linkage.limit(defaultLimit), linkage.start());
    }
}
