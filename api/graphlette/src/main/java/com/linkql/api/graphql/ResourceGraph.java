package com.linkql.api.graphql;

import com.linkql.core.execution.ExecutionContext;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;

import java.util.Map;
import java.util.Objects;

/**
 * Executes queries against a {@link ResourceSchema} in process, given the objects a fetch pipeline
 * already gathered for the query.
 */
public class ResourceGraph {
    private final ResourceSchema schema;
    private final GraphQL graphQL;

    public ResourceGraph(ResourceSchema schema) {
        this.schema = schema;
        this.graphQL = GraphQL.newGraphQL(schema.schema()).build();
    }

    public ResourceSchema schema() {
        return schema;
    }

    public ExecutionResult execute(String query, ExecutionContext context) {
        Objects.requireNonNull(context, "context");
        ExecutionInput input = ExecutionInput.newExecutionInput()
                .query(query)
                .graphQLContext(Map.of(ExecutionContext.CONTEXT_KEY, context))
                .build();
        return graphQL.execute(input);
    }

    public Map<String, Object> executeToSpecification(String query, ExecutionContext context) {
        return execute(query, context).toSpecification();
    }
}
