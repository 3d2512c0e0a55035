package com.linkql.api.graphql;

import com.linkql.core.Handler;
import com.linkql.core.Parameter;
import graphql.schema.GraphQLArgument;

import java.util.ArrayList;
import java.util.List;

/**
 * Field arguments for a handler's declared parameters.
 */
public class HandlerArguments {
    private final PaginationField pagination;

    public HandlerArguments(PaginationField pagination) {
        this.pagination = pagination;
    }

    public List<GraphQLArgument> generate(Handler handler, boolean includePagination) {
        List<GraphQLArgument> arguments = new ArrayList<>();
        for (Parameter parameter : handler.parameters()) {
            GraphQLArgument.Builder argument = GraphQLArgument.newArgument()
                    .name(parameter.name())
                    .type(ScalarTypes.inputType(parameter));
            if (parameter.defaultValue() != null) {
                argument.defaultValueProgrammatic(parameter.defaultValue());
            }
            arguments.add(argument.build());
        }
        if (includePagination) {
            addIfAbsent(arguments, pagination.startArgument());
            addIfAbsent(arguments, pagination.limitArgument());
        }
        return arguments;
    }

    private static void addIfAbsent(List<GraphQLArgument> arguments, GraphQLArgument argument) {
        if (arguments.stream().noneMatch(a -> a.getName().equals(argument.getName()))) {
            arguments.add(argument);
        }
    }
}
