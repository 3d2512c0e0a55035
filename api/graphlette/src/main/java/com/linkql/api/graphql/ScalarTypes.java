package com.linkql.api.graphql;

import com.linkql.core.Parameter;
import com.linkql.core.schema.FieldSpec;
import graphql.Scalars;
import graphql.scalars.ExtendedScalars;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLScalarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Maps catalog type names onto GraphQL scalars.
 */
public final class ScalarTypes {
    private static final Logger logger = LoggerFactory.getLogger(ScalarTypes.class);

    private ScalarTypes() {
    }

    public static GraphQLScalarType forName(String type) {
        if (type == null) {
            return Scalars.GraphQLString;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "string" -> Scalars.GraphQLString;
            case "id" -> Scalars.GraphQLID;
            case "int", "integer" -> Scalars.GraphQLInt;
            case "long" -> ExtendedScalars.GraphQLLong;
            case "float", "double" -> Scalars.GraphQLFloat;
            case "boolean" -> Scalars.GraphQLBoolean;
            default -> {
                logger.debug("Unknown type {}, exposing it as String", type);
                yield Scalars.GraphQLString;
            }
        };
    }

    public static GraphQLInputType inputType(Parameter parameter) {
        GraphQLScalarType scalar = forName(parameter.elementType());
        GraphQLInputType type = parameter.isList() ? GraphQLList.list(scalar) : scalar;
        return parameter.required() && parameter.defaultValue() == null ? GraphQLNonNull.nonNull(type) : type;
    }

    public static GraphQLOutputType outputType(FieldSpec field) {
        String type = field.type();
        if (type != null && type.startsWith("[") && type.endsWith("]")) {
            return GraphQLList.list(forName(type.substring(1, type.length() - 1)));
        }
        return forName(type);
    }
}
