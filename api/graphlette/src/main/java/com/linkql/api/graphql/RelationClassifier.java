package com.linkql.api.graphql;

import com.linkql.core.Handler;
import com.linkql.core.HandlerKind;
import com.linkql.core.Resource;
import com.linkql.core.schema.FieldRelation;
import com.linkql.core.schema.ReverseRelationAnnotation;
import com.linkql.core.schema.SchemaError;
import com.linkql.core.schema.SchemaResult;

/**
 * Decides which handler of the target resource serves a paginated field.
 */
public final class RelationClassifier {
    public static final String FINDER_ARGUMENT = "q";

    private RelationClassifier() {
    }

    /**
     * @param resource        the resource the field pages over
     * @param fieldName       name of the field being built, for error reporting
     * @param handlerOverride handler to use regardless of relation, or null
     * @param relation        the relation the field implements, or null for a plain multi-get
     */
    public static SchemaResult<Handler> classify(
            Resource resource,
            String fieldName,
            Handler handlerOverride,
            FieldRelation relation
    ) {
        if (handlerOverride != null) {
            return SchemaResult.built(handlerOverride);
        }
        if (relation == null) {
            return multiGet(resource, fieldName);
        }
        return relation.fold(
                forward -> multiGet(resource, fieldName),
                reverse -> reverse(resource, fieldName, reverse.annotation())
        );
    }

    private static SchemaResult<Handler> reverse(Resource resource, String fieldName, ReverseRelationAnnotation annotation) {
        return switch (annotation.relationType()) {
            case FINDER -> finder(resource, fieldName, annotation);
            case MULTI_GET -> multiGet(resource, fieldName);
            case GET, SINGLE_ELEMENT_FINDER, UNKNOWN -> SchemaResult.failed(
                    new SchemaError.PaginationNotSupportedForSingleElement(resource.name(), fieldName));
        };
    }

    private static SchemaResult<Handler> finder(Resource resource, String fieldName, ReverseRelationAnnotation annotation) {
        String finderName = annotation.arguments().get(FINDER_ARGUMENT);
        if (finderName == null) {
            return SchemaResult.failed(new SchemaError.MissingFinderParameter(resource.name(), fieldName));
        }
        return SchemaResult.fromOptional(
                resource.handlerNamed(finderName, HandlerKind.FINDER),
                new SchemaError.MissingFinderParameter(resource.name(), fieldName));
    }

    private static SchemaResult<Handler> multiGet(Resource resource, String fieldName) {
        return SchemaResult.fromOptional(
                resource.handlerOfKind(HandlerKind.MULTI_GET),
                new SchemaError.MissingMultiGetHandler(resource.name(), fieldName));
    }
}
