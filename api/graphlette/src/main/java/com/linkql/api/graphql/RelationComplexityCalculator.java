package com.linkql.api.graphql;

import graphql.analysis.FieldComplexityCalculator;
import graphql.analysis.FieldComplexityEnvironment;
import graphql.schema.FieldCoordinates;

import java.util.Map;

/**
 * Prices relation fields with their {@link RelationComplexity}; every other field costs one plus
 * its children, as graphql-java does by default.
 */
public class RelationComplexityCalculator implements FieldComplexityCalculator {
    private final Map<FieldCoordinates, RelationField> relations;

    public RelationComplexityCalculator(Map<FieldCoordinates, RelationField> relations) {
        this.relations = Map.copyOf(relations);
    }

    @Override
    public int calculate(FieldComplexityEnvironment environment, int childComplexity) {
        FieldCoordinates coordinates = FieldCoordinates.coordinates(
                environment.getParentType().getName(),
                environment.getField().getName()
        );
        RelationField relation = relations.get(coordinates);
        if (relation == null) {
            return 1 + childComplexity;
        }
        double cost = relation.cost(environment.getArguments(), childComplexity);
        return cost >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) Math.round(cost);
    }
}
