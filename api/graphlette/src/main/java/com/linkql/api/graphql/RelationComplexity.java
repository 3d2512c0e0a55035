package com.linkql.api.graphql;

/**
 * Estimated cost of resolving a relation field.
 */
@FunctionalInterface
public interface RelationComplexity {
    double COMPLEXITY_COST = 10.0d;

    /**
     * A relation is an indexed lookup worth ten scalar fields, and a page of {@code limit} elements
     * can fan out into that many downstream fetches.
     */
    RelationComplexity PAGINATED = (limit, childCost) -> Math.max(limit / 10, 1) * COMPLEXITY_COST * childCost;

    double cost(int limit, double childCost);
}
