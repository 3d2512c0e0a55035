package com.linkql.core.execution;

import com.linkql.core.ResourceName;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What the fetch pipeline gathered for one query before resolution runs. Implementations are
 * read-only and may be shared by concurrently resolving fields.
 */
public interface ExecutionContext {
    /**
     * Key under which the context is placed in the graphql-java {@code GraphQLContext}.
     */
    String CONTEXT_KEY = "executionContext";

    /**
     * Fetched objects of one resource keyed by identifier, or empty if the resource was never
     * fetched for this query.
     */
    Optional<Map<Object, Map<String, Object>>> objects(ResourceName resource);

    /**
     * Root-level requests in the order they were issued, each with the identifiers it returned.
     */
    List<TopLevelResult> topLevelResponses();
}
