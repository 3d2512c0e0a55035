package com.linkql.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema generation settings.
 *
 * @param defaultLimit page size used when a caller leaves {@code limit} unset
 * @param resources    resource identifiers ({@code name.vN}) exposed at the query root; empty
 *                     exposes every resource
 */
public record GraphConfig(
        int defaultLimit,
        List<String> resources
) {
    public static final int DEFAULT_LIMIT = 100;

    public static GraphConfig defaults() {
        return builder().build();
    }

    public boolean exposesAtRoot(String resourceIdentifier) {
        return resources == null || resources.isEmpty() || resources.contains(resourceIdentifier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultLimit = DEFAULT_LIMIT;
        private List<String> resources = new ArrayList<>();

        public Builder defaultLimit(int defaultLimit) {
            if (defaultLimit <= 0) {
                throw new IllegalArgumentException("defaultLimit must be positive, got " + defaultLimit);
            }
            this.defaultLimit = defaultLimit;
            return this;
        }

        public Builder resource(String resourceIdentifier) {
            this.resources.add(resourceIdentifier);
            return this;
        }

        public Builder resources(List<String> resourceIdentifiers) {
            this.resources.addAll(resourceIdentifiers);
            return this;
        }

        public GraphConfig build() {
            return new GraphConfig(defaultLimit, List.copyOf(resources));
        }
    }
}
