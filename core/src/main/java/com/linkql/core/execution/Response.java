package com.linkql.core.execution;

import com.linkql.core.ResourceName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link ExecutionContext} assembled by a fetch pipeline once its batches complete.
 */
public record Response(
        List<TopLevelResult> topLevelResponses,
        Map<ResourceName, Map<Object, Map<String, Object>>> data
) implements ExecutionContext {

    public static final Response EMPTY = new Response(List.of(), Map.of());

    public Response {
        topLevelResponses = List.copyOf(topLevelResponses);
        Map<ResourceName, Map<Object, Map<String, Object>>> copy = new LinkedHashMap<>();
        data.forEach((resource, objects) -> copy.put(resource, Collections.unmodifiableMap(new LinkedHashMap<>(objects))));
        data = Collections.unmodifiableMap(copy);
    }

    @Override
    public Optional<Map<Object, Map<String, Object>>> objects(ResourceName resource) {
        return Optional.ofNullable(data.get(resource));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<TopLevelResult> topLevelResponses = new ArrayList<>();
        private final Map<ResourceName, Map<Object, Map<String, Object>>> data = new LinkedHashMap<>();

        public Builder topLevel(TopLevelRequest request, TopLevelResponse response) {
            this.topLevelResponses.add(new TopLevelResult(request, response));
            return this;
        }

        public Builder topLevel(ResourceName resource, RequestField selection, List<?> ids) {
            return topLevel(new TopLevelRequest(resource, selection), TopLevelResponse.of(ids));
        }

        public Builder object(ResourceName resource, Object id, Map<String, Object> element) {
            this.data.computeIfAbsent(resource, r -> new LinkedHashMap<>()).put(id, element);
            return this;
        }

        public Builder objects(ResourceName resource, Map<?, ? extends Map<String, Object>> elements) {
            Map<Object, Map<String, Object>> existing = this.data.computeIfAbsent(resource, r -> new LinkedHashMap<>());
            elements.forEach(existing::put);
            return this;
        }

        public Response build() {
            return new Response(topLevelResponses, data);
        }
    }
}
