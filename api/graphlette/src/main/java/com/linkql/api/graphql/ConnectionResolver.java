package com.linkql.api.graphql;

import com.linkql.core.ResourceName;
import com.linkql.core.execution.ExecutionContext;
import com.linkql.core.execution.ResponsePagination;
import com.linkql.core.execution.TopLevelResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns fetched objects into the ordered page a relation field returns.
 * <p>
 * At the query root the identifiers come from the top-level request recorded for this occurrence,
 * in the order the server returned them. Under a parent they come from the parent's own field
 * value and are windowed by {@code start} and {@code limit}. Identifiers without a fetched object
 * are dropped. Holds no state; safe to share between concurrently executing fields.
 */
public class ConnectionResolver {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionResolver.class);

    public List<Map<String, Object>> resolve(
            ExecutionContext context,
            ParentLinkage linkage,
            ResourceName resource,
            String fieldName,
            int limit,
            String start
    ) {
        if (context == null) {
            logger.warn("No execution context for {} on {}, returning no elements", fieldName, resource);
            return List.of();
        }
        Optional<Map<Object, Map<String, Object>>> objects = context.objects(resource);
        if (objects.isEmpty()) {
            return List.of();
        }

        List<Object> ids = linkage.isTopLevel()
                ? topLevelIds(context, linkage, resource)
                : window(referencedIds(linkage, fieldName), start, limit);

        Map<Object, Map<String, Object>> fetched = objects.get();
        List<Map<String, Object>> elements = new ArrayList<>(ids.size());
        for (Object id : ids) {
            Map<String, Object> element = fetched.get(id);
            if (element != null) {
                elements.add(element);
            }
        }
        logger.trace("{} resolved {} of {} ids on {}", fieldName, elements.size(), ids.size(), resource);
        return elements;
    }

    /**
     * Single element of a top-level GET: the first identifier the request returned.
     */
    public Map<String, Object> resolveOne(ExecutionContext context, ParentLinkage linkage, ResourceName resource) {
        if (context == null) {
            return null;
        }
        return context.objects(resource)
                .flatMap(objects -> topLevelIds(context, linkage, resource).stream()
                        .map(objects::get)
                        .filter(Objects::nonNull)
                        .findFirst())
                .orElse(null);
    }

    /**
     * Pagination metadata matching what {@link #resolve} returned for the same arguments.
     */
    public ResponsePagination paging(
            ExecutionContext context,
            ParentLinkage linkage,
            String fieldName,
            int limit,
            String start
    ) {
        if (linkage.isTopLevel()) {
            if (context == null) {
                return ResponsePagination.EMPTY;
            }
            return topLevelMatch(context, linkage, linkage.resource())
                    .map(match -> match.response().pagination())
                    .orElse(ResponsePagination.EMPTY);
        }
        List<Object> ids = referencedIds(linkage, fieldName);
        int next = Math.max(cursorIndex(ids, start), 0) + Math.max(limit, 0);
        return new ResponsePagination(
                next < ids.size() ? String.valueOf(ids.get(next)) : null,
                (long) ids.size()
        );
    }

    Optional<TopLevelResult> topLevelMatch(ExecutionContext context, ParentLinkage linkage, ResourceName resource) {
        return context.topLevelResponses().stream()
                .filter(result -> resource.equals(result.request().resource()))
                .filter(result -> result.request().selection() != null
                        && result.request().selection().matches(linkage.selectionName(), linkage.alias()))
                .findFirst();
    }

    List<Object> topLevelIds(ExecutionContext context, ParentLinkage linkage, ResourceName resource) {
        return topLevelMatch(context, linkage, resource)
                .map(match -> match.response().ids())
                .orElse(List.of());
    }

    @SuppressWarnings("unchecked")
    static List<Object> referencedIds(ParentLinkage linkage, String fieldName) {
        if (linkage.parentValue() == null) {
            return List.of();
        }
        String key = linkage.alias() != null ? linkage.alias() : fieldName;
        Object ids = linkage.parentValue().get(key);
        return ids instanceof List ? (List<Object>) ids : List.of();
    }

    static List<Object> window(List<Object> ids, String start, int limit) {
        int from = cursorIndex(ids, start);
        if (from < 0) {
            // TODO: confirm with product whether an unknown cursor should give an empty page instead of restarting at the head
            logger.warn("Cursor {} not found among {} ids, paging from the first id", start, ids.size());
            from = 0;
        }
        int to = Math.min(ids.size(), from + Math.max(limit, 0));
        return from >= to ? List.of() : ids.subList(from, to);
    }

    /**
     * Position of the first identifier whose string form equals {@code start}; 0 without a
     * cursor, -1 when no identifier matches.
     */
    static int cursorIndex(List<Object> ids, String start) {
        if (start == null) {
            return 0;
        }
        for (int i = 0; i < ids.size(); i++) {
            if (start.equals(String.valueOf(ids.get(i)))) {
                return i;
            }
        }
        return -1;
    }
}
