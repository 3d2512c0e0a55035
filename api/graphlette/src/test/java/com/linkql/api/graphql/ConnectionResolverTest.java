package com.linkql.api.graphql;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.linkql.core.ResourceName;
import com.linkql.core.execution.ExecutionContext;
import com.linkql.core.execution.RequestField;
import com.linkql.core.execution.Response;
import com.linkql.core.execution.ResponsePagination;
import com.linkql.core.execution.TopLevelRequest;
import com.linkql.core.execution.TopLevelResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionResolverTest {
    private static final ResourceName ITEMS = ResourceName.of("items", 1);
    private static final int LIMIT = 100;

    private final ConnectionResolver resolver = new ConnectionResolver();

    @Test
    void testTopLevelKeepsRequestOrder() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("c", "a", "b"))
                .objects(ITEMS, objects("a", "b", "c"))
                .build();

        List<Map<String, Object>> elements = resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null);

        assertEquals(List.of("c", "a", "b"), ids(elements));
    }

    @Test
    void testTopLevelDropsIdentifiersThatWereNotFetched() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("a", "b", "c"))
                .objects(ITEMS, objects("a", "c"))
                .build();

        List<Map<String, Object>> elements = resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null);

        assertEquals(List.of("a", "c"), ids(elements));
    }

    @Test
    void testTopLevelMatchesOnAliasAndName() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("a"))
                .topLevel(ITEMS, RequestField.aliased("multiGet", "second"), List.of("b", "c"))
                .topLevel(ResourceName.of("other", 1), RequestField.aliased("multiGet", "third"), List.of("a"))
                .objects(ITEMS, objects("a", "b", "c"))
                .build();

        assertEquals(List.of("b", "c"),
                ids(resolver.resolve(response, topLevel("multiGet", "second"), ITEMS, "multiGet", LIMIT, null)));
        assertEquals(List.of("a"),
                ids(resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null)));
        assertEquals(List.of(),
                resolver.resolve(response, topLevel("multiGet", "third"), ITEMS, "multiGet", LIMIT, null));
        assertEquals(List.of(),
                resolver.resolve(response, topLevel("byName", null), ITEMS, "byName", LIMIT, null));
    }

    @Test
    void testTopLevelIgnoresStartAndLimit() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("a", "b", "c"))
                .objects(ITEMS, objects("a", "b", "c"))
                .build();

        List<Map<String, Object>> elements = resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", 1, "b");

        assertEquals(List.of("a", "b", "c"), ids(elements));
    }

    @Test
    void testEmptyParentMapIsTopLevel() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("a"))
                .objects(ITEMS, objects("a"))
                .build();
        ParentLinkage linkage = new ParentLinkage(Map.of(), Map.of(), "multiGet", null, ITEMS, "multiGet");

        assertEquals(List.of("a"), ids(resolver.resolve(response, linkage, ITEMS, "multiGet", LIMIT, null)));
    }

    @Test
    void testNestedWindowsByStartAndLimit() {
        Response response = Response.builder().objects(ITEMS, objects(1, 2, 3, 4, 5)).build();
        ParentLinkage linkage = nested(Map.of("items", List.of(1, 2, 3, 4, 5)), null);

        List<Map<String, Object>> elements = resolver.resolve(response, linkage, ITEMS, "items", 2, "3");

        assertEquals(List.of(3, 4), ids(elements));
    }

    @Test
    void testNestedLimitWithoutStart() {
        Response response = Response.builder().objects(ITEMS, objects(1, 2, 3)).build();
        ParentLinkage linkage = nested(Map.of("items", List.of(3, 1, 2)), null);

        assertEquals(List.of(3, 1), ids(resolver.resolve(response, linkage, ITEMS, "items", 2, null)));
        assertEquals(List.of(3, 1, 2), ids(resolver.resolve(response, linkage, ITEMS, "items", 10, null)));
        assertEquals(List.of(), resolver.resolve(response, linkage, ITEMS, "items", 0, null));
    }

    @Test
    void testNestedUnknownCursorPagesFromTheFirstIdentifier() {
        Response response = Response.builder().objects(ITEMS, objects(1, 2, 3)).build();
        ParentLinkage linkage = nested(Map.of("items", List.of(1, 2, 3)), null);

        assertEquals(List.of(1, 2), ids(resolver.resolve(response, linkage, ITEMS, "items", 2, "42")));
    }

    @Test
    void testUnknownCursorIsReportedOncePerOccurrence() {
        Logger logger = (Logger) LoggerFactory.getLogger(ConnectionResolver.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Response response = Response.builder().objects(ITEMS, objects(1, 2, 3)).build();
            ParentLinkage linkage = nested(Map.of("items", List.of(1, 2, 3)), null);

            resolver.resolve(response, linkage, ITEMS, "items", 2, "42");
            assertEquals(new ResponsePagination("3", 3L), resolver.paging(response, linkage, "items", 2, "42"));

            assertEquals(1, appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count());
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void testCursorIndex() {
        List<Object> ids = List.of(1, 2, 3);
        assertEquals(0, ConnectionResolver.cursorIndex(ids, null));
        assertEquals(1, ConnectionResolver.cursorIndex(ids, "2"));
        assertEquals(-1, ConnectionResolver.cursorIndex(ids, "42"));
    }

    @Test
    void testNestedReadsTheAliasedKey() {
        Response response = Response.builder().objects(ITEMS, objects("a", "b")).build();
        ParentLinkage linkage = nested(Map.of("items", List.of("a"), "favourites", List.of("b")), "favourites");

        assertEquals(List.of("b"), ids(resolver.resolve(response, linkage, ITEMS, "items", LIMIT, null)));
    }

    @Test
    void testNestedDropsMissingObjectsAfterWindowing() {
        Response response = Response.builder().objects(ITEMS, objects("a", "c", "d")).build();
        ParentLinkage linkage = nested(Map.of("items", List.of("a", "b", "c", "d")), null);

        assertEquals(List.of("a", "c"), ids(resolver.resolve(response, linkage, ITEMS, "items", 3, null)));
    }

    @Test
    void testNestedWithoutIdentifiersIsEmpty() {
        Response response = Response.builder().objects(ITEMS, objects("a")).build();

        assertEquals(List.of(), resolver.resolve(response, nested(Map.of("name", "x"), null), ITEMS, "items", LIMIT, null));
        assertEquals(List.of(), resolver.resolve(response, nested(Map.of("items", "a"), null), ITEMS, "items", LIMIT, null));
    }

    @Test
    void testUnfetchedResourceIsEmpty() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("a"))
                .build();

        assertEquals(List.of(), resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null));
        assertEquals(List.of(), resolver.resolve(response, nested(Map.of("items", List.of("a")), null), ITEMS, "items", LIMIT, null));
    }

    @Test
    void testMissingContextIsEmpty() {
        assertEquals(List.of(), resolver.resolve(null, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null));
        assertNull(resolver.resolveOne(null, topLevel("get", null), ITEMS));
    }

    @Test
    void testResolveOneTakesTheFirstFetchedIdentifier() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("get"), List.of("x", "b"))
                .objects(ITEMS, objects("a", "b"))
                .build();

        assertEquals("b", resolver.resolveOne(response, topLevel("get", null), ITEMS).get("id"));
        assertNull(resolver.resolveOne(response, topLevel("get", "other"), ITEMS));
    }

    @Test
    void testNestedPaging() {
        ParentLinkage linkage = nested(Map.of("items", List.of(1, 2, 3, 4, 5)), null);

        assertEquals(new ResponsePagination("5", 5L), resolver.paging(Response.EMPTY, linkage, "items", 2, "3"));
        assertEquals(new ResponsePagination(null, 5L), resolver.paging(Response.EMPTY, linkage, "items", 2, "4"));
        assertEquals(new ResponsePagination("3", 5L), resolver.paging(Response.EMPTY, linkage, "items", 2, null));
    }

    @Test
    void testTopLevelPagingComesFromTheResponse() {
        ExecutionContext response = Response.builder()
                .topLevel(new TopLevelRequest(ITEMS, RequestField.named("byName")),
                        new TopLevelResponse(List.of("a"), new ResponsePagination("b", 12L)))
                .build();

        assertEquals(new ResponsePagination("b", 12L),
                resolver.paging(response, topLevel("byName", null), "byName", LIMIT, null));
        assertEquals(ResponsePagination.EMPTY,
                resolver.paging(response, topLevel("multiGet", null), "multiGet", LIMIT, null));
    }

    @Test
    void testResolutionLeavesTheContextUntouched() {
        Response response = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("b", "a"))
                .objects(ITEMS, objects("a", "b"))
                .build();
        Response copy = Response.builder()
                .topLevel(ITEMS, RequestField.named("multiGet"), List.of("b", "a"))
                .objects(ITEMS, objects("a", "b"))
                .build();

        resolver.resolve(response, topLevel("multiGet", null), ITEMS, "multiGet", LIMIT, null);
        resolver.resolve(response, nested(Map.of("items", List.of("a")), null), ITEMS, "items", 1, "a");

        assertEquals(copy, response);
    }

    private static ParentLinkage topLevel(String selectionName, String alias) {
        return new ParentLinkage(null, Map.of(), selectionName, alias, ITEMS, selectionName);
    }

    private static ParentLinkage nested(Map<String, Object> parent, String alias) {
        return new ParentLinkage(parent, Map.of(), "items", alias, ITEMS, "items");
    }

    private static Map<Object, Map<String, Object>> objects(Object... ids) {
        Map<Object, Map<String, Object>> objects = new LinkedHashMap<>();
        for (Object id : ids) {
            objects.put(id, Map.of("id", id));
        }
        return objects;
    }

    private static List<Object> ids(List<Map<String, Object>> elements) {
        return elements.stream().map(e -> e.get("id")).toList();
    }
}
