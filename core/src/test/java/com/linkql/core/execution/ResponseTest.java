package com.linkql.core.execution;

import com.linkql.core.ResourceName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseTest {
    private static final ResourceName COURSES = ResourceName.of("courses", 1);

    @Test
    void testBuilderKeepsTopLevelOrder() {
        Response response = Response.builder()
                .topLevel(COURSES, RequestField.named("multiGet"), List.of("b", "a"))
                .topLevel(COURSES, RequestField.aliased("multiGet", "other"), List.of("c"))
                .build();

        assertEquals(2, response.topLevelResponses().size());
        assertEquals(List.of("b", "a"), response.topLevelResponses().get(0).response().ids());
        assertEquals("other", response.topLevelResponses().get(1).request().selection().alias());
    }

    @Test
    void testObjectsAreAbsentForUnfetchedResources() {
        Response response = Response.builder()
                .object(COURSES, "a", Map.of("id", "a"))
                .build();

        assertTrue(response.objects(COURSES).isPresent());
        assertTrue(response.objects(ResourceName.of("instructors", 1)).isEmpty());
    }

    @Test
    void testResponseIsNotAffectedByLaterBuilderOrSourceChanges() {
        Map<Object, Map<String, Object>> source = new HashMap<>();
        source.put("a", Map.of("id", "a"));
        Response.Builder builder = Response.builder().objects(COURSES, source);
        Response response = builder.build();

        source.put("b", Map.of("id", "b"));
        builder.object(COURSES, "c", Map.of("id", "c"));

        assertEquals(1, response.objects(COURSES).orElseThrow().size());
        assertThrows(UnsupportedOperationException.class,
                () -> response.objects(COURSES).orElseThrow().put("d", Map.of()));
    }

    @Test
    void testTopLevelResponseToleratesNullIdentifiers() {
        TopLevelResponse response = new TopLevelResponse(Arrays.<Object>asList("a", null), null);
        assertEquals(2, response.ids().size());
        assertEquals(ResponsePagination.EMPTY, response.pagination());
    }

    @Test
    void testRequestFieldMatchesNameAndAlias() {
        assertTrue(RequestField.named("multiGet").matches("multiGet", null));
        assertFalse(RequestField.named("multiGet").matches("multiGet", "first"));
        assertTrue(RequestField.aliased("multiGet", "first").matches("multiGet", "first"));
        assertFalse(RequestField.aliased("multiGet", "first").matches("byInstructor", "first"));
    }

    @Test
    void testRequestFieldKeepsExplicitNullArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("start", null);
        arguments.put("limit", 10);

        RequestField field = new RequestField("multiGet", null, arguments);
        arguments.put("limit", 20);

        assertTrue(field.arguments().containsKey("start"));
        assertNull(field.arguments().get("start"));
        assertEquals(10, field.arguments().get("limit"));
        assertThrows(UnsupportedOperationException.class, () -> field.arguments().put("q", "x"));
    }
}
