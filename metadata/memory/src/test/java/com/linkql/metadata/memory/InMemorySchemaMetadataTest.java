package com.linkql.metadata.memory;

import com.linkql.core.Handler;
import com.linkql.core.HandlerKind;
import com.linkql.core.Resource;
import com.linkql.core.ResourceName;
import com.linkql.core.schema.ElementSchema;
import com.linkql.core.schema.FieldSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySchemaMetadataTest {
    private static final ResourceName COURSES = ResourceName.of("courses", 1);
    private static final ResourceName LEGACY = ResourceName.of("legacy", 0);

    private final InMemorySchemaMetadata metadata = InMemorySchemaMetadata.builder()
            .resource(new Resource(COURSES, "Course", List.of(Handler.of("multiGet", HandlerKind.MULTI_GET))))
            .resource(new Resource(LEGACY, "Legacy", List.of()))
            .schema(new ElementSchema("Course", List.of(new FieldSpec("id", "id")), List.of()))
            .build();

    @Test
    void testLooksUpResourcesByName() {
        assertEquals("Course", metadata.getResource(ResourceName.parse("courses.v1")).orElseThrow().schema());
        assertTrue(metadata.getResource(ResourceName.of("courses", 2)).isEmpty());
    }

    @Test
    void testSchemaOfResource() {
        Resource courses = metadata.getResource(COURSES).orElseThrow();
        assertEquals("Course", metadata.getSchema(courses).orElseThrow().name());
        assertTrue(metadata.getSchema(metadata.getResource(LEGACY).orElseThrow()).isEmpty());
    }

    @Test
    void testResourcesKeepDeclarationOrder() {
        assertEquals(List.of(COURSES, LEGACY), metadata.resources().stream().map(Resource::name).toList());
    }
}
