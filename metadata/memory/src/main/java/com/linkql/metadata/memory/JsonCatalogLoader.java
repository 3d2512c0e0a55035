package com.linkql.metadata.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkql.core.Handler;
import com.linkql.core.HandlerKind;
import com.linkql.core.Parameter;
import com.linkql.core.Resource;
import com.linkql.core.ResourceName;
import com.linkql.core.schema.ElementSchema;
import com.linkql.core.schema.FieldRelation;
import com.linkql.core.schema.FieldSpec;
import com.linkql.core.schema.ForwardRelation;
import com.linkql.core.schema.RelationDeclaration;
import com.linkql.core.schema.RelationType;
import com.linkql.core.schema.ReverseRelation;
import com.linkql.core.schema.ReverseRelationAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a catalog of resources and element schemas from JSON:
 *
 * <pre>
 * {
 *   "resources": [
 *     { "name": "courses.v1", "schema": "Course",
 *       "handlers": [ { "name": "multiGet", "kind": "MULTI_GET",
 *                       "parameters": [ { "name": "ids", "type": "[id]", "required": true } ] } ] }
 *   ],
 *   "schemas": [
 *     { "name": "Course",
 *       "fields": [ { "name": "id", "type": "id" } ],
 *       "relations": [
 *         { "field": "instructorIds", "forward": "instructors.v1" },
 *         { "field": "sessions", "reverse": { "resource": "sessions.v1", "type": "FINDER",
 *                                             "arguments": { "q": "byCourse", "courseId": "$id" } } } ] }
 *   ]
 * }
 * </pre>
 */
public class JsonCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(JsonCatalogLoader.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static InMemorySchemaMetadata load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new MetadataLoadException("Cannot read catalog " + path, e);
        }
    }

    public static InMemorySchemaMetadata load(InputStream in) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new MetadataLoadException("Catalog is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MetadataLoadException("Catalog must be a JSON object");
        }

        InMemorySchemaMetadata.Builder builder = InMemorySchemaMetadata.builder();
        for (JsonNode resource : root.path("resources")) {
            builder.resource(readResource(resource));
        }
        for (JsonNode schema : root.path("schemas")) {
            builder.schema(readSchema(schema));
        }
        InMemorySchemaMetadata metadata = builder.build();
        logger.debug("Loaded catalog with {} resources", metadata.resources().size());
        return metadata;
    }

    private static Resource readResource(JsonNode node) {
        ResourceName name = ResourceName.parse(required(node, "name"));
        List<Handler> handlers = new ArrayList<>();
        for (JsonNode handler : node.path("handlers")) {
            List<Parameter> parameters = new ArrayList<>();
            for (JsonNode parameter : handler.path("parameters")) {
                JsonNode defaultValue = parameter.get("default");
                parameters.add(new Parameter(
                        required(parameter, "name"),
                        parameter.path("type").asText("string"),
                        parameter.path("required").asBoolean(false),
                        defaultValue == null || defaultValue.isNull() ? null : mapper.convertValue(defaultValue, Object.class)
                ));
            }
            handlers.add(new Handler(
                    required(handler, "name"),
                    HandlerKind.fromName(handler.path("kind").asText(null)),
                    parameters
            ));
        }
        return new Resource(name, node.path("schema").asText(null), handlers);
    }

    private static ElementSchema readSchema(JsonNode node) {
        List<FieldSpec> fields = new ArrayList<>();
        for (JsonNode field : node.path("fields")) {
            fields.add(new FieldSpec(required(field, "name"), field.path("type").asText("string")));
        }
        List<RelationDeclaration> relations = new ArrayList<>();
        for (JsonNode relation : node.path("relations")) {
            relations.add(new RelationDeclaration(required(relation, "field"), readRelation(relation)));
        }
        return new ElementSchema(required(node, "name"), fields, relations);
    }

    private static FieldRelation readRelation(JsonNode node) {
        if (node.hasNonNull("forward")) {
            return new ForwardRelation(ResourceName.parse(node.get("forward").asText()));
        }
        JsonNode reverse = node.path("reverse");
        if (!reverse.isObject()) {
            throw new MetadataLoadException("Relation " + node.path("field").asText() + " is neither forward nor reverse");
        }
        Map<String, String> arguments = new LinkedHashMap<>();
        reverse.path("arguments").fields().forEachRemaining(e -> arguments.put(e.getKey(), e.getValue().asText()));
        return new ReverseRelation(new ReverseRelationAnnotation(
                ResourceName.parse(required(reverse, "resource")),
                arguments,
                RelationType.fromName(reverse.path("type").asText(null)),
                reverse.path("description").asText(null)
        ));
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new MetadataLoadException("Missing '" + field + "' in " + node);
        }
        return value.asText();
    }
}
