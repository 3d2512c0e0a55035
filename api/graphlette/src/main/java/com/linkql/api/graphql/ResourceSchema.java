package com.linkql.api.graphql;

import com.linkql.core.Handler;
import com.linkql.core.Resource;
import com.linkql.core.ResourceName;
import com.linkql.core.SchemaMetadata;
import com.linkql.core.config.GraphConfig;
import com.linkql.core.execution.ExecutionContext;
import com.linkql.core.schema.ElementSchema;
import com.linkql.core.schema.FieldSpec;
import com.linkql.core.schema.RelationDeclaration;
import com.linkql.core.schema.SchemaError;
import com.linkql.core.schema.SchemaGenerationException;
import graphql.schema.DataFetcher;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLCodeRegistry;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLTypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles a {@link GraphQLSchema} for every resource of a {@link SchemaMetadata}.
 * <p>
 * Each resource gets an element type with its scalar fields and one connection field per declared
 * relation, and a root field {@code <Resource>Resource} exposing its handlers. A field that cannot
 * be built is reported in {@link #errors()} and left out; the rest of the schema is unaffected.
 */
public class ResourceSchema {
    private static final Logger logger = LoggerFactory.getLogger(ResourceSchema.class);
    public static final String QUERY = "Query";

    private final GraphQLSchema schema;
    private final List<SchemaError> errors;
    private final Map<FieldCoordinates, RelationField> relationFields;

    private ResourceSchema(GraphQLSchema schema, List<SchemaError> errors, Map<FieldCoordinates, RelationField> relationFields) {
        this.schema = schema;
        this.errors = Collections.unmodifiableList(errors);
        this.relationFields = Collections.unmodifiableMap(relationFields);
    }

    public static ResourceSchema create(SchemaMetadata metadata, GraphConfig config) {
        return new Assembly(metadata, config).assemble();
    }

    public GraphQLSchema schema() {
        return schema;
    }

    public List<SchemaError> errors() {
        return errors;
    }

    public Map<FieldCoordinates, RelationField> relationFields() {
        return relationFields;
    }

    public RelationComplexityCalculator complexityCalculator() {
        return new RelationComplexityCalculator(relationFields);
    }

    private static final class Assembly {
        private final SchemaMetadata metadata;
        private final GraphConfig config;
        private final ConnectionResolver resolver = new ConnectionResolver();
        private final PaginationField pagination;
        private final PaginatedResourceField paginated;
        private final HandlerArguments handlerArguments;

        private final GraphQLCodeRegistry.Builder code = GraphQLCodeRegistry.newCodeRegistry();
        private final Map<String, List<GraphQLFieldDefinition>> elementTypes = new LinkedHashMap<>();
        private final Map<ResourceName, List<GraphQLFieldDefinition>> resourceTypes = new LinkedHashMap<>();
        private final List<PendingRelation> pending = new ArrayList<>();
        private final Map<String, ConnectionType> connections = new LinkedHashMap<>();
        private final Map<FieldCoordinates, RelationField> relationFields = new LinkedHashMap<>();
        private final List<SchemaError> errors = new ArrayList<>();

        Assembly(SchemaMetadata metadata, GraphConfig config) {
            this.metadata = metadata;
            this.config = config;
            this.pagination = new PaginationField(config.defaultLimit(), resolver);
            this.paginated = new PaginatedResourceField(metadata, pagination, resolver);
            this.handlerArguments = new HandlerArguments(pagination);
        }

        ResourceSchema assemble() {
            for (Resource resource : metadata.resources()) {
                Optional<ElementSchema> elementSchema = metadata.getSchema(resource);
                if (elementSchema.isEmpty()) {
                    fail(new SchemaError.SchemaMissing(resource.name()));
                    continue;
                }
                addElementType(resource, elementSchema.get());
                if (config.exposesAtRoot(resource.name().identifier())) {
                    addResourceType(resource);
                }
            }

            Set<String> excluded = emptyElementTypes();
            pending.forEach(relation -> attach(relation, excluded));

            GraphQLObjectType.Builder query = GraphQLObjectType.newObject().name(QUERY);
            GraphQLSchema.Builder schema = GraphQLSchema.newSchema();

            resourceTypes.forEach((resource, fields) -> {
                String typeName = TypeNames.resourceTypeName(resource);
                if (excluded.contains(TypeNames.elementTypeName(resource))) {
                    logger.warn("Element type of {} has no fields, leaving out {}", resource, typeName);
                    return;
                }
                if (fields.isEmpty()) {
                    logger.warn("Resource type {} has no paginated or single-element handlers, leaving it out", typeName);
                    return;
                }
                GraphQLObjectType type = GraphQLObjectType.newObject().name(typeName).fields(fields).build();
                DataFetcher<Map<String, Object>> root = env -> Map.of();
                query.field(GraphQLFieldDefinition.newFieldDefinition().name(typeName).type(type));
                code.dataFetcher(FieldCoordinates.coordinates(QUERY, typeName), root);
            });
            elementTypes.forEach((typeName, fields) -> {
                if (!excluded.contains(typeName)) {
                    schema.additionalType(GraphQLObjectType.newObject().name(typeName).fields(fields).build());
                }
            });
            connections.values().forEach(connection -> {
                schema.additionalType(connection.objectType());
                paginated.connectionDataFetchers().forEach((field, fetcher) ->
                        code.dataFetcher(FieldCoordinates.coordinates(connection.name(), field), fetcher));
            });
            schema.additionalType(pagination.type());
            pagination.dataFetchers().forEach((field, fetcher) ->
                    code.dataFetcher(FieldCoordinates.coordinates(PaginationField.TYPE_NAME, field), fetcher));

            GraphQLObjectType queryType = query.build();
            if (queryType.getFieldDefinitions().isEmpty()) {
                throw new SchemaGenerationException("No resource can be exposed at the query root");
            }

            logger.debug("Assembled schema: {} element types, {} connection types, {} relation fields, {} errors",
                    elementTypes.size() - excluded.size(), connections.size(), relationFields.size(), errors.size());

            return new ResourceSchema(
                    schema.query(queryType).codeRegistry(code.build()).build(),
                    errors,
                    relationFields
            );
        }

        private void addElementType(Resource resource, ElementSchema elementSchema) {
            String typeName = TypeNames.elementTypeName(resource.name());
            List<GraphQLFieldDefinition> fields = new ArrayList<>();
            for (FieldSpec field : elementSchema.fields()) {
                fields.add(GraphQLFieldDefinition.newFieldDefinition()
                        .name(field.name())
                        .type(ScalarTypes.outputType(field))
                        .build());
            }
            elementTypes.put(typeName, fields);

            for (RelationDeclaration declaration : elementSchema.relations()) {
                paginated.build(
                        declaration.relation().target(),
                        declaration.fieldName(),
                        null,
                        declaration.relation()
                ).accept(this::fail, field -> pending.add(new PendingRelation(typeName, typeName, fields, field)));
            }
        }

        private void addResourceType(Resource resource) {
            ResourceName name = resource.name();
            String typeName = TypeNames.resourceTypeName(name);
            String elementType = TypeNames.elementTypeName(name);
            List<GraphQLFieldDefinition> fields = new ArrayList<>();
            resourceTypes.put(name, fields);

            for (Handler handler : resource.handlers()) {
                switch (handler.kind()) {
                    case GET -> {
                        fields.add(GraphQLFieldDefinition.newFieldDefinition()
                                .name(handler.name())
                                .type(GraphQLTypeReference.typeRef(elementType))
                                .arguments(handlerArguments.generate(handler, false))
                                .build());
                        code.dataFetcher(FieldCoordinates.coordinates(typeName, handler.name()), singleElement(name, handler));
                    }
                    case MULTI_GET, GET_ALL, FINDER -> paginated.build(name, handler.name(), handler, null)
                            .accept(this::fail, field -> pending.add(new PendingRelation(typeName, elementType, fields, field)));
                    default -> logger.debug("Handler {} of {} is {}, not exposed", handler.name(), name, handler.kind());
                }
            }
        }

        private DataFetcher<Map<String, Object>> singleElement(ResourceName resource, Handler handler) {
            return env -> resolver.resolveOne(
                    env.getGraphQlContext().get(ExecutionContext.CONTEXT_KEY),
                    ParentLinkage.from(env, resource, handler.name()),
                    resource
            );
        }

        /**
         * Element types left without a single field once relations to other empty types are
         * dropped. Repeats until no further type empties out.
         */
        private Set<String> emptyElementTypes() {
            Set<String> excluded = new HashSet<>();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Map.Entry<String, List<GraphQLFieldDefinition>> type : elementTypes.entrySet()) {
                    String typeName = type.getKey();
                    if (excluded.contains(typeName) || !type.getValue().isEmpty()) {
                        continue;
                    }
                    boolean hasRelation = pending.stream()
                            .anyMatch(relation -> relation.typeName().equals(typeName) && attachable(relation, excluded));
                    if (!hasRelation) {
                        logger.warn("Element type {} has no fields, leaving it out", typeName);
                        excluded.add(typeName);
                        changed = true;
                    }
                }
            }
            return excluded;
        }

        private boolean attachable(PendingRelation relation, Set<String> excluded) {
            return !excluded.contains(relation.elementType())
                    && !excluded.contains(TypeNames.elementTypeName(relation.field().resource()))
                    && !relation.field().connectionType().fields().isEmpty();
        }

        private void attach(PendingRelation relation, Set<String> excluded) {
            RelationField field = relation.field();
            if (!attachable(relation, excluded)) {
                logger.warn("{} of {} has no fields to page over, leaving out {}.{}",
                        field.connectionType().name(), field.resource(), relation.typeName(), field.name());
                return;
            }
            connections.putIfAbsent(field.connectionType().name(), field.connectionType());
            FieldCoordinates coordinates = FieldCoordinates.coordinates(relation.typeName(), field.name());
            relation.fields().add(field.definition());
            code.dataFetcher(coordinates, field.resolver());
            relationFields.put(coordinates, field);
        }

        private void fail(SchemaError error) {
            logger.warn("Skipping field: {}", error.message());
            errors.add(error);
        }
    }

    /**
     * A built relation field waiting to be added to {@code typeName}, an element type or a root
     * resource type; {@code elementType} is the element type that owner type depends on.
     */
    private record PendingRelation(
            String typeName,
            String elementType,
            List<GraphQLFieldDefinition> fields,
            RelationField field
    ) {
    }
}
