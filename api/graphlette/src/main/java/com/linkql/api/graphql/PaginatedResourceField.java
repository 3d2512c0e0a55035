package com.linkql.api.graphql;

import com.linkql.core.Handler;
import com.linkql.core.Resource;
import com.linkql.core.ResourceName;
import com.linkql.core.SchemaMetadata;
import com.linkql.core.execution.ExecutionContext;
import com.linkql.core.schema.FieldRelation;
import com.linkql.core.schema.SchemaError;
import com.linkql.core.schema.SchemaGenerationException;
import com.linkql.core.schema.SchemaResult;
import graphql.schema.DataFetcher;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLTypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds paginated fields: a field of type {@code <Resource>Connection} exposing {@code elements}
 * and {@code paging}, served by the handler the {@link RelationClassifier} picks.
 */
public class PaginatedResourceField {
    private static final Logger logger = LoggerFactory.getLogger(PaginatedResourceField.class);
    public static final String IDS_ARGUMENT = "ids";

    private final SchemaMetadata metadata;
    private final PaginationField pagination;
    private final HandlerArguments handlerArguments;
    private final ConnectionResolver resolver;

    public PaginatedResourceField(SchemaMetadata metadata, PaginationField pagination, ConnectionResolver resolver) {
        this.metadata = metadata;
        this.pagination = pagination;
        this.handlerArguments = new HandlerArguments(pagination);
        this.resolver = resolver;
    }

    /**
     * @param resourceName    resource the field pages over
     * @param fieldName       name of the field
     * @param handlerOverride handler to serve the field regardless of relation, or null
     * @param relation        relation the field implements, or null
     */
    public SchemaResult<RelationField> build(
            ResourceName resourceName,
            String fieldName,
            Handler handlerOverride,
            FieldRelation relation
    ) {
        Optional<Resource> resource = metadata.getResource(resourceName);
        if (resource.isEmpty()) {
            return SchemaResult.failed(new SchemaError.ResourceNotFound(resourceName));
        }
        if (metadata.getSchema(resource.get()).isEmpty()) {
            return SchemaResult.failed(new SchemaError.SchemaMissing(resourceName));
        }

        return RelationClassifier.classify(resource.get(), fieldName, handlerOverride, relation).map(handler -> {
            Set<String> boundArguments = relation == null
                    ? Set.of()
                    : relation.<Set<String>>fold(forward -> Set.of(), reverse -> reverse.annotation().arguments().keySet());

            List<GraphQLArgument> arguments = handlerArguments.generate(handler, true).stream()
                    .filter(argument -> !IDS_ARGUMENT.equals(argument.getName()))
                    .filter(argument -> !boundArguments.contains(argument.getName()))
                    .collect(Collectors.toList());

            logger.debug("Paginated field {} on {} served by {} ({})", fieldName, resourceName, handler.name(), handler.kind());

            return new RelationField(
                    fieldName,
                    resourceName,
                    handler,
                    arguments,
                    connectionType(resourceName),
                    env -> ParentLinkage.from(env, resourceName, fieldName),
                    RelationComplexity.PAGINATED,
                    pagination.defaultLimit()
            );
        });
    }

    /**
     * Fetchers of the {@code elements} and {@code paging} members, shared by every connection type.
     */
    public Map<String, DataFetcher<?>> connectionDataFetchers() {
        Map<String, DataFetcher<?>> fetchers = new LinkedHashMap<>();
        fetchers.put("elements", env -> {
            ParentLinkage linkage = env.getSource();
            ExecutionContext context = env.getGraphQlContext().get(ExecutionContext.CONTEXT_KEY);
            return resolver.resolve(
                    context,
                    linkage,
                    linkage.resource(),
                    linkage.fieldName(),
                    linkage.limit(pagination.defaultLimit()),
                    linkage.start()
            );
        });
        fetchers.put("paging", env -> env.getSource());
        return fetchers;
    }

    ConnectionType connectionType(ResourceName resourceName) {
        Resource resource = metadata.getResource(resourceName)
                .orElseThrow(() -> new SchemaGenerationException("Cannot find schema for " + resourceName));
        metadata.getSchema(resource)
                .orElseThrow(() -> new SchemaGenerationException("Cannot find schema for " + resourceName));

        return new ConnectionType(
                TypeNames.connectionTypeName(resourceName),
                resourceName,
                () -> connectionFields(resourceName)
        );
    }

    private List<GraphQLFieldDefinition> connectionFields(ResourceName resourceName) {
        try {
            Optional<String> elementType = metadata.getResource(resourceName)
                    .flatMap(metadata::getSchema)
                    .map(schema -> TypeNames.elementTypeName(resourceName));
            if (elementType.isEmpty()) {
                logger.warn("Element type of {} cannot be resolved, its connection has no fields", resourceName);
                return List.of();
            }
            return List.of(
                    GraphQLFieldDefinition.newFieldDefinition()
                            .name("elements")
                            .type(GraphQLList.list(GraphQLTypeReference.typeRef(elementType.get())))
                            .build(),
                    GraphQLFieldDefinition.newFieldDefinition()
                            .name("paging")
                            .type(GraphQLTypeReference.typeRef(PaginationField.TYPE_NAME))
                            .build()
            );
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve element type of {}, its connection has no fields", resourceName, e);
            return List.of();
        }
    }
}
