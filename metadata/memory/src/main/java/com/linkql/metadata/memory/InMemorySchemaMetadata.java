package com.linkql.metadata.memory;

import com.linkql.core.Resource;
import com.linkql.core.ResourceName;
import com.linkql.core.SchemaMetadata;
import com.linkql.core.schema.ElementSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema metadata held in memory. Built once, then read concurrently.
 */
public class InMemorySchemaMetadata implements SchemaMetadata {
    private final Map<ResourceName, Resource> resources;
    private final Map<String, ElementSchema> schemas;

    public InMemorySchemaMetadata(List<Resource> resources, List<ElementSchema> schemas) {
        Map<ResourceName, Resource> byName = new LinkedHashMap<>();
        resources.forEach(r -> byName.put(r.name(), r));
        Map<String, ElementSchema> bySchemaName = new LinkedHashMap<>();
        schemas.forEach(s -> bySchemaName.put(s.name(), s));
        this.resources = Collections.unmodifiableMap(byName);
        this.schemas = Collections.unmodifiableMap(bySchemaName);
    }

    @Override
    public Optional<Resource> getResource(ResourceName name) {
        return Optional.ofNullable(resources.get(name));
    }

    @Override
    public Optional<ElementSchema> getSchema(Resource resource) {
        if (resource == null || resource.schema() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemas.get(resource.schema()));
    }

    @Override
    public Collection<Resource> resources() {
        return resources.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Resource> resources = new ArrayList<>();
        private final List<ElementSchema> schemas = new ArrayList<>();

        public Builder resource(Resource resource) {
            this.resources.add(resource);
            return this;
        }

        public Builder schema(ElementSchema schema) {
            this.schemas.add(schema);
            return this;
        }

        public InMemorySchemaMetadata build() {
            return new InMemorySchemaMetadata(resources, schemas);
        }
    }
}
