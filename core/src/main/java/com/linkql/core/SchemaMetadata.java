package com.linkql.core;

import com.linkql.core.schema.ElementSchema;

import java.util.Collection;
import java.util.Optional;

public interface SchemaMetadata {
    Optional<Resource> getResource(ResourceName name);

    Optional<ElementSchema> getSchema(Resource resource);

    Collection<Resource> resources();
}
