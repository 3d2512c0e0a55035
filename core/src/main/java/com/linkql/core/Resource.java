package com.linkql.core;

import java.util.List;
import java.util.Optional;

/**
 * Descriptor of a REST resource: its identity, the element schema its objects follow and the
 * handlers it serves. Loaded once by a {@link SchemaMetadata} and never mutated.
 */
public record Resource(
        ResourceName name,
        String schema,
        List<Handler> handlers
) {
    public Resource {
        handlers = handlers == null ? List.of() : List.copyOf(handlers);
    }

    public Optional<Handler> handlerOfKind(HandlerKind kind) {
        return handlers.stream().filter(h -> h.kind() == kind).findFirst();
    }

    public Optional<Handler> handlerNamed(String handlerName, HandlerKind kind) {
        return handlers.stream()
                .filter(h -> h.kind() == kind && h.name().equals(handlerName))
                .findFirst();
    }
}
