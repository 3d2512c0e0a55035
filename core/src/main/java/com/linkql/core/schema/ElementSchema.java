package com.linkql.core.schema;

import java.util.List;

/**
 * The shape of the objects a resource returns: scalar fields plus relation fields pointing at
 * other resources.
 */
public record ElementSchema(
        String name,
        List<FieldSpec> fields,
        List<RelationDeclaration> relations
) {
    public ElementSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }
}
