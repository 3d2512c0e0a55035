package com.linkql.core.schema;

public record RelationDeclaration(String fieldName, FieldRelation relation) {
}
