package com.linkql.core;

/**
 * A declared parameter of a {@link Handler}. Types are the scalar names understood by the schema
 * generator ({@code string}, {@code int}, {@code long}, {@code float}, {@code boolean},
 * {@code id}); a list is written {@code [string]}.
 */
public record Parameter(
        String name,
        String type,
        boolean required,
        Object defaultValue
) {
    public static Parameter required(String name, String type) {
        return new Parameter(name, type, true, null);
    }

    public static Parameter optional(String name, String type) {
        return new Parameter(name, type, false, null);
    }

    public boolean isList() {
        return type != null && type.startsWith("[") && type.endsWith("]");
    }

    public String elementType() {
        return isList() ? type.substring(1, type.length() - 1) : type;
    }
}
