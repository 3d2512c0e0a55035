package com.linkql.core.schema;

public enum RelationType {
    GET,
    MULTI_GET,
    FINDER,
    SINGLE_ELEMENT_FINDER,
    UNKNOWN;

    public static RelationType fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (RelationType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
