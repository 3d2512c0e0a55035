package com.linkql.core;

public enum HandlerKind {
    GET,
    MULTI_GET,
    GET_ALL,
    FINDER,
    SINGLE_ELEMENT_FINDER,
    UNKNOWN;

    public static HandlerKind fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        for (HandlerKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
