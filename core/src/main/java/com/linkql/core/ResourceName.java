package com.linkql.core;

import java.util.Objects;

/**
 * Identity of a resource: its top-level name plus version, written {@code name.vN}.
 */
public record ResourceName(String topLevelName, int version) {

    public ResourceName {
        Objects.requireNonNull(topLevelName, "topLevelName");
    }

    public static ResourceName of(String topLevelName, int version) {
        return new ResourceName(topLevelName, version);
    }

    /**
     * Parses {@code courses.v1} into {@code ResourceName("courses", 1)}. A name without a version
     * suffix is treated as version 0.
     */
    public static ResourceName parse(String identifier) {
        int split = identifier.lastIndexOf(".v");
        if (split <= 0) {
            return new ResourceName(identifier, 0);
        }
        String version = identifier.substring(split + 2);
        try {
            return new ResourceName(identifier.substring(0, split), Integer.parseInt(version));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed resource name: " + identifier, e);
        }
    }

    public String identifier() {
        return topLevelName + ".v" + version;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
