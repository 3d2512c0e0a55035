package com.linkql.api.graphql;

import com.linkql.core.ResourceName;

/**
 * GraphQL-safe names derived from resource identities, e.g. {@code courses.v1} becomes
 * {@code CoursesV1}, {@code CoursesV1Connection} and {@code CoursesV1Resource}.
 */
public final class TypeNames {
    private TypeNames() {
    }

    public static String elementTypeName(ResourceName resource) {
        return pascalCase(resource.topLevelName()) + "V" + resource.version();
    }

    public static String connectionTypeName(ResourceName resource) {
        return elementTypeName(resource) + "Connection";
    }

    public static String resourceTypeName(ResourceName resource) {
        return elementTypeName(resource) + "Resource";
    }

    static String pascalCase(String name) {
        StringBuilder out = new StringBuilder();
        for (String part : name.split("[^A-Za-z0-9_]+")) {
            if (!part.isEmpty()) {
                out.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return out.toString();
    }
}
