package com.linkql.core.execution;

/**
 * Cursor of the following page, if any, and the total element count when the server reports it.
 */
public record ResponsePagination(String next, Long total) {
    public static final ResponsePagination EMPTY = new ResponsePagination(null, null);
}
