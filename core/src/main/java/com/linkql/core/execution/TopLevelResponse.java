package com.linkql.core.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record TopLevelResponse(List<Object> ids, ResponsePagination pagination) {
    public TopLevelResponse {
        ids = ids == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ids));
        pagination = pagination == null ? ResponsePagination.EMPTY : pagination;
    }

    public static TopLevelResponse of(List<?> ids) {
        return new TopLevelResponse(new ArrayList<>(ids), ResponsePagination.EMPTY);
    }
}
