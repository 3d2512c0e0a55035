package com.linkql.core.execution;

public record TopLevelResult(TopLevelRequest request, TopLevelResponse response) {
}
