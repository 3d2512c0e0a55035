package com.linkql.core.execution;

import com.linkql.core.ResourceName;

public record TopLevelRequest(ResourceName resource, RequestField selection) {
}
