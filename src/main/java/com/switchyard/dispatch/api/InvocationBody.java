package com.switchyard.dispatch.api;

import java.util.Map;

/**
 * Request body for {@code POST /api/v1/tools/{tool}/invocations}.
 */
public record InvocationBody(
    Map<String, Object> parameters
) {}
