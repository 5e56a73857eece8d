package com.switchyard.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A single call of a tool with its parameters.
 *
 * @param tool        tool name
 * @param parameters  parameters, already validated as deterministically serializable
 * @param requestedAt when the call was made
 * @param fingerprint hash of tool name and canonical parameters; cache key and queue dedup key
 */
public record InvocationRequest(
    String tool,
    Map<String, Object> parameters,
    Instant requestedAt,
    String fingerprint
) {}
