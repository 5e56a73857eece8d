package com.switchyard.core.executor;

import java.util.Map;

/**
 * A tool that can run in-process.
 * <p>
 * Implementations must be side-effect free and safe to call from multiple
 * threads. Spring beans implementing this interface are picked up by
 * {@link LocalToolRegistry} automatically.
 */
public interface LocalTool {

    /** Registry name, matching the name the tool is classified under. */
    String name();

    /**
     * Runs the tool.
     *
     * @param parameters request parameters, never {@code null}
     * @return a JSON-serializable result
     * @throws IllegalArgumentException if required parameters are missing or malformed
     */
    Object execute(Map<String, Object> parameters) throws Exception;
}
