package com.switchyard.core.executor;

import java.util.Map;

/**
 * Invokes a tool on the remote backend.
 */
public interface RemoteExecutor {

    /**
     * @return the tool's result
     * @throws RemoteUnreachableException if the backend could not be reached
     * @throws ToolExecutionException     with kind {@code REMOTE_EXECUTION_FAILED} if the backend
     *                                    answered with an error
     */
    Object execute(String tool, Map<String, Object> parameters);

    /** Base URL requests are sent to, for logging and health reporting. */
    String endpoint();
}
