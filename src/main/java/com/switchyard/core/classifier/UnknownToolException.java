package com.switchyard.core.classifier;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

/**
 * Thrown when a request names a tool that has no descriptor.
 */
public class UnknownToolException extends RouterException {

    public UnknownToolException(String tool) {
        super(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + tool);
    }
}
