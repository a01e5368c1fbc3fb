package com.geotool.tools;

/**
 * Thrown when a tool is used without the configuration it needs (missing context or services,
 * use before initialization, undeclared parameter slot). Indicates a host or tool-authoring defect,
 * not a data condition.
 */
public final class ToolConfigurationException extends RuntimeException {

    public ToolConfigurationException(String message) {
        super(message);
    }

    public ToolConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
