package com.geotool.tools;

import com.geotool.api.PluginIdentity;

/**
 * SPI for contributing tools. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.geotool.tools.GisToolProvider) or registered explicitly with {@link ToolRegistry}.
 */
public interface GisToolProvider {

    /** Tool name; unique in a registry and equal to {@link GisTool#getName()} of the created tools. */
    String getToolName();

    PluginIdentity getPluginIdentity();

    /** Creates a new, uninitialized tool instance. */
    GisTool createTool();

    /**
     * Whether this provider should be registered. Override to skip registration when a dependency is unavailable.
     */
    default boolean isEnabled() {
        return true;
    }
}
