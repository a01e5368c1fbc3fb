package com.geotool.tools;

import com.geotool.api.PluginIdentity;
import com.geotool.api.ToolContext;
import com.geotool.parameters.discovery.ParameterSet;

/**
 * A unit of GIS data processing with declared parameters.
 * <p>
 * <b>Threading:</b> tools run on the host's main thread; one instance is used for one execution.
 */
public interface GisTool {

    String getName();

    String getDescription();

    /** Identity of the plugin that contributed this tool. */
    PluginIdentity getPluginIdentity();

    /**
     * Parameters of the tool, built on first access and cached for the lifetime of the instance.
     * Repeated calls return the same set holding the same parameter objects.
     */
    ParameterSet getParameters();

    /**
     * Binds the application context. Call exactly once per instance, before {@link #validate()}.
     *
     * @throws ToolConfigurationException if the context or one of its services is missing
     */
    void initialize(ToolContext context);

    /**
     * Validates parameter values; reports the first failure to the user.
     *
     * @return true if all parameters are valid
     */
    boolean validate();

    /**
     * Executes the tool.
     *
     * @return true on success; data-processing failures are reported by returning false
     */
    boolean run();
}
