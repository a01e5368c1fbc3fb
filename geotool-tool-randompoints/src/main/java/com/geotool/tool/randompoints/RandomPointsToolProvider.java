package com.geotool.tool.randompoints;

import com.geotool.api.PluginIdentity;
import com.geotool.tools.GisTool;
import com.geotool.tools.GisToolProvider;

/**
 * Provider for {@link RandomPointsTool}. Registered via META-INF/services/com.geotool.tools.GisToolProvider.
 */
public final class RandomPointsToolProvider implements GisToolProvider {

    static final PluginIdentity IDENTITY =
            new PluginIdentity("Vector tools", "GeoTool", "b8a3b5c2-6a2d-4bd3-9a1c-3f1f2a6f0d41");

    @Override
    public String getToolName() {
        return RandomPointsTool.NAME;
    }

    @Override
    public PluginIdentity getPluginIdentity() {
        return IDENTITY;
    }

    @Override
    public GisTool createTool() {
        return new RandomPointsTool();
    }
}
