package com.geotool.api;

import com.geotool.config.GeoToolConfig;

/**
 * Application context handed to a tool once, at initialization. Services are already resolved
 * by the host; the tool keeps a non-owning reference to the context.
 */
public interface ToolContext {

    /** Live layers of the map; read access only. */
    LayerCollection getLayers();

    MessageService getMessageService();

    LayerService getLayerService();

    /** Execution settings. Default: built-in defaults, without reading the environment. */
    default GeoToolConfig getConfig() {
        return GeoToolConfig.defaults();
    }
}
