package com.geotool.api;

import java.util.List;

/**
 * Read view of the layers currently on the map.
 */
public interface LayerCollection {

    /**
     * Returns the layer with the given handle, or null if no such layer exists.
     */
    Layer getByHandle(int handle);

    /** All layers in map order; never null. */
    List<Layer> getAll();
}
