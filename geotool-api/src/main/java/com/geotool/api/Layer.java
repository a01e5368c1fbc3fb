package com.geotool.api;

/**
 * Named, displayable entry of the map.
 */
public interface Layer {

    int getHandle();

    String getName();

    void setName(String name);

    /** Bounding box of the layer's data; {@link Envelope#isEmpty()} when the layer has no features. */
    Envelope getExtent();
}
