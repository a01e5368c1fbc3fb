package com.geotool.api;

/**
 * Adds layers to the live map. The registry behind it is only ever mutated through this service.
 */
public interface LayerService {

    /**
     * Opens the file(s) and adds them as layers.
     *
     * @param filename path of the dataset on disk
     * @return true if at least one layer was added
     */
    boolean addLayersFromFilename(String filename);

    /**
     * Adds an in-memory datasource as a layer. On success the registry owns the datasource.
     *
     * @return true if the layer was added
     */
    boolean addDatasource(Datasource datasource);

    /** Handle of the most recently added layer, or -1 when nothing was added yet. */
    int getLastLayerHandle();
}
