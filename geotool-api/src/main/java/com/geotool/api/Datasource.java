package com.geotool.api;

/**
 * Opaque handle to a geographic dataset produced or consumed by a tool.
 * <p>
 * <b>Ownership:</b> exactly one owner at a time. A tool owns the datasources it creates until it hands
 * them to the output dispatcher; the dispatcher either disposes them or transfers them to the layer registry.
 */
public interface Datasource {

    /**
     * Writes the dataset to the given file.
     *
     * @return true on success; on failure {@link #getLastError()} describes the problem
     */
    boolean saveAs(String filename);

    /** Releases the handle. Must be called at most once by the owner. */
    void dispose();

    /** Description of the last failure, or an empty string. */
    String getLastError();
}
