package com.geotool.tools.output;

import com.geotool.api.Datasource;

/**
 * Persistence used for disk outputs. Names passed to {@link #exists}, {@link #remove} and {@link #save}
 * are the values returned by {@link #resolve}.
 */
public interface DatasourceStore {

    /** Turns an output name into the identifier of the stored dataset (e.g. an absolute path). */
    String resolve(String name);

    boolean exists(String filename);

    /**
     * Removes the dataset and its companion files.
     *
     * @return true if nothing is left under the name
     */
    boolean remove(String filename);

    /**
     * Writes the datasource. Does not dispose it.
     *
     * @return true on success; on failure the datasource's last error describes the problem
     */
    boolean save(Datasource datasource, String filename);
}
