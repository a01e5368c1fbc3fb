package com.geotool.tools.output;

import com.geotool.api.Datasource;
import com.geotool.api.Layer;
import com.geotool.api.LayerCollection;
import com.geotool.api.LayerService;
import com.geotool.api.MessageService;
import com.geotool.parameters.OutputLayerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Commits a datasource produced by a tool, either to disk or as an in-memory layer.
 * <p>
 * <b>Ownership:</b> the dispatcher owns the datasource passed to {@link #handleOutput}. It disposes it on
 * every path except a successful in-memory registration, where the layer registry becomes the owner.
 * Conflicts and write failures are reported as {@code false}, never thrown.
 */
public final class OutputDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutputDispatcher.class);

    private final LayerService layerService;
    private final LayerCollection layers;
    private final MessageService messageService;
    private final DatasourceStore store;

    public OutputDispatcher(LayerService layerService, LayerCollection layers, MessageService messageService,
                            DatasourceStore store) {
        this.layerService = Objects.requireNonNull(layerService, "layerService");
        this.layers = Objects.requireNonNull(layers, "layers");
        this.messageService = Objects.requireNonNull(messageService, "messageService");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return true if the output was committed (and, when requested, added to the map)
     */
    public boolean handleOutput(Datasource datasource, OutputLayerInfo outputInfo) {
        Objects.requireNonNull(datasource, "datasource");
        Objects.requireNonNull(outputInfo, "outputInfo");
        if (outputInfo.isMemoryLayer()) {
            return handleMemoryOutput(datasource, outputInfo);
        }
        return handleDiskOutput(datasource, outputInfo);
    }

    private boolean handleDiskOutput(Datasource datasource, OutputLayerInfo outputInfo) {
        String filename = store.resolve(outputInfo.getName());

        if (store.exists(filename)) {
            if (!outputInfo.isOverwrite()) {
                datasource.dispose();
                return handleOverwriteFailure(filename);
            }
            if (!store.remove(filename)) {
                datasource.dispose();
                return handleOverwriteFailure(filename);
            }
        }

        if (!store.save(datasource, filename)) {
            log.error("Failed to save datasource to {}: {}", filename, datasource.getLastError());
            datasource.dispose();
            return false;
        }
        log.info("Layer ({}) is created.", filename);
        datasource.dispose();

        if (outputInfo.isAddToMap()) {
            return layerService.addLayersFromFilename(filename);
        }
        return true;
    }

    private boolean handleMemoryOutput(Datasource datasource, OutputLayerInfo outputInfo) {
        if (!outputInfo.isAddToMap()) {
            datasource.dispose();
            log.warn("Memory layer created by the tool wasn't added to the map: {}", outputInfo.getName());
            return false;
        }

        if (!layerService.addDatasource(datasource)) {
            log.error("Failed to add memory layer to the map: {}", outputInfo.getName());
            datasource.dispose();
            return false;
        }

        int layerHandle = layerService.getLastLayerHandle();
        Layer layer = layers.getByHandle(layerHandle);
        if (layer != null) {
            layer.setName(outputInfo.getName());
        } else {
            log.warn("Added layer handle {} not found; name {} not applied", layerHandle, outputInfo.getName());
        }
        return true;
    }

    private boolean handleOverwriteFailure(String filename) {
        log.warn("Failed to overwrite existing datasource: {}", filename);
        messageService.info("Failed to overwrite existing datasource: " + filename);
        return false;
    }
}
