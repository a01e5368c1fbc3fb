package com.geotool.parameters;

import com.geotool.api.Layer;
import com.geotool.api.LayerCollection;

import java.util.List;
import java.util.Objects;

/**
 * Selection of one layer of the live map. Bound to the map's layer collection when the tool is
 * initialized; until then nothing can be selected.
 */
public class LayerParameter extends ToolParameter {

    private LayerCollection layers;
    private Integer selectedHandle;

    @Override
    public ParameterKind getKind() {
        return ParameterKind.LAYER;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitLayer(this);
    }

    /** Binds the parameter to the layers it can choose from. */
    public void initialize(LayerCollection layers) {
        this.layers = Objects.requireNonNull(layers, "layers");
    }

    public boolean isInitialized() {
        return layers != null;
    }

    /** Layers available for selection; empty before {@link #initialize(LayerCollection)}. */
    public List<Layer> getSelectableLayers() {
        return layers != null ? layers.getAll() : List.of();
    }

    /**
     * Selects the layer with the given handle.
     *
     * @throws IllegalStateException if the parameter is not initialized
     * @throws IllegalArgumentException if no layer has that handle
     */
    public void select(int handle) {
        if (layers == null) {
            throw new IllegalStateException("Layer parameter not initialized: " + getName());
        }
        if (layers.getByHandle(handle) == null) {
            throw new IllegalArgumentException("No layer with handle " + handle);
        }
        this.selectedHandle = handle;
    }

    public void clearSelection() {
        this.selectedHandle = null;
    }

    /** The selected layer, or null if none is selected or it was removed from the map. */
    public Layer getSelectedLayer() {
        if (layers == null || selectedHandle == null) return null;
        return layers.getByHandle(selectedHandle);
    }

    /** Layer parameters have no declarable default. */
    @Override
    public void setDefaultValue(Object value) {
        if (value != null) {
            throw new IllegalArgumentException("Layer parameter " + getName() + " does not take a default value");
        }
    }

    @Override
    public ValidationResult validate() {
        if (isRequired() && getSelectedLayer() == null) {
            return ValidationResult.error(label() + ": no layer is selected.");
        }
        return ValidationResult.ok();
    }
}
