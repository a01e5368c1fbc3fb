package com.geotool.parameters;

/**
 * Destination of the dataset produced by a tool.
 */
public class OutputLayerParameter extends ToolParameter {

    private OutputLayerInfo value;

    @Override
    public ParameterKind getKind() {
        return ParameterKind.OUTPUT_LAYER;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitOutputLayer(this);
    }

    public OutputLayerInfo getValue() {
        return value;
    }

    public void setValue(OutputLayerInfo value) {
        this.value = value;
    }

    /**
     * Accepts an {@link OutputLayerInfo}, or a name for a disk output that is added to the map.
     */
    @Override
    public void setDefaultValue(Object raw) {
        if (raw == null) {
            this.value = null;
        } else if (raw instanceof OutputLayerInfo) {
            this.value = (OutputLayerInfo) raw;
        } else if (raw instanceof String) {
            this.value = OutputLayerInfo.builder((String) raw).build();
        } else {
            throw new IllegalArgumentException("Cannot use " + raw.getClass().getSimpleName() + " as output layer");
        }
    }

    /** Delegates to {@link OutputLayerInfo#validate()}. */
    @Override
    public ValidationResult validate() {
        if (value == null) {
            return ValidationResult.error(label() + ": output is not specified.");
        }
        return value.validate();
    }
}
