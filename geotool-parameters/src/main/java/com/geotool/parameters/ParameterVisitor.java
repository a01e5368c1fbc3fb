package com.geotool.parameters;

/**
 * Visitor over all parameter variants. Adding a variant adds a method here, so every
 * implementation has to decide what to do with it.
 *
 * @param <R> result type
 */
public interface ParameterVisitor<R> {

    R visitInteger(IntegerParameter parameter);

    R visitDouble(DoubleParameter parameter);

    R visitString(StringParameter parameter);

    R visitBoolean(BooleanParameter parameter);

    R visitLayer(LayerParameter parameter);

    R visitOutputLayer(OutputLayerParameter parameter);
}
