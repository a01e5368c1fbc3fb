/**
 * Parameter model: one typed input or output slot of a tool.
 * <p>
 * Every parameter is tagged with a {@link com.geotool.parameters.ParameterKind} and accepts a
 * {@link com.geotool.parameters.ParameterVisitor}, so code that needs per-variant behaviour
 * (range binding, validation selection) is checked for completeness by the compiler instead of
 * relying on {@code instanceof} chains.
 * <ul>
 *   <li>{@link com.geotool.parameters.ValueParameter} – integer, double, string and boolean values</li>
 *   <li>{@link com.geotool.parameters.LayerParameter} – selection of a layer from the live map</li>
 *   <li>{@link com.geotool.parameters.OutputLayerParameter} – destination of the produced dataset</li>
 * </ul>
 */
package com.geotool.parameters;
