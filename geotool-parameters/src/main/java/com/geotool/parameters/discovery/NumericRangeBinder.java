package com.geotool.parameters.discovery;

import com.geotool.parameters.BooleanParameter;
import com.geotool.parameters.DoubleParameter;
import com.geotool.parameters.IntegerParameter;
import com.geotool.parameters.LayerParameter;
import com.geotool.parameters.OutputLayerParameter;
import com.geotool.parameters.ParameterVisitor;
import com.geotool.parameters.StringParameter;

/**
 * Projects a declared range onto numeric parameters; other variants are left alone.
 * Returns true when the range was applied.
 */
final class NumericRangeBinder implements ParameterVisitor<Boolean> {

    private final RangeSpec range;

    NumericRangeBinder(RangeSpec range) {
        this.range = range;
    }

    @Override
    public Boolean visitInteger(IntegerParameter parameter) {
        parameter.setRange((int) range.minimum(), (int) range.maximum());
        return true;
    }

    @Override
    public Boolean visitDouble(DoubleParameter parameter) {
        parameter.setRange(range.minimum(), range.maximum());
        return true;
    }

    @Override
    public Boolean visitString(StringParameter parameter) {
        return false;
    }

    @Override
    public Boolean visitBoolean(BooleanParameter parameter) {
        return false;
    }

    @Override
    public Boolean visitLayer(LayerParameter parameter) {
        return false;
    }

    @Override
    public Boolean visitOutputLayer(OutputLayerParameter parameter) {
        return false;
    }
}
