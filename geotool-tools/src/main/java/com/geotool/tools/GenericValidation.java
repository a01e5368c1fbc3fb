package com.geotool.tools;

import com.geotool.parameters.BooleanParameter;
import com.geotool.parameters.DoubleParameter;
import com.geotool.parameters.IntegerParameter;
import com.geotool.parameters.LayerParameter;
import com.geotool.parameters.OutputLayerParameter;
import com.geotool.parameters.ParameterVisitor;
import com.geotool.parameters.StringParameter;
import com.geotool.parameters.ValidationResult;

/**
 * Selects the checks of the generic validation pass: value and output-layer parameters validate
 * themselves; layer selections pass.
 */
final class GenericValidation implements ParameterVisitor<ValidationResult> {

    static final GenericValidation INSTANCE = new GenericValidation();

    private GenericValidation() {
    }

    @Override
    public ValidationResult visitInteger(IntegerParameter parameter) {
        return parameter.validate();
    }

    @Override
    public ValidationResult visitDouble(DoubleParameter parameter) {
        return parameter.validate();
    }

    @Override
    public ValidationResult visitString(StringParameter parameter) {
        return parameter.validate();
    }

    @Override
    public ValidationResult visitBoolean(BooleanParameter parameter) {
        return parameter.validate();
    }

    // Selections are checked by the tool itself when it runs.
    @Override
    public ValidationResult visitLayer(LayerParameter parameter) {
        return ValidationResult.ok();
    }

    @Override
    public ValidationResult visitOutputLayer(OutputLayerParameter parameter) {
        return parameter.validate();
    }
}
