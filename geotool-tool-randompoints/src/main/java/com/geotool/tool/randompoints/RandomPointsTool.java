package com.geotool.tool.randompoints;

import com.geotool.api.Envelope;
import com.geotool.api.Layer;
import com.geotool.parameters.IntegerParameter;
import com.geotool.parameters.LayerParameter;
import com.geotool.parameters.OutputLayerInfo;
import com.geotool.parameters.OutputLayerParameter;
import com.geotool.parameters.ValidationResult;
import com.geotool.parameters.discovery.ParameterDeclaration;
import com.geotool.tools.AbstractGisTool;
import com.geotool.tools.ToolConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates uniformly distributed random points within the extent of the selected layer.
 * Uses GEOTOOL_RANDOM_SEED (via the context's config) when set, so runs can be reproduced.
 */
public final class RandomPointsTool extends AbstractGisTool {

    private static final Logger log = LoggerFactory.getLogger(RandomPointsTool.class);

    public static final String NAME = "Random points";
    static final String INPUT_LAYER = "InputLayer";
    static final String POINT_COUNT = "PointCount";
    static final String OUTPUT = "Output";

    public RandomPointsTool() {
        super(RandomPointsToolProvider.IDENTITY);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Generates random points within the extent of the selected layer.";
    }

    @Override
    protected List<ParameterDeclaration> declareParameters() {
        return List.of(
                ParameterDeclaration.required(INPUT_LAYER, LayerParameter::new, 0, "Input layer"),
                ParameterDeclaration.required(POINT_COUNT, IntegerParameter::new, 1, "Number of points")
                        .withRange(1, 1_000_000)
                        .withDefault(500),
                ParameterDeclaration.required(OUTPUT, OutputLayerParameter::new, 2, "Output layer")
                        .withDefault("random_points.geojson"));
    }

    public LayerParameter getInputLayer() {
        return parameter(INPUT_LAYER, LayerParameter.class);
    }

    public IntegerParameter getPointCount() {
        return parameter(POINT_COUNT, IntegerParameter.class);
    }

    public OutputLayerParameter getOutput() {
        return parameter(OUTPUT, OutputLayerParameter.class);
    }

    @Override
    public boolean run() {
        if (!isInitialized()) {
            throw new ToolConfigurationException("Tool " + NAME + " is not initialized");
        }
        Layer layer = getInputLayer().getSelectedLayer();
        if (layer == null) {
            getMessageService().info("No input layer is selected.");
            return false;
        }
        Envelope extent = layer.getExtent();
        if (extent == null || extent.isEmpty()) {
            getMessageService().info("Input layer has an empty extent: " + layer.getName());
            return false;
        }

        // validate() may have been skipped
        if (!checked(getPointCount().validate()) || !checked(getOutput().validate())) {
            return false;
        }
        int count = getPointCount().getValue();
        OutputLayerInfo output = getOutput().getValue();
        Long seed = getConfig().getRandomSeed();
        Random random = seed != null ? new Random(seed) : new Random();

        List<double[]> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double x = extent.minX() + random.nextDouble() * extent.width();
            double y = extent.minY() + random.nextDouble() * extent.height();
            points.add(new double[]{x, y});
        }
        log.info("Generated {} random point(s) within the extent of layer {}", count, layer.getName());

        return handleOutput(new PointDatasource(points), output);
    }

    private boolean checked(ValidationResult result) {
        if (!result.valid()) {
            getMessageService().info(result.message());
        }
        return result.valid();
    }
}
