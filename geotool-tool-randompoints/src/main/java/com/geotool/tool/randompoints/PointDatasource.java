package com.geotool.tool.randompoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geotool.api.Datasource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory point dataset. Saved as a GeoJSON FeatureCollection with one Point feature per point
 * and an {@code id} property (0-based).
 */
public final class PointDatasource implements Datasource {

    private static final Logger log = LoggerFactory.getLogger(PointDatasource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<double[]> points;
    private boolean disposed;
    private String lastError = "";

    /**
     * @param points x/y pairs; copied
     */
    public PointDatasource(List<double[]> points) {
        this.points = new ArrayList<>(points.size());
        for (double[] p : points) {
            this.points.add(new double[]{p[0], p[1]});
        }
    }

    public int getPointCount() {
        return points.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public boolean saveAs(String filename) {
        if (disposed) {
            lastError = "Datasource is disposed";
            return false;
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", "FeatureCollection");
        ArrayNode features = root.putArray("features");
        for (int i = 0; i < points.size(); i++) {
            double[] p = points.get(i);
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            ObjectNode geometry = feature.putObject("geometry");
            geometry.put("type", "Point");
            geometry.putArray("coordinates").add(p[0]).add(p[1]);
            feature.putObject("properties").put("id", i);
        }
        try {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(new File(filename), root);
            lastError = "";
            return true;
        } catch (IOException e) {
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Writing {} failed: {}", filename, lastError);
            return false;
        }
    }

    @Override
    public void dispose() {
        disposed = true;
        points.clear();
    }

    @Override
    public String getLastError() {
        return lastError;
    }
}
