package com.geotool.parameters;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a produced dataset goes: a file on disk (name is a path) or an in-memory layer (name is the
 * display name), whether an existing file may be overwritten, and whether the result is added to the map.
 * Immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public final class OutputLayerInfo {

    private final String name;
    private final boolean memoryLayer;
    private final boolean overwrite;
    private final boolean addToMap;

    private OutputLayerInfo(Builder b) {
        this.name = b.name;
        this.memoryLayer = b.memoryLayer;
        this.overwrite = b.overwrite;
        this.addToMap = b.addToMap;
    }

    public String getName() {
        return name;
    }

    public boolean isMemoryLayer() {
        return memoryLayer;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public boolean isAddToMap() {
        return addToMap;
    }

    /**
     * Checks that the destination is usable: a name is given and, for disk outputs, it is a valid path
     * with a file extension whose directory exists. Relative paths are not checked against a directory.
     */
    public ValidationResult validate() {
        if (name == null || name.isBlank()) {
            return ValidationResult.error("Output layer name is not specified.");
        }
        if (memoryLayer) {
            return ValidationResult.ok();
        }
        Path path;
        try {
            path = Path.of(name);
        } catch (InvalidPathException e) {
            return ValidationResult.error("Invalid output filename: " + name);
        }
        Path fileName = path.getFileName();
        String file = fileName != null ? fileName.toString() : "";
        int dot = file.lastIndexOf('.');
        if (dot <= 0 || dot == file.length() - 1) {
            return ValidationResult.error("Output filename has no extension: " + name);
        }
        Path parent = path.getParent();
        if (path.isAbsolute() && parent != null && !Files.isDirectory(parent)) {
            return ValidationResult.error("Output directory does not exist: " + parent);
        }
        return ValidationResult.ok();
    }

    public Builder toBuilder() {
        return new Builder(name)
                .memoryLayer(memoryLayer)
                .overwrite(overwrite)
                .addToMap(addToMap);
    }

    /** Builder for a disk output added to the map, without overwrite. */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputLayerInfo that = (OutputLayerInfo) o;
        return memoryLayer == that.memoryLayer && overwrite == that.overwrite && addToMap == that.addToMap
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, memoryLayer, overwrite, addToMap);
    }

    @Override
    public String toString() {
        return "OutputLayerInfo{name=" + name + ", memoryLayer=" + memoryLayer
                + ", overwrite=" + overwrite + ", addToMap=" + addToMap + "}";
    }

    public static final class Builder {
        private final String name;
        private boolean memoryLayer;
        private boolean overwrite;
        private boolean addToMap = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder memoryLayer(boolean memoryLayer) {
            this.memoryLayer = memoryLayer;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder addToMap(boolean addToMap) {
            this.addToMap = addToMap;
            return this;
        }

        public OutputLayerInfo build() {
            return new OutputLayerInfo(this);
        }
    }
}
