package com.geotool.tools.output;

import com.geotool.api.Datasource;
import com.geotool.config.GeoToolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Stores datasources as files. Relative names are resolved against the configured output directory;
 * removing a shapefile also removes its sidecars (e.g. {@code .shx}, {@code .dbf}, {@code .prj} next to a {@code .shp}).
 * Files of other formats are removed alone.
 */
public final class FileDatasourceStore implements DatasourceStore {

    private static final Logger log = LoggerFactory.getLogger(FileDatasourceStore.class);

    private static final String SHAPEFILE_EXTENSION = "shp";

    private final GeoToolConfig config;

    public FileDatasourceStore(GeoToolConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String resolve(String name) {
        try {
            Path p = Path.of(name);
            if (!p.isAbsolute()) {
                p = config.getOutputDirectory().resolve(p);
            }
            return p.toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            log.warn("Output name is not a valid path, using it as is: {}", name);
            return name;
        }
    }

    @Override
    public boolean exists(String filename) {
        try {
            return Files.exists(Path.of(filename));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    @Override
    public boolean remove(String filename) {
        Path main;
        try {
            main = Path.of(filename);
        } catch (InvalidPathException e) {
            log.warn("Cannot remove {}: {}", filename, e.getMessage());
            return false;
        }
        try {
            for (Path p : withSidecars(main)) {
                if (Files.deleteIfExists(p)) {
                    log.debug("Removed {}", p);
                }
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to remove {}: {}", filename, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean save(Datasource datasource, String filename) {
        try {
            Path parent = Path.of(filename).getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException | InvalidPathException e) {
            log.error("Cannot create directory for {}: {}", filename, e.getMessage());
            return false;
        }
        return datasource.saveAs(filename);
    }

    /**
     * The file itself followed, for a shapefile, by its companion files with the configured extensions.
     * A file of any other format has no sidecars: same-named {@code .dbf} or {@code .prj} files next to
     * {@code roads.geojson} belong to another dataset.
     */
    List<Path> withSidecars(Path main) {
        List<Path> files = new ArrayList<>();
        files.add(main);
        Path fileName = main.getFileName();
        if (fileName == null) return files;
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return files;
        if (!SHAPEFILE_EXTENSION.equals(name.substring(dot + 1).toLowerCase(Locale.ROOT))) return files;
        String base = name.substring(0, dot);
        for (String ext : config.getSidecarExtensions()) {
            Path sidecar = main.resolveSibling(base + "." + ext);
            if (!sidecar.equals(main)) {
                files.add(sidecar);
            }
        }
        return files;
    }
}
