package com.geotool.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Settings for tool execution, loaded from environment variables.
 * <p>
 * Output: GEOTOOL_OUTPUT_DIR (base directory for relative output names).
 * Overwrite: GEOTOOL_SIDECAR_EXTENSIONS (comma-separated, removed together with the main file).
 * Tools: GEOTOOL_RANDOM_SEED (optional seed for tools that draw random numbers).
 */
public final class GeoToolConfig {

    private static final String ENV_OUTPUT_DIR = "GEOTOOL_OUTPUT_DIR";
    private static final String ENV_SIDECAR_EXTENSIONS = "GEOTOOL_SIDECAR_EXTENSIONS";
    private static final String ENV_RANDOM_SEED = "GEOTOOL_RANDOM_SEED";

    private static final String DEFAULT_OUTPUT_DIR = ".";
    /** Files that travel with a shapefile (and MapWindow's own index files). */
    private static final List<String> DEFAULT_SIDECAR_EXTENSIONS =
            List.of("shx", "dbf", "prj", "cpg", "sbn", "sbx", "qix", "mwd", "mwx");

    private final Path outputDirectory;
    private final List<String> sidecarExtensions;
    private final Long randomSeed;

    private GeoToolConfig(Builder b) {
        this.outputDirectory = b.outputDirectory;
        this.sidecarExtensions = Collections.unmodifiableList(new ArrayList<>(b.sidecarExtensions));
        this.randomSeed = b.randomSeed;
    }

    /** Base directory against which relative output names are resolved. Default: working directory. */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Extensions (lower case, without the dot) of companion files removed when a shapefile output is overwritten,
     * e.g. {@code out.shx} and {@code out.dbf} for {@code out.shp}.
     */
    public List<String> getSidecarExtensions() {
        return sidecarExtensions;
    }

    /** Seed for random number generation in tools; null when runs should not be reproducible. */
    public Long getRandomSeed() {
        return randomSeed;
    }

    /** Built-in defaults; does not read the environment. */
    public static GeoToolConfig defaults() {
        return builder().build();
    }

    public static GeoToolConfig fromEnvironment() {
        List<String> sidecars = parseCommaSeparated(System.getenv(ENV_SIDECAR_EXTENSIONS));
        if (sidecars.isEmpty()) sidecars = DEFAULT_SIDECAR_EXTENSIONS;

        return builder()
                .outputDirectory(Path.of(getEnv(ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR)))
                .sidecarExtensions(sidecars)
                .randomSeed(parseLong(System.getenv(ENV_RANDOM_SEED)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String normalizeExtension(String extension) {
        String e = extension.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e.substring(1) : e;
    }

    public static final class Builder {
        private Path outputDirectory = Path.of(DEFAULT_OUTPUT_DIR);
        private List<String> sidecarExtensions = DEFAULT_SIDECAR_EXTENSIONS;
        private Long randomSeed;

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
            return this;
        }

        public Builder sidecarExtensions(List<String> sidecarExtensions) {
            this.sidecarExtensions = sidecarExtensions != null
                    ? sidecarExtensions.stream()
                            .filter(Objects::nonNull)
                            .filter(s -> !s.isBlank())
                            .map(GeoToolConfig::normalizeExtension)
                            .collect(Collectors.toList())
                    : List.of();
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public GeoToolConfig build() {
            return new GeoToolConfig(this);
        }
    }
}
