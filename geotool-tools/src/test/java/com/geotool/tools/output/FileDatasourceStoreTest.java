package com.geotool.tools.output;

import com.geotool.config.GeoToolConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileDatasourceStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void resolve_relativeNamesAgainstOutputDirectory() {
        FileDatasourceStore store = new FileDatasourceStore(GeoToolConfig.builder().outputDirectory(tempDir).build());
        Path absolute = tempDir.resolve("abs.shp").toAbsolutePath();

        assertEquals(tempDir.resolve("a/b.shp").toAbsolutePath().normalize().toString(), store.resolve("a/./b.shp"));
        assertEquals(absolute.normalize().toString(), store.resolve(absolute.toString()));
    }

    @Test
    void withSidecars_usesConfiguredExtensions() {
        FileDatasourceStore store = new FileDatasourceStore(
                GeoToolConfig.builder().sidecarExtensions(List.of("shx", "shp")).build());
        Path main = tempDir.resolve("roads.shp");

        assertEquals(List.of(main, tempDir.resolve("roads.shx")), store.withSidecars(main));
        assertEquals(List.of(tempDir.resolve("README")), store.withSidecars(tempDir.resolve("README")));
    }

    @Test
    void withSidecars_onlyForShapefiles() {
        FileDatasourceStore store = new FileDatasourceStore(GeoToolConfig.defaults());
        Path geojson = tempDir.resolve("roads.geojson");
        Path upperCase = tempDir.resolve("ROADS.SHP");

        assertEquals(List.of(geojson), store.withSidecars(geojson));
        assertTrue(store.withSidecars(upperCase).contains(tempDir.resolve("ROADS.dbf")));
    }

    @Test
    void remove_succeedsWhenNothingExists() {
        FileDatasourceStore store = new FileDatasourceStore(GeoToolConfig.defaults());

        assertTrue(store.remove(tempDir.resolve("none.shp").toString()));
    }

    @Test
    void remove_failsForNonEmptyDirectory() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("busy.shp"));
        Files.writeString(dir.resolve("inner"), "x");
        FileDatasourceStore store = new FileDatasourceStore(GeoToolConfig.defaults());

        assertFalse(store.remove(dir.toString()));
        assertTrue(store.exists(dir.toString()));
    }
}
