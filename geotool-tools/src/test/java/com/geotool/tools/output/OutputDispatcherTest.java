package com.geotool.tools.output;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.geotool.api.Datasource;
import com.geotool.api.Envelope;
import com.geotool.config.GeoToolConfig;
import com.geotool.parameters.OutputLayerInfo;
import com.geotool.tools.FakeDatasource;
import com.geotool.tools.FakeToolContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputDispatcherTest {

    @TempDir
    Path tempDir;

    private FakeToolContext context;
    private OutputDispatcher dispatcher;
    private ListAppender<ILoggingEvent> logEvents;
    private Logger dispatcherLogger;

    @BeforeEach
    void setUp() {
        GeoToolConfig config = GeoToolConfig.builder().outputDirectory(tempDir).build();
        context = new FakeToolContext(config);
        dispatcher = new OutputDispatcher(context, context, context, new FileDatasourceStore(config));

        dispatcherLogger = (Logger) LoggerFactory.getLogger(OutputDispatcher.class);
        logEvents = new ListAppender<>();
        logEvents.start();
        dispatcherLogger.addAppender(logEvents);
    }

    @AfterEach
    void tearDown() {
        dispatcherLogger.detachAppender(logEvents);
    }

    @Test
    void disk_existingFileWithoutOverwrite_failsWithoutWritingOrRegistering() throws Exception {
        Path existing = Files.writeString(tempDir.resolve("out.shp"), "old");
        FakeDatasource ds = new FakeDatasource("new");
        OutputLayerInfo info = OutputLayerInfo.builder("out.shp").overwrite(false).addToMap(true).build();

        assertFalse(dispatcher.handleOutput(ds, info));

        assertEquals("old", Files.readString(existing));
        assertEquals(0, ds.getSaveCount());
        assertTrue(context.addedFiles.isEmpty());
        assertEquals(1, ds.getDisposeCount());
        assertEquals(1, context.messages.size());
        assertTrue(context.messages.get(0).startsWith("Failed to overwrite existing datasource"));
    }

    @Test
    void disk_overwriteReplacesFileAndSidecars() throws Exception {
        Path shp = Files.writeString(tempDir.resolve("out.shp"), "old");
        Path dbf = Files.writeString(tempDir.resolve("out.dbf"), "old attributes");
        Path unrelated = Files.writeString(tempDir.resolve("other.dbf"), "keep");
        FakeDatasource ds = new FakeDatasource("new");
        OutputLayerInfo info = OutputLayerInfo.builder("out.shp").overwrite(true).addToMap(false).build();

        assertTrue(dispatcher.handleOutput(ds, info));

        assertEquals("new", Files.readString(shp));
        assertFalse(Files.exists(dbf));
        assertTrue(Files.exists(unrelated));
        assertEquals(1, ds.getDisposeCount());
        assertTrue(context.addedFiles.isEmpty());
    }

    @Test
    void disk_overwriteOfNonShapefileKeepsSameNamedShapefile() throws Exception {
        Path shp = Files.writeString(tempDir.resolve("roads.shp"), "geometry");
        Path dbf = Files.writeString(tempDir.resolve("roads.dbf"), "attributes");
        Path shx = Files.writeString(tempDir.resolve("roads.shx"), "index");
        Path geojson = Files.writeString(tempDir.resolve("roads.geojson"), "old");
        FakeDatasource ds = new FakeDatasource("new");
        OutputLayerInfo info = OutputLayerInfo.builder("roads.geojson").overwrite(true).addToMap(false).build();

        assertTrue(dispatcher.handleOutput(ds, info));

        assertEquals("new", Files.readString(geojson));
        assertEquals("geometry", Files.readString(shp));
        assertEquals("attributes", Files.readString(dbf));
        assertEquals("index", Files.readString(shx));
    }

    @Test
    void disk_removalFailure_isOverwriteFailure() {
        DatasourceStore stuck = new DatasourceStore() {
            @Override
            public String resolve(String name) {
                return name;
            }

            @Override
            public boolean exists(String filename) {
                return true;
            }

            @Override
            public boolean remove(String filename) {
                return false;
            }

            @Override
            public boolean save(Datasource datasource, String filename) {
                throw new AssertionError("must not save after failed removal");
            }
        };
        OutputDispatcher d = new OutputDispatcher(context, context, context, stuck);
        FakeDatasource ds = new FakeDatasource("new");

        assertFalse(d.handleOutput(ds, OutputLayerInfo.builder("locked.shp").overwrite(true).build()));
        assertEquals(1, ds.getDisposeCount());
    }

    @Test
    void disk_newFileIsSavedAndAddedToMap() throws Exception {
        FakeDatasource ds = new FakeDatasource("points");

        assertTrue(dispatcher.handleOutput(ds, OutputLayerInfo.builder("sub/points.geojson").build()));

        Path written = tempDir.resolve("sub").resolve("points.geojson");
        assertEquals("points", Files.readString(written));
        assertEquals(List.of(written.toAbsolutePath().normalize().toString()), context.addedFiles);
        assertEquals(1, ds.getDisposeCount());
    }

    @Test
    void disk_registrationResultIsReturned() {
        context.rejectLayers();
        FakeDatasource ds = new FakeDatasource("points");

        assertFalse(dispatcher.handleOutput(ds, OutputLayerInfo.builder("points.geojson").build()));
        assertTrue(Files.exists(tempDir.resolve("points.geojson")));
        assertEquals(1, ds.getDisposeCount());
    }

    @Test
    void disk_saveFailureIsLoggedWithLastError() {
        FakeDatasource ds = new FakeDatasource("x", true);

        assertFalse(dispatcher.handleOutput(ds, OutputLayerInfo.builder("fail.shp").build()));

        assertEquals(1, ds.getDisposeCount());
        assertTrue(context.addedFiles.isEmpty());
        assertTrue(logEvents.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getFormattedMessage().contains("disk full")));
    }

    @Test
    void memory_notAddedToMap_isDisposedAndWarned() {
        FakeDatasource ds = new FakeDatasource("points");

        assertFalse(dispatcher.handleOutput(ds,
                OutputLayerInfo.builder("Random points").memoryLayer(true).addToMap(false).build()));

        assertEquals(1, ds.getDisposeCount());
        assertTrue(context.addedDatasources.isEmpty());
        assertTrue(logEvents.list.stream().anyMatch(e -> e.getLevel() == Level.WARN));
    }

    @Test
    void memory_addedToMap_isRenamedAndNotDisposed() {
        context.addLayer("rivers", Envelope.empty());
        FakeDatasource ds = new FakeDatasource("points");

        assertTrue(dispatcher.handleOutput(ds,
                OutputLayerInfo.builder("Random points").memoryLayer(true).build()));

        assertEquals(0, ds.getDisposeCount());
        assertSame(ds, context.addedDatasources.get(0));
        assertEquals("Random points", context.getByHandle(context.getLastLayerHandle()).getName());
        assertEquals("rivers", context.getAll().get(0).getName());
        assertEquals(0, ds.getSaveCount());
    }

    @Test
    void memory_registrationFailure_disposes() {
        context.rejectLayers();
        FakeDatasource ds = new FakeDatasource("points");

        assertFalse(dispatcher.handleOutput(ds,
                OutputLayerInfo.builder("Random points").memoryLayer(true).build()));
        assertEquals(1, ds.getDisposeCount());
    }
}
