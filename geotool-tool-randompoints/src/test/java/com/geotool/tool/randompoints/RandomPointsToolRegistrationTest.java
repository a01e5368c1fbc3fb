package com.geotool.tool.randompoints;

import com.geotool.tools.GisTool;
import com.geotool.tools.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RandomPointsToolRegistrationTest {

    private final ToolRegistry registry = ToolRegistry.getInstance();

    @AfterEach
    void tearDown() {
        registry.clear();
    }

    @Test
    void loadFromClasspath_findsProviderThroughServiceLoader() {
        registry.clear();

        assertEquals(1, registry.loadFromClasspath(getClass().getClassLoader()));
        assertEquals(List.of(RandomPointsTool.NAME), registry.getToolNames());

        GisTool tool = registry.createTool(RandomPointsTool.NAME);
        assertTrue(tool instanceof RandomPointsTool);
    }

    @Test
    void loadFromClasspath_twiceSkipsDuplicates() {
        registry.clear();
        registry.loadFromClasspath(getClass().getClassLoader());

        assertEquals(0, registry.loadFromClasspath(getClass().getClassLoader()));
    }
}
