package com.geotool.tools;

import com.geotool.api.PluginIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private static final PluginIdentity IDENTITY = new PluginIdentity("Test plugin", "tests", "0000");

    private final ToolRegistry registry = ToolRegistry.getInstance();

    private static GisToolProvider provider(String name, boolean enabled) {
        return new GisToolProvider() {
            @Override
            public String getToolName() {
                return name;
            }

            @Override
            public PluginIdentity getPluginIdentity() {
                return IDENTITY;
            }

            @Override
            public GisTool createTool() {
                return new AbstractGisToolTest.SampleTool();
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry.clear();
    }

    @AfterEach
    void tearDown() {
        registry.clear();
    }

    @Test
    void register_andCreateFreshTools() {
        assertTrue(registry.register(provider("Sample", true)));

        GisTool first = registry.createTool("Sample");
        GisTool second = registry.createTool(" Sample ");

        assertNotSame(first, second);
        assertEquals("Sample", first.getName());
        assertEquals(IDENTITY, first.getPluginIdentity());
        assertNull(registry.createTool("Unknown"));
        assertNull(registry.get(null));
    }

    @Test
    void register_skipsDisabledProviders() {
        assertFalse(registry.register(provider("Disabled", false)));
        assertTrue(registry.getToolNames().isEmpty());
    }

    @Test
    void register_rejectsDuplicateAndBlankNames() {
        registry.register(provider("Sample", true));

        assertThrows(IllegalArgumentException.class, () -> registry.register(provider("Sample", true)));
        assertThrows(IllegalArgumentException.class, () -> registry.register(provider("  ", true)));
    }

    @Test
    void getToolNames_sorted() {
        registry.register(provider("Buffer", true));
        registry.register(provider("Aggregate", true));

        assertEquals(List.of("Aggregate", "Buffer"), registry.getToolNames());
    }

    @Test
    void loadFromClasspath_withoutProvidersRegistersNothing() {
        assertEquals(0, registry.loadFromClasspath(ToolRegistryTest.class.getClassLoader()));
    }
}
