package com.geotool.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of tool providers by tool name. The host registers providers at startup (explicitly or from
 * the classpath) and creates a fresh tool instance for every execution.
 */
public final class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ToolRegistry INSTANCE = new ToolRegistry();

    /** tool name → provider */
    private final Map<String, GisToolProvider> providers = new ConcurrentHashMap<>();

    public static ToolRegistry getInstance() {
        return INSTANCE;
    }

    private ToolRegistry() {
    }

    /**
     * Registers a provider under its tool name. Disabled providers are skipped.
     *
     * @return true if registered, false if the provider is disabled
     * @throws IllegalArgumentException if the tool name is blank or already registered
     */
    public boolean register(GisToolProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String name = Objects.requireNonNull(provider.getToolName(), "toolName").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Tool name must be non-blank");
        }
        if (!provider.isEnabled()) {
            log.debug("Tool provider {} is disabled; not registered", name);
            return false;
        }
        if (providers.putIfAbsent(name, provider) != null) {
            throw new IllegalArgumentException("Tool already registered: " + name);
        }
        return true;
    }

    /**
     * Registers every {@link GisToolProvider} visible to the class loader. Duplicates and broken service
     * entries are logged and skipped.
     *
     * @return number of providers registered
     */
    public int loadFromClasspath(ClassLoader classLoader) {
        int n = 0;
        try {
            for (GisToolProvider provider : ServiceLoader.load(GisToolProvider.class, classLoader)) {
                try {
                    if (register(provider)) n++;
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping tool provider {}: {}", provider.getClass().getName(), e.getMessage());
                }
            }
        } catch (ServiceConfigurationError e) {
            log.error("Failed to load tool providers: {}", e.getMessage(), e);
        }
        log.info("Registered {} tool provider(s) from classpath", n);
        return n;
    }

    /** Provider for the tool name, or null if not registered. */
    public GisToolProvider get(String toolName) {
        if (toolName == null || toolName.isBlank()) return null;
        return providers.get(toolName.trim());
    }

    /** New uninitialized tool, or null if no provider is registered under the name. */
    public GisTool createTool(String toolName) {
        GisToolProvider provider = get(toolName);
        return provider != null ? provider.createTool() : null;
    }

    /** Registered tool names, sorted. */
    public List<String> getToolNames() {
        return providers.keySet().stream().sorted().collect(Collectors.toList());
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        providers.clear();
    }
}
