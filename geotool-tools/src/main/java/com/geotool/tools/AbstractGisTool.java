package com.geotool.tools;

import com.geotool.api.Datasource;
import com.geotool.api.LayerService;
import com.geotool.api.MessageService;
import com.geotool.api.PluginIdentity;
import com.geotool.api.ToolContext;
import com.geotool.config.GeoToolConfig;
import com.geotool.parameters.LayerParameter;
import com.geotool.parameters.OutputLayerInfo;
import com.geotool.parameters.ToolParameter;
import com.geotool.parameters.ValidationResult;
import com.geotool.parameters.discovery.ParameterDeclaration;
import com.geotool.parameters.discovery.ParameterDiscovery;
import com.geotool.parameters.discovery.ParameterSet;
import com.geotool.tools.output.DatasourceStore;
import com.geotool.tools.output.FileDatasourceStore;
import com.geotool.tools.output.OutputDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Base class for GIS tools: parameter discovery from the declaration table, initialization with the
 * application context, generic validation and output handling. Subclasses declare their parameters
 * and implement {@link #run()}, typically ending with {@link #handleOutput(Datasource, OutputLayerInfo)}.
 */
public abstract class AbstractGisTool implements GisTool {

    private static final Logger log = LoggerFactory.getLogger(AbstractGisTool.class);

    private final PluginIdentity pluginIdentity;
    private final DatasourceStore datasourceStore;
    private ParameterSet parameters;
    private ToolContext context;
    private MessageService messageService;
    private LayerService layerService;
    private OutputDispatcher outputDispatcher;

    /**
     * @param pluginIdentity identity of the contributing plugin
     */
    protected AbstractGisTool(PluginIdentity pluginIdentity) {
        this(pluginIdentity, null);
    }

    /**
     * @param pluginIdentity  identity of the contributing plugin
     * @param datasourceStore persistence for disk outputs; null = files under the context's output directory
     */
    protected AbstractGisTool(PluginIdentity pluginIdentity, DatasourceStore datasourceStore) {
        this.pluginIdentity = Objects.requireNonNull(pluginIdentity, "pluginIdentity");
        this.datasourceStore = datasourceStore;
    }

    /** Declaration table of this tool's parameters, in slot order. Called once per instance. */
    protected abstract List<ParameterDeclaration> declareParameters();

    @Override
    public PluginIdentity getPluginIdentity() {
        return pluginIdentity;
    }

    @Override
    public final ParameterSet getParameters() {
        if (parameters == null) {
            parameters = ParameterDiscovery.discover(declareParameters());
        }
        return parameters;
    }

    /**
     * Binds the context, binds layer parameters to the live layers and takes the message and layer
     * services. Not idempotent: a second call rebinds everything.
     */
    @Override
    public void initialize(ToolContext context) {
        if (context == null) {
            throw new ToolConfigurationException("Tool " + getName() + " requires an application context");
        }
        if (context.getLayers() == null || context.getMessageService() == null || context.getLayerService() == null) {
            throw new ToolConfigurationException("Application context for tool " + getName() + " is incomplete");
        }
        this.context = context;

        for (LayerParameter layerParameter : getParameters().ofType(LayerParameter.class)) {
            layerParameter.initialize(context.getLayers());
        }

        this.messageService = context.getMessageService();
        this.layerService = context.getLayerService();
        DatasourceStore store = datasourceStore != null
                ? datasourceStore
                : new FileDatasourceStore(context.getConfig() != null ? context.getConfig() : GeoToolConfig.defaults());
        this.outputDispatcher = new OutputDispatcher(layerService, context.getLayers(), messageService, store);
        log.debug("Tool {} initialized with {} parameter(s)", getName(), getParameters().size());
    }

    public boolean isInitialized() {
        return context != null;
    }

    /**
     * Validates value and output-layer parameters in declaration order. Stops at the first invalid
     * parameter and shows its message; layer selections are not checked here.
     */
    @Override
    public boolean validate() {
        requireInitialized();
        for (ToolParameter p : getParameters()) {
            ValidationResult result = p.accept(GenericValidation.INSTANCE);
            if (!result.valid()) {
                messageService.info(result.message());
                return false;
            }
        }
        return true;
    }

    /**
     * Commits the produced datasource as described by {@code outputInfo}. Ownership of {@code datasource}
     * passes to this call.
     */
    protected final boolean handleOutput(Datasource datasource, OutputLayerInfo outputInfo) {
        requireInitialized();
        return outputDispatcher.handleOutput(datasource, outputInfo);
    }

    /**
     * The parameter of a declared slot.
     *
     * @throws ToolConfigurationException if the slot was not declared or could not be built
     */
    protected final <T extends ToolParameter> T parameter(String slotId, Class<T> type) {
        T p = getParameters().get(slotId, type);
        if (p == null) {
            throw new ToolConfigurationException("Tool " + getName() + " has no parameter " + slotId);
        }
        return p;
    }

    protected ToolContext getContext() {
        return context;
    }

    protected MessageService getMessageService() {
        return messageService;
    }

    protected LayerService getLayerService() {
        return layerService;
    }

    /** Settings from the context, or defaults before initialization. */
    protected GeoToolConfig getConfig() {
        GeoToolConfig config = context != null ? context.getConfig() : null;
        return config != null ? config : GeoToolConfig.defaults();
    }

    private void requireInitialized() {
        if (context == null) {
            throw new ToolConfigurationException("Tool " + getName() + " is not initialized");
        }
    }
}
