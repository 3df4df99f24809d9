package com.javacpi.provider;

import com.javacpi.exec.PowerShellExecutor;
import com.javacpi.exec.ToolExecutor;
import com.javacpi.exec.ToolWarmUp;
import com.javacpi.observability.MetricsConfig;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ActionName;
import com.javacpi.shared.config.ProviderConfig;
import com.javacpi.shared.model.ActionResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class HyperVProvider implements CpiProvider {

    // one warm-up per process, however many providers are built
    private static final ToolWarmUp WARM_UP = new ToolWarmUp();

    private final ProviderConfig config;
    private final ActionDispatcher dispatcher;

    public HyperVProvider(ProviderConfig config, ToolExecutor executor, MetricsConfig metrics) {
        this.config = config;
        this.dispatcher = new ActionDispatcher(
                HyperVActions.catalog(config.defaults()), executor, config.lookupFailurePolicy(), metrics);
    }

    public static HyperVProvider create(ProviderConfig config, MetricsConfig metrics) {
        var executor = new PowerShellExecutor(config.executor());
        if (config.executor().warmUp()) {
            WARM_UP.runOnce(executor);
        }
        return new HyperVProvider(config, executor, metrics);
    }

    @Override public String name() { return "hyperv"; }

    @Override public String providerType() { return "command"; }

    @Override public Map<String, Object> defaultSettings() { return config.defaults(); }

    @Override
    public List<ActionName> listActions() {
        return dispatcher.listActions();
    }

    @Override
    public Optional<ActionDefinition> describeAction(String action) {
        return dispatcher.describeAction(action);
    }

    @Override
    public ActionResult execute(String action, Map<String, ?> parameters) {
        return dispatcher.execute(action, parameters);
    }

    public ActionDispatcher dispatcher() { return dispatcher; }
}
