package dev.station.cli;

import dev.station.engine.StepRegistry;

import java.util.ServiceLoader;

/**
 * Contributes step definitions to a station's registry. Implementations are
 * listed in {@code META-INF/services/dev.station.cli.StepCatalog}.
 */
public interface StepCatalog {

    void register(StepRegistry registry);

    /**
     * Build a registry from every catalog on the class path.
     */
    static StepRegistry loadRegistry() {
        var registry = new StepRegistry();
        for (StepCatalog catalog : ServiceLoader.load(StepCatalog.class)) {
            catalog.register(registry);
        }
        return registry;
    }
}
