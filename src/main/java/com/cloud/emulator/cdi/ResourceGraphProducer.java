package com.cloud.emulator.cdi;

import com.cloud.emulator.manager.ResourceManager;
import com.cloud.emulator.manager.ResourceManagerConfig;
import com.cloud.emulator.manager.ResourceManagers;
import com.cloud.emulator.metrics.GraphMetrics;
import com.cloud.emulator.metrics.MicrometerGraphMetrics;
import com.cloud.emulator.metrics.NoOpGraphMetrics;
import com.cloud.emulator.service.ec2.NetworkService;
import com.cloud.emulator.service.iam.IamService;
import com.cloud.emulator.state.InMemoryStateStore;
import com.cloud.emulator.state.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the resource graph and the emulated services from
 * MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * resource-graph:
 *   enabled: true
 *   strict-validation: false
 *   detect-cycles: true
 *   use-provider-schema: true
 *   seed-default-network: true
 * </pre>
 *
 * <p>With {@code enabled: false} the services get a no-op manager and run without
 * dependency tracking. A {@link MeterRegistry} bean, when present, receives the graph
 * counters.</p>
 */
@ApplicationScoped
public class ResourceGraphProducer {

    private static final Logger log = LoggerFactory.getLogger(ResourceGraphProducer.class);

    @Inject
    @ConfigProperty(name = "resource-graph.enabled", defaultValue = "true")
    boolean enabled;

    @Inject
    @ConfigProperty(name = "resource-graph.strict-validation", defaultValue = "false")
    boolean strictValidation;

    @Inject
    @ConfigProperty(name = "resource-graph.detect-cycles", defaultValue = "true")
    boolean detectCycles;

    @Inject
    @ConfigProperty(name = "resource-graph.use-provider-schema", defaultValue = "true")
    boolean useProviderSchema;

    @Inject
    @ConfigProperty(name = "resource-graph.seed-default-network", defaultValue = "true")
    boolean seedDefaultNetwork;

    @Produces
    @ApplicationScoped
    public ResourceManagerConfig resourceManagerConfig() {
        return new ResourceManagerConfig(strictValidation, detectCycles, useProviderSchema);
    }

    @Produces
    @ApplicationScoped
    public GraphMetrics graphMetrics(Instance<MeterRegistry> registries) {
        if (registries.isResolvable()) {
            log.info("Graph metrics published to Micrometer");
            return new MicrometerGraphMetrics(registries.get());
        }
        return new NoOpGraphMetrics();
    }

    @Produces
    @ApplicationScoped
    public ResourceManager resourceManager(ResourceManagerConfig config, GraphMetrics metrics) {
        if (!enabled) {
            log.info("Resource graph disabled, dependency tracking is off");
            return ResourceManagers.disabled();
        }
        log.info("Producing ResourceManager: strict={} detectCycles={} providerSchema={} seedDefaultNetwork={}",
                config.strictValidation(), config.detectCycles(), config.useProviderSchema(), seedDefaultNetwork);
        return seedDefaultNetwork
                ? ResourceManagers.forNetworkService(config, metrics)
                : ResourceManagers.create(config, metrics);
    }

    @Produces
    @ApplicationScoped
    public StateStore stateStore() {
        return new InMemoryStateStore();
    }

    @Produces
    @ApplicationScoped
    public IamService iamService(StateStore state, ResourceManager resources) {
        return new IamService(state, resources);
    }

    @Produces
    @ApplicationScoped
    public NetworkService networkService(StateStore state, ResourceManager resources) {
        return new NetworkService(state, resources);
    }
}
