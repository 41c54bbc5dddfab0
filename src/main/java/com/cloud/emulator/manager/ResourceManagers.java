package com.cloud.emulator.manager;

import com.cloud.emulator.metrics.GraphMetrics;

/**
 * Factory methods for the resource managers handed to emulated services.
 */
public final class ResourceManagers {

    private ResourceManagers() {
    }

    /**
     * Manager for services without provider-default resources, such as the identity service.
     */
    public static ResourceManager create(ResourceManagerConfig config) {
        return GraphResourceManager.builder().config(config).build();
    }

    public static ResourceManager create(ResourceManagerConfig config, GraphMetrics metrics) {
        return GraphResourceManager.builder().config(config).metrics(metrics).build();
    }

    /**
     * Manager for network/compute services, pre-seeded with the default network topology.
     */
    public static ResourceManager forNetworkService(ResourceManagerConfig config) {
        return forNetworkService(config, null);
    }

    public static ResourceManager forNetworkService(ResourceManagerConfig config, GraphMetrics metrics) {
        GraphResourceManager.Builder builder = GraphResourceManager.builder()
                .config(config)
                .seed(new DefaultNetworkTopology());
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    /**
     * Manager for services built without dependency tracking.
     */
    public static ResourceManager disabled() {
        return new NoOpResourceManager();
    }
}
