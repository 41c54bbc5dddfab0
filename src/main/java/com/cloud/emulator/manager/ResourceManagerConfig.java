package com.cloud.emulator.manager;

/**
 * Construction-time configuration of a {@link ResourceManager}.
 *
 * @param strictValidation  consistency policy read by callers through {@link ResourceManager#isStrictMode()};
 *                          when true, relationship bookkeeping failures abort and roll back the caller's operation
 * @param detectCycles      reject relationships that would close a directed cycle
 * @param useProviderSchema only accept relationships listed in {@link com.cloud.emulator.schema.ProviderSchema}
 */
public record ResourceManagerConfig(boolean strictValidation, boolean detectCycles, boolean useProviderSchema) {

    /**
     * Default configuration: permissive, cycle detection on, provider schema on.
     */
    public static ResourceManagerConfig defaults() {
        return new ResourceManagerConfig(false, true, true);
    }

    /**
     * Strict configuration: relationship failures abort the caller's operation.
     */
    public static ResourceManagerConfig strict() {
        return new ResourceManagerConfig(true, true, true);
    }

    public ResourceManagerConfig withStrictValidation(boolean strictValidation) {
        return new ResourceManagerConfig(strictValidation, detectCycles, useProviderSchema);
    }
}
