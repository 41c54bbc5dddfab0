package com.cloud.emulator.manager;

/**
 * Pre-registers provider-default resources when a manager is built.
 */
@FunctionalInterface
public interface TopologySeed {

    void seed(ResourceManager manager);
}
