package org.twinsql.db;

import java.util.List;

/**
 * Snapshot of what a {@link ClientRegistry} holds, by identity key.
 */
public record RegistryInfo(List<String> instances, List<String> pools, int instanceCount, int poolCount) {

    public RegistryInfo {
        instances = List.copyOf(instances);
        pools = List.copyOf(pools);
    }
}
