package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

import java.util.Locale;

/**
 * How chat servers publish themselves in Redis.
 */
public enum RegistryMode {
    /**
     * One sorted set; member is the address, score the unix-second heartbeat.
     */
    SORTED_SET("sorted-set"),
    /**
     * One key per server under a common prefix, expiry handled by the key TTL.
     */
    KEY_PATTERN("key-pattern");

    private final String configName;

    RegistryMode(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a mode from its configuration name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static RegistryMode fromConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RegistryMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown registry mode: " + name);
    }
}
