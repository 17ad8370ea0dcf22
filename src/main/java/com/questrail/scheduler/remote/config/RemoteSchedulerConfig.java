package com.questrail.scheduler.remote.config;

import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for a remote scheduler proxy.
 *
 * @param schedulerId  key under which the proxy is known in the scheduler directory
 * @param registryHost host of the RMI registry exporting the engine
 * @param registryPort port of that registry
 * @param bindName     name the engine is bound under in the registry
 */
public record RemoteSchedulerConfig(
    String schedulerId,
    String registryHost,
    int registryPort,
    String bindName
) {
    public static final String PROP_SCHEDULER_ID = "scheduler.remote.id";
    public static final String PROP_REGISTRY_HOST = "scheduler.remote.rmi.host";
    public static final String PROP_REGISTRY_PORT = "scheduler.remote.rmi.port";
    public static final String PROP_BIND_NAME = "scheduler.remote.rmi.bindName";

    public static final String DEFAULT_REGISTRY_HOST = "localhost";
    public static final int DEFAULT_REGISTRY_PORT = 1099;

    public RemoteSchedulerConfig {
        Objects.requireNonNull(schedulerId, "schedulerId");
        Objects.requireNonNull(registryHost, "registryHost");
        Objects.requireNonNull(bindName, "bindName");

        if (schedulerId.isBlank()) {
            throw new IllegalArgumentException("schedulerId must not be blank");
        }
        if (registryPort <= 0 || registryPort > 65535) {
            throw new IllegalArgumentException("registryPort must be in range 1-65535 (was " + registryPort + ")");
        }
    }

    /**
     * Reads a configuration from {@code properties}.
     * <p>
     * Only {@value #PROP_SCHEDULER_ID} is required. The bind name defaults to
     * the scheduler id.
     *
     * @throws IllegalArgumentException if a required key is missing or a value is malformed
     */
    public static RemoteSchedulerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        String id = trimmed(properties.getProperty(PROP_SCHEDULER_ID));
        if (id == null) {
            throw new IllegalArgumentException("Missing required property '" + PROP_SCHEDULER_ID + "'");
        }

        Builder builder = builder().withSchedulerId(id);

        String host = trimmed(properties.getProperty(PROP_REGISTRY_HOST));
        if (host != null) {
            builder.withRegistryHost(host);
        }

        String port = trimmed(properties.getProperty(PROP_REGISTRY_PORT));
        if (port != null) {
            try {
                builder.withRegistryPort(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Property '" + PROP_REGISTRY_PORT + "' is not a number: '" + port + "'", e);
            }
        }

        String bindName = trimmed(properties.getProperty(PROP_BIND_NAME));
        if (bindName != null) {
            builder.withBindName(bindName);
        }

        return builder.build();
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String schedulerId;
        private String registryHost = DEFAULT_REGISTRY_HOST;
        private int registryPort = DEFAULT_REGISTRY_PORT;
        private String bindName;

        public Builder withSchedulerId(String schedulerId) {
            this.schedulerId = schedulerId;
            return this;
        }

        public Builder withRegistryHost(String registryHost) {
            this.registryHost = registryHost;
            return this;
        }

        public Builder withRegistryPort(int registryPort) {
            this.registryPort = registryPort;
            return this;
        }

        public Builder withBindName(String bindName) {
            this.bindName = bindName;
            return this;
        }

        public RemoteSchedulerConfig build() {
            return new RemoteSchedulerConfig(
                    schedulerId,
                    registryHost,
                    registryPort,
                    bindName != null ? bindName : schedulerId);
        }
    }
}
