package com.questrail.courier.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named services a client can connect to.
 * Maps service names to the {@link EndpointConfig} they listen on.
 */
public final class ServiceRegistry {
    private static final ServiceRegistry EMPTY = new ServiceRegistry(Map.of());

    private final Map<String, EndpointConfig> services;

    private ServiceRegistry(Map<String, EndpointConfig> services) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public static ServiceRegistry empty() {
        return EMPTY;
    }

    public boolean isRegistered(String serviceName) {
        return services.containsKey(serviceName);
    }

    /**
     * Resolves a service name to its endpoint configuration.
     * @throws IllegalArgumentException if the service is unknown
     */
    public EndpointConfig resolve(String serviceName) {
        EndpointConfig config = services.get(serviceName);
        if (config == null) {
            throw new IllegalArgumentException("Unknown service: " + serviceName);
        }
        return config;
    }

    /**
     * Returns the names of all registered services, in registration order.
     */
    public Set<String> serviceNames() {
        return services.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, EndpointConfig> services = new LinkedHashMap<>();

        public Builder addService(String serviceName, EndpointConfig config) {
            Objects.requireNonNull(serviceName, "serviceName");
            Objects.requireNonNull(config, "config");
            if (serviceName.isBlank()) {
                throw new IllegalArgumentException("Service name must not be blank");
            }
            services.put(serviceName, config.requireConnectable());
            return this;
        }

        public Builder addService(String serviceName, String host, int port) {
            return addService(serviceName, EndpointConfig.of(host, port));
        }

        public ServiceRegistry build() {
            if (services.isEmpty()) {
                throw new IllegalStateException("At least one service required");
            }
            return new ServiceRegistry(services);
        }
    }
}
