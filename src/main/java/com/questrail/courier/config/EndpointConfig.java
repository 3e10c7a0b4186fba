package com.questrail.courier.config;

import com.questrail.courier.model.Endpoint;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection parameters for one endpoint.
 *
 * <p>Supplied by the caller, already parsed; the messaging core only reads
 * them. Port 0 requests an ephemeral port and is accepted only when
 * listening. An absent read timeout means a connection blocks indefinitely
 * while waiting for the next frame.</p>
 *
 * @param host        bind or connect address
 * @param port        0-65535
 * @param readTimeout optional per-read timeout, positive when present
 */
public record EndpointConfig(
    String host,
    int port,
    Optional<Duration> readTimeout
) {
    public EndpointConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(readTimeout, "readTimeout");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535: " + port);
        }
        readTimeout.ifPresent(t -> {
            if (t.isZero() || t.isNegative()) {
                throw new IllegalArgumentException("readTimeout must be positive: " + t);
            }
        });
    }

    public static EndpointConfig of(String host, int port) {
        return new EndpointConfig(host, port, Optional.empty());
    }

    public Endpoint endpoint() {
        return new Endpoint(host, port);
    }

    /**
     * Read timeout in whole milliseconds, as socket APIs expect it.
     * Zero means no timeout.
     */
    public int readTimeoutMillis() {
        return readTimeout.map(t -> (int) Math.min(Integer.MAX_VALUE, Math.max(1, t.toMillis()))).orElse(0);
    }

    /**
     * @throws IllegalArgumentException if this configuration cannot be used to
     *         open an outbound connection (port 0)
     */
    public EndpointConfig requireConnectable() {
        if (port == 0) {
            throw new IllegalArgumentException("port must be 1-65535 to connect: " + port);
        }
        return this;
    }

    public EndpointConfig withReadTimeout(Duration timeout) {
        return new EndpointConfig(host, port, Optional.of(timeout));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private Integer port;
        private Duration readTimeout;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withReadTimeoutMillis(long readTimeoutMs) {
            this.readTimeout = Duration.ofMillis(readTimeoutMs);
            return this;
        }

        public EndpointConfig build() {
            if (port == null) {
                throw new IllegalStateException("port is required");
            }
            return new EndpointConfig(host, port, Optional.ofNullable(readTimeout));
        }
    }
}
