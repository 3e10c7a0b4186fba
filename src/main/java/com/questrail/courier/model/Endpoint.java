package com.questrail.courier.model;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * One side of a connection, identified by host and port.
 *
 * @param host host name or literal address
 * @param port port number, 0-65535
 */
public record Endpoint(String host, int port)
{
    public Endpoint {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535: " + port);
        }
    }

    /**
     * Convert a socket address reported by a transport. Unresolved addresses
     * keep their host string; resolved ones use the literal IP address.
     */
    public static Endpoint of(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            String host = inet.isUnresolved() || inet.getAddress() == null
                    ? inet.getHostString()
                    : inet.getAddress().getHostAddress();
            return new Endpoint(host, inet.getPort());
        }
        throw new IllegalArgumentException("Unsupported socket address: " + address);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
