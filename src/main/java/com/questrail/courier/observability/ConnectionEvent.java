package com.questrail.courier.observability;

import com.questrail.courier.connection.Direction;
import com.questrail.courier.model.Endpoint;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record representing a connection or listener lifecycle transition.
 */
public record ConnectionEvent(
    Instant timestamp,
    Type type,
    Direction direction,
    Endpoint local,
    Endpoint remote,
    Optional<Throwable> cause
) {
    public enum Type {
        LISTENER_STARTED,
        LISTENER_STOPPED,
        CONNECTION_OPENED,
        CONNECTION_CLOSED
    }

    public ConnectionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cause, "cause");
    }

    public static ConnectionEvent listenerStarted(Endpoint local) {
        return new ConnectionEvent(Instant.now(), Type.LISTENER_STARTED, Direction.INBOUND, local, null, Optional.empty());
    }

    public static ConnectionEvent listenerStopped(Endpoint local) {
        return new ConnectionEvent(Instant.now(), Type.LISTENER_STOPPED, Direction.INBOUND, local, null, Optional.empty());
    }

    public static ConnectionEvent opened(Direction direction, Endpoint local, Endpoint remote) {
        return new ConnectionEvent(Instant.now(), Type.CONNECTION_OPENED, direction, local, remote, Optional.empty());
    }

    public static ConnectionEvent closed(Direction direction, Endpoint local, Endpoint remote, Throwable cause) {
        return new ConnectionEvent(Instant.now(), Type.CONNECTION_CLOSED, direction, local, remote, Optional.ofNullable(cause));
    }
}
