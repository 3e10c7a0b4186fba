package com.questrail.courier.connection;

/**
 * Which side initiated a connection.
 */
public enum Direction
{
    /** Accepted by a listener. */
    INBOUND,

    /** Opened by {@code connect}. */
    OUTBOUND
}
