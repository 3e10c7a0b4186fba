package com.questrail.courier.error;

/**
 * Transport-level I/O failure (unreachable peer, reset, broken pipe).
 * A connection that raised this exception is always closed.
 */
public final class TransportException extends MessagingException
{
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
