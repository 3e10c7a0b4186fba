package com.questrail.courier.error;

/**
 * Raised when a send or request is attempted on a connection that has
 * already reached {@code CLOSED}.
 */
public final class ConnectionClosedException extends MessagingException
{
    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
