package com.questrail.courier.error;

/**
 * Raised when a configured read timeout elapses while a connection waits for
 * a frame, or when a request does not receive its reply in time.
 */
public final class ReadTimeoutException extends MessagingException
{
    public ReadTimeoutException(String message) {
        super(message);
    }

    public ReadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
