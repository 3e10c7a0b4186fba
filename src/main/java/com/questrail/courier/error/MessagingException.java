package com.questrail.courier.error;

/**
 * Root of the messaging error taxonomy.
 *
 * <p>Every failure raised by the messaging core is unchecked and extends this
 * type, so callers that do not care about the specific category can catch a
 * single exception. Transport {@link java.io.IOException}s never escape the
 * core directly; they are translated into {@link TransportException} or
 * {@link ReadTimeoutException} at the connection boundary.</p>
 */
public abstract class MessagingException extends RuntimeException
{
    protected MessagingException(String message) {
        super(message);
    }

    protected MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
