package com.questrail.courier.error;

/**
 * Raised while constructing a message whose payload violates the model's
 * invariants (empty or duplicated key, text not representable in UTF-8).
 *
 * <p>Always recoverable by the caller. Never retried automatically.</p>
 */
public final class InvalidPayloadException extends MessagingException
{
    public InvalidPayloadException(String message) {
        super(message);
    }
}
