package com.questrail.courier.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the messaging stack that does
 * not surface to a caller directly (accept failures, callback failures).
 */
public record MessagingErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
    public static MessagingErrorEvent of(String message, Throwable cause) {
        return new MessagingErrorEvent(Instant.now(), message, cause);
    }
}
