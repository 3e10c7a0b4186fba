package com.questrail.courier.error;

import java.util.Objects;

/**
 * Raised while decoding a frame that violates the wire format.
 *
 * <p>A connection that produced a protocol error is unsalvageable: framing
 * is ambiguous from that point on, so the connection is closed rather than
 * resynchronised.</p>
 */
public final class ProtocolException extends MessagingException
{
    public enum Reason
    {
        /** Kind tag is neither 0 (KEY_VALUE) nor 1 (RAW_STRING). */
        UNKNOWN_KIND,

        /** Truncated frame, leftover bytes, invalid text or an illegal key/value body. */
        MALFORMED
    }

    private final Reason reason;

    public ProtocolException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ProtocolException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
