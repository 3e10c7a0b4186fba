package com.questrail.courier.error;

/**
 * Raised at encode time when a message does not fit the wire format's length
 * fields. The connection the caller tried to send on remains usable.
 */
public final class PayloadTooLargeException extends MessagingException
{
    private final long actualLength;
    private final long maximumLength;

    public PayloadTooLargeException(String what, long actualLength, long maximumLength) {
        super(what + " is " + actualLength + " bytes, maximum is " + maximumLength);
        this.actualLength = actualLength;
        this.maximumLength = maximumLength;
    }

    public long actualLength() {
        return actualLength;
    }

    public long maximumLength() {
        return maximumLength;
    }
}
