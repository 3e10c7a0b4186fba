package com.questrail.courier.codec;

import com.questrail.courier.model.Message;

/**
 * MessageFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for message frames; the exact inverse of
 * {@link MessageFrameDecoder}.
 */
public interface MessageFrameEncoder
{
    /**
     * Encode {@code message} into one complete, wire-ready frame.
     *
     * <p>The returned array is suitable for a single transport write. The same
     * message always yields the same bytes.</p>
     *
     * @throws com.questrail.courier.error.PayloadTooLargeException if a key,
     *         value or the whole body exceeds its length field
     */
    byte[] encode(Message message);
}
