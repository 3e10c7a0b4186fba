package com.questrail.courier.codec;

import com.questrail.courier.model.Message;
import com.questrail.courier.transport.StreamSource;

import java.io.IOException;
import java.util.Optional;

/**
 * MessageFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for message frames.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Accumulating a complete frame across partial reads</li>
 *   <li>Validating frame structure and text encoding</li>
 *   <li>Constructing a {@link Message} on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for dispatching,
 * closing the stream, or recovering from a bad frame.</p>
 */
public interface MessageFrameDecoder
{
    /**
     * Read exactly one frame from {@code source}, blocking until it is
     * complete.
     *
     * @return the decoded message, or {@link Optional#empty()} if the stream
     *         ended cleanly before a complete header arrived
     * @throws com.questrail.courier.error.ProtocolException if the frame is invalid
     * @throws IOException on transport failure, including a read timeout
     *         ({@link java.net.SocketTimeoutException})
     */
    Optional<Message> decode(StreamSource source) throws IOException;

    /**
     * Decode a complete frame held in memory. The array must contain exactly
     * one frame, header included, with no trailing bytes.
     *
     * @throws com.questrail.courier.error.ProtocolException if the frame is invalid
     */
    Message decode(byte[] frame);
}
