package com.questrail.courier.codec.impl;

import com.questrail.courier.error.ProtocolException;
import com.questrail.courier.model.MessageKind;
import com.questrail.courier.transport.StreamSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * MessageFraming
 * -----------------------------------------------------------------------------
 * Wire constants and the small helpers shared by
 * {@link DefaultMessageFrameEncoder} and {@link DefaultMessageFrameDecoder}.
 */
final class MessageFraming
{
    /** Kind tag (1 byte) plus body length (4 bytes). */
    static final int HEADER_LENGTH = 5;

    /** Width of each key and value length prefix inside a KEY_VALUE body. */
    static final int ENTRY_LENGTH_FIELD = 2;

    /** Largest key or value that fits the 16-bit length prefix. */
    static final int MAX_ENTRY_FIELD_LENGTH = 0xFFFF;

    /** Largest body the unsigned 32-bit length field can describe. */
    static final long MAX_WIRE_BODY_LENGTH = 0xFFFF_FFFFL;

    /** Largest body that still fits a Java array together with its header. */
    static final int MAX_IN_MEMORY_BODY_LENGTH = Integer.MAX_VALUE - 8 - HEADER_LENGTH;

    private MessageFraming() {}

    static MessageKind kindOf(byte tag)
    {
        final int unsigned = tag & 0xFF;
        return MessageKind.fromWireTag(unsigned)
                .orElseThrow(() -> new ProtocolException(
                        ProtocolException.Reason.UNKNOWN_KIND, "unknown kind tag " + unsigned));
    }

    static long bodyLength(byte[] header)
    {
        return ((header[1] & 0xFFL) << 24)
                | ((header[2] & 0xFFL) << 16)
                | ((header[3] & 0xFFL) << 8)
                | (header[4] & 0xFFL);
    }

    /**
     * Read until {@code length} bytes arrived or the stream ended.
     *
     * @return number of bytes read; less than {@code length} only at end of stream
     */
    static int readFully(StreamSource source, byte[] buffer, int offset, int length)
            throws IOException
    {
        int total = 0;
        while (total < length) {
            int n = source.read(buffer, offset + total, length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    /**
     * Strict UTF-8 decode. {@link String#String(byte[], java.nio.charset.Charset)}
     * would substitute U+FFFD for bad input, which would silently alter the payload.
     */
    static String decodeUtf8(ByteBuffer bytes, String what)
    {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(bytes)
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, what + " is not valid UTF-8", e);
        }
    }

    static ProtocolException malformed(String message)
    {
        return new ProtocolException(ProtocolException.Reason.MALFORMED, message);
    }
}
