package com.questrail.courier.codec.impl;

import com.questrail.courier.codec.MessageFrameDecoder;
import com.questrail.courier.error.InvalidPayloadException;
import com.questrail.courier.error.ProtocolException;
import com.questrail.courier.model.KeyValueMessage;
import com.questrail.courier.model.Message;
import com.questrail.courier.model.MessageKind;
import com.questrail.courier.model.RawStringMessage;
import com.questrail.courier.transport.StreamSource;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultMessageFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header: read exactly 5 bytes; end of stream here is a clean disconnect</li>
 *   <li>Kind tag validation, before any body byte is consumed</li>
 *   <li>Length validation against the configured body limit</li>
 *   <li>Body: read exactly {@code length} bytes; end of stream here is truncation</li>
 *   <li>Structural parse of the body into a {@link Message}</li>
 * </ol>
 *
 * <p>The body limit exists because a Java array cannot hold the full
 * 2<sup>32</sup>&minus;1 range of the length field, and a peer should not be
 * able to force a large allocation with a single header.</p>
 */
public final class DefaultMessageFrameDecoder implements MessageFrameDecoder
{
    public static final int DEFAULT_MAX_BODY_LENGTH = 16 * 1024 * 1024;

    private final int maxBodyLength;

    public DefaultMessageFrameDecoder()
    {
        this(DEFAULT_MAX_BODY_LENGTH);
    }

    public DefaultMessageFrameDecoder(int maxBodyLength)
    {
        if (maxBodyLength < 0 || maxBodyLength > MessageFraming.MAX_IN_MEMORY_BODY_LENGTH) {
            throw new IllegalArgumentException("maxBodyLength out of range: " + maxBodyLength);
        }
        this.maxBodyLength = maxBodyLength;
    }

    public int maxBodyLength()
    {
        return maxBodyLength;
    }

    @Override
    public Optional<Message> decode(StreamSource source) throws IOException
    {
        Objects.requireNonNull(source, "source");

        final byte[] header = new byte[MessageFraming.HEADER_LENGTH];
        if (MessageFraming.readFully(source, header, 0, header.length) < header.length) {
            return Optional.empty();
        }

        final MessageKind kind = MessageFraming.kindOf(header[0]);
        final int length = checkBodyLength(MessageFraming.bodyLength(header));

        final byte[] body = new byte[length];
        final int read = MessageFraming.readFully(source, body, 0, length);
        if (read < length) {
            throw MessageFraming.malformed("stream ended after " + read + " of " + length + " body bytes");
        }

        return Optional.of(decodeBody(kind, body));
    }

    @Override
    public Message decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.length < MessageFraming.HEADER_LENGTH) {
            throw MessageFraming.malformed("frame shorter than header: " + frame.length + " bytes");
        }

        final MessageKind kind = MessageFraming.kindOf(frame[0]);
        final long declared = MessageFraming.bodyLength(frame);
        final long available = frame.length - MessageFraming.HEADER_LENGTH;

        if (declared > available) {
            throw MessageFraming.malformed("declared body length " + declared + " exceeds available " + available);
        }
        if (declared < available) {
            throw MessageFraming.malformed((available - declared) + " trailing bytes after body");
        }
        checkBodyLength(declared);

        return decodeBody(kind, Arrays.copyOfRange(frame, MessageFraming.HEADER_LENGTH, frame.length));
    }

    private int checkBodyLength(long length)
    {
        if (length > maxBodyLength) {
            throw MessageFraming.malformed("declared body length " + length + " exceeds limit " + maxBodyLength);
        }
        return (int) length;
    }

    private static Message decodeBody(MessageKind kind, byte[] body)
    {
        switch (kind) {
            case RAW_STRING:
                return decodeRaw(body);
            case KEY_VALUE:
                return decodeKeyValues(body);
            default:
                throw new ProtocolException(ProtocolException.Reason.UNKNOWN_KIND, "unhandled kind " + kind);
        }
    }

    private static RawStringMessage decodeRaw(byte[] body)
    {
        String text = MessageFraming.decodeUtf8(ByteBuffer.wrap(body), "text body");
        return new RawStringMessage(text);
    }

    private static KeyValueMessage decodeKeyValues(byte[] body)
    {
        final ByteBuf buf = Unpooled.wrappedBuffer(body);
        final KeyValueMessage.Builder builder = KeyValueMessage.builder();

        try {
            while (buf.isReadable()) {
                String key = readField(buf, "key");
                String value = readField(buf, "value for key '" + key + "'");
                builder.put(key, value);
            }
            return builder.build();
        }
        catch (InvalidPayloadException e) {
            // Empty or duplicate key on the wire.
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, e.getMessage(), e);
        }
        finally {
            buf.release();
        }
    }

    private static String readField(ByteBuf buf, String what)
    {
        if (buf.readableBytes() < MessageFraming.ENTRY_LENGTH_FIELD) {
            throw MessageFraming.malformed("truncated length prefix of " + what);
        }
        final int length = buf.readUnsignedShort();
        if (buf.readableBytes() < length) {
            throw MessageFraming.malformed(what + " declares " + length + " bytes, " + buf.readableBytes() + " remain");
        }
        String s = MessageFraming.decodeUtf8(buf.nioBuffer(buf.readerIndex(), length), what);
        buf.skipBytes(length);
        return s;
    }
}
