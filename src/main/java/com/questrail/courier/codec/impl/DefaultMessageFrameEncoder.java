package com.questrail.courier.codec.impl;

import com.questrail.courier.codec.MessageFrameEncoder;
import com.questrail.courier.error.PayloadTooLargeException;
import com.questrail.courier.model.KeyValueMessage;
import com.questrail.courier.model.Message;
import com.questrail.courier.model.RawStringMessage;
import com.questrail.courier.model.Utf8Text;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultMessageFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link MessageFrameEncoder}.
 *
 * <p>All length checks run before the first byte is written, so a message
 * that is too large fails without side effects and the caller's connection
 * stays usable.</p>
 */
public final class DefaultMessageFrameEncoder implements MessageFrameEncoder
{
    private final long maxBodyLength;

    public DefaultMessageFrameEncoder()
    {
        this(MessageFraming.MAX_IN_MEMORY_BODY_LENGTH);
    }

    /**
     * @param maxBodyLength largest body this encoder will produce; at most
     *                      {@code Integer.MAX_VALUE - 13}
     */
    public DefaultMessageFrameEncoder(long maxBodyLength)
    {
        if (maxBodyLength < 0 || maxBodyLength > MessageFraming.MAX_IN_MEMORY_BODY_LENGTH) {
            throw new IllegalArgumentException("maxBodyLength out of range: " + maxBodyLength);
        }
        this.maxBodyLength = maxBodyLength;
    }

    @Override
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");

        if (message instanceof RawStringMessage raw) {
            return encodeRaw(raw);
        }
        else if (message instanceof KeyValueMessage kv) {
            return encodeKeyValues(kv);
        }
        throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
    }

    private byte[] encodeRaw(RawStringMessage message)
    {
        // Size check before allocating the encoded copy.
        checkBodyLength(Utf8Text.encodedLength(message.text()));
        final byte[] text = message.text().getBytes(StandardCharsets.UTF_8);

        ByteBuf buf = Unpooled.buffer(MessageFraming.HEADER_LENGTH + text.length);
        try {
            buf.writeByte(message.kind().wireTag());
            buf.writeInt(text.length);
            buf.writeBytes(text);
            return ByteBufUtil.getBytes(buf);
        }
        finally {
            buf.release();
        }
    }

    private byte[] encodeKeyValues(KeyValueMessage message)
    {
        // Encode every key/value once up front so the size check is exact.
        List<byte[]> fields = new ArrayList<>(message.size() * 2);
        long bodyLength = 0;

        for (Map.Entry<String, String> e : message.entries().entrySet()) {
            checkFieldLength("key '" + abbreviate(e.getKey()) + "'", Utf8Text.encodedLength(e.getKey()));
            checkFieldLength("value for key '" + abbreviate(e.getKey()) + "'", Utf8Text.encodedLength(e.getValue()));

            byte[] key = e.getKey().getBytes(StandardCharsets.UTF_8);
            byte[] value = e.getValue().getBytes(StandardCharsets.UTF_8);

            fields.add(key);
            fields.add(value);
            bodyLength += 2L * MessageFraming.ENTRY_LENGTH_FIELD + key.length + value.length;
        }
        checkBodyLength(bodyLength);

        ByteBuf buf = Unpooled.buffer((int) (MessageFraming.HEADER_LENGTH + bodyLength));
        try {
            buf.writeByte(message.kind().wireTag());
            buf.writeInt((int) bodyLength);
            for (byte[] field : fields) {
                buf.writeShort(field.length);
                buf.writeBytes(field);
            }
            return ByteBufUtil.getBytes(buf);
        }
        finally {
            buf.release();
        }
    }

    private static void checkFieldLength(String what, long length)
    {
        if (length > MessageFraming.MAX_ENTRY_FIELD_LENGTH) {
            throw new PayloadTooLargeException(what, length, MessageFraming.MAX_ENTRY_FIELD_LENGTH);
        }
    }

    private void checkBodyLength(long length)
    {
        if (length > MessageFraming.MAX_WIRE_BODY_LENGTH) {
            throw new PayloadTooLargeException("message body", length, MessageFraming.MAX_WIRE_BODY_LENGTH);
        }
        if (length > maxBodyLength) {
            throw new PayloadTooLargeException("message body", length, maxBodyLength);
        }
    }

    private static String abbreviate(String s)
    {
        return s.length() <= 32 ? s : s.substring(0, 32) + "...";
    }
}
