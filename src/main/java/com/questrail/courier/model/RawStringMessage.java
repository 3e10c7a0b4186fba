package com.questrail.courier.model;

import com.questrail.courier.error.InvalidPayloadException;

/**
 * RAW_STRING message: a single opaque string.
 *
 * <p>The text travels as UTF-8. An empty string is a valid payload; a string
 * containing unpaired surrogates is not, because it cannot be encoded.</p>
 *
 * @param text the payload, never {@code null}
 */
public record RawStringMessage(String text) implements Message
{
    public RawStringMessage {
        if (text == null) {
            throw new InvalidPayloadException("text must not be null");
        }
        if (!Utf8Text.isEncodable(text)) {
            throw new InvalidPayloadException("text contains an unpaired surrogate and is not representable in UTF-8");
        }
    }

    @Override
    public MessageKind kind() {
        return MessageKind.RAW_STRING;
    }
}
