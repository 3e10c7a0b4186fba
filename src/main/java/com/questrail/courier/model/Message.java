package com.questrail.courier.model;

import java.util.List;
import java.util.Map;

/**
 * Canonical in-memory representation of a unit of transfer.
 *
 * <h2>Variants</h2>
 * <p>
 * A message is either a {@link KeyValueMessage} (string keys to string values)
 * or a {@link RawStringMessage} (one opaque string, typically JSON or XML
 * document content). The payload type is fully determined by {@link #kind()};
 * the sealed hierarchy makes a message that mixes variants unrepresentable.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * Messages are immutable values. A sender constructs one immediately before
 * encoding it and a receiver reconstructs one immediately after decoding. The
 * messaging core never caches or persists them.
 * </p>
 *
 * <p>
 * Wire concerns (tags, length prefixes, text encoding) are resolved by the
 * codec layer and never surface here.
 * </p>
 */
public sealed interface Message
        permits KeyValueMessage, RawStringMessage {

    /**
     * @return the payload variant of this message
     */
    MessageKind kind();

    /**
     * Construct a KEY_VALUE message from a mapping.
     *
     * @throws com.questrail.courier.error.InvalidPayloadException if a key is empty
     *         or a key/value is not representable in UTF-8
     */
    static KeyValueMessage newKeyValueMessage(Map<String, String> pairs) {
        return KeyValueMessage.of(pairs);
    }

    /**
     * Construct a KEY_VALUE message from an ordered list of pairs.
     *
     * @throws com.questrail.courier.error.InvalidPayloadException if a key is empty,
     *         appears more than once, or is not representable in UTF-8
     */
    static KeyValueMessage newKeyValueMessage(List<Map.Entry<String, String>> pairs) {
        return KeyValueMessage.of(pairs);
    }

    /**
     * Construct a RAW_STRING message.
     *
     * @throws com.questrail.courier.error.InvalidPayloadException if the text is not
     *         representable in UTF-8
     */
    static RawStringMessage newRawMessage(String text) {
        return new RawStringMessage(text);
    }
}
