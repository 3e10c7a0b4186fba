package com.questrail.courier.model;

import java.util.Optional;

/**
 * Payload variant of a {@link Message}.
 *
 * <p>Each kind carries the one-byte tag that identifies it on the wire. The
 * tag values are part of the interoperability contract and must never be
 * renumbered.</p>
 */
public enum MessageKind
{
    KEY_VALUE(0),
    RAW_STRING(1);

    private final int wireTag;

    MessageKind(int wireTag) {
        this.wireTag = wireTag;
    }

    public int wireTag() {
        return wireTag;
    }

    /**
     * Resolve a wire tag back to its kind.
     *
     * @param tag unsigned tag byte as read from the wire
     * @return the matching kind, or empty for an unknown tag
     */
    public static Optional<MessageKind> fromWireTag(int tag) {
        for (MessageKind kind : values()) {
            if (kind.wireTag == tag) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
