package com.questrail.courier.model;

import com.questrail.courier.error.InvalidPayloadException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * KEY_VALUE message: a mapping of string keys to string values.
 *
 * <h2>Key rules</h2>
 * <ul>
 *   <li>Keys must be non-empty.</li>
 *   <li>Keys must be unique. A duplicate key is a construction error; there is
 *       no last-write-wins.</li>
 *   <li>Keys and values must be representable in UTF-8. Empty values are fine.</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Insertion order is kept so that encoding is deterministic, but it carries
 * no meaning: {@link #equals(Object)} compares the pair sets and ignores order,
 * and receivers must not rely on the order keys arrive in.</p>
 *
 * @param entries unmodifiable, insertion-ordered view of the pairs
 */
public record KeyValueMessage(Map<String, String> entries) implements Message
{
    /**
     * Conventional key naming the operation a request asks for. The framing
     * has no header map, so a request name travels as an ordinary entry.
     */
    public static final String REQUEST_NAME_KEY = "request";

    public KeyValueMessage {
        if (entries == null) {
            throw new InvalidPayloadException("entries must not be null");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : entries.entrySet()) {
            validate(e.getKey(), e.getValue());
            copy.put(e.getKey(), e.getValue());
        }
        entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.KEY_VALUE;
    }

    public int size() {
        return entries.size();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * @return the value for {@code key}, or {@code null} if absent
     */
    public String get(String key) {
        return entries.get(key);
    }

    public Optional<String> requestName() {
        return Optional.ofNullable(entries.get(REQUEST_NAME_KEY));
    }

    public static KeyValueMessage of(Map<String, String> pairs) {
        return new KeyValueMessage(pairs);
    }

    public static KeyValueMessage of(List<Map.Entry<String, String>> pairs) {
        if (pairs == null) {
            throw new InvalidPayloadException("pairs must not be null");
        }
        Builder b = builder();
        for (Map.Entry<String, String> e : pairs) {
            if (e == null) {
                throw new InvalidPayloadException("pair must not be null");
            }
            b.put(e.getKey(), e.getValue());
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void validate(String key, String value) {
        if (key == null || value == null) {
            throw new InvalidPayloadException("keys and values must not be null");
        }
        if (key.isEmpty()) {
            throw new InvalidPayloadException("key must not be empty");
        }
        if (!Utf8Text.isEncodable(key)) {
            throw new InvalidPayloadException("key is not representable in UTF-8");
        }
        if (!Utf8Text.isEncodable(value)) {
            throw new InvalidPayloadException("value for key '" + key + "' is not representable in UTF-8");
        }
    }

    /**
     * Incremental builder. Rejects a duplicate key at the {@link #put} that
     * introduces it.
     */
    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, String value) {
            validate(key, value);
            if (entries.containsKey(key)) {
                throw new InvalidPayloadException("duplicate key '" + key + "'");
            }
            entries.put(key, value);
            return this;
        }

        public Builder requestName(String name) {
            return put(REQUEST_NAME_KEY, name);
        }

        public KeyValueMessage build() {
            return new KeyValueMessage(entries);
        }
    }
}
