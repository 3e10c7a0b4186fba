package com.questrail.courier.model;

import com.questrail.courier.error.InvalidPayloadException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class KeyValueMessageTest
{
    @Test
    void keepsInsertionOrderOfPairs()
    {
        KeyValueMessage m = KeyValueMessage.builder()
                .put("user", "alice")
                .put("action", "login")
                .build();

        assertEquals(MessageKind.KEY_VALUE, m.kind());
        assertEquals(List.of("user", "action"), List.copyOf(m.entries().keySet()));
        assertEquals("alice", m.get("user"));
        assertTrue(m.containsKey("action"));
        assertNull(m.get("missing"));
    }

    @Test
    void requestNameIsAnOrdinaryEntry()
    {
        KeyValueMessage m = KeyValueMessage.builder()
                .requestName("lookup")
                .put("user", "alice")
                .build();

        assertEquals(Optional.of("lookup"), m.requestName());
        assertEquals("lookup", m.get(KeyValueMessage.REQUEST_NAME_KEY));
        assertEquals(2, m.size());
        assertEquals(KeyValueMessage.of(Map.of("request", "lookup", "user", "alice")), m);

        assertEquals(Optional.empty(), KeyValueMessage.of(Map.of("user", "alice")).requestName());
        assertThrows(InvalidPayloadException.class,
                () -> KeyValueMessage.builder().put("request", "a").requestName("b"));
    }

    @Test
    void equalityIgnoresPairOrder()
    {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("a", "1");
        forward.put("b", "2");
        Map<String, String> backward = new LinkedHashMap<>();
        backward.put("b", "2");
        backward.put("a", "1");

        assertEquals(KeyValueMessage.of(forward), KeyValueMessage.of(backward));
        assertEquals(KeyValueMessage.of(forward).hashCode(), KeyValueMessage.of(backward).hashCode());
    }

    @Test
    void duplicateKeyIsRejected()
    {
        KeyValueMessage.Builder b = KeyValueMessage.builder().put("k", "1");
        assertThrows(InvalidPayloadException.class, () -> b.put("k", "2"));

        assertThrows(InvalidPayloadException.class,
                () -> Message.newKeyValueMessage(List.of(Map.entry("k", "1"), Map.entry("k", "1"))));
    }

    @Test
    void emptyKeyIsRejectedButEmptyValueIsAllowed()
    {
        assertThrows(InvalidPayloadException.class, () -> KeyValueMessage.builder().put("", "v"));

        KeyValueMessage m = KeyValueMessage.builder().put("k", "").build();
        assertEquals("", m.get("k"));
    }

    @Test
    void emptyMessageIsAllowed()
    {
        KeyValueMessage m = Message.newKeyValueMessage(Map.of());
        assertEquals(0, m.size());
    }

    @Test
    void unpairedSurrogateIsRejected()
    {
        assertThrows(InvalidPayloadException.class, () -> KeyValueMessage.builder().put("\uD800", "v"));
        assertThrows(InvalidPayloadException.class, () -> KeyValueMessage.builder().put("k", "x\uDC00"));
    }

    @Test
    void nullsAreRejected()
    {
        assertThrows(InvalidPayloadException.class, () -> KeyValueMessage.builder().put(null, "v"));
        assertThrows(InvalidPayloadException.class, () -> KeyValueMessage.builder().put("k", null));
        assertThrows(InvalidPayloadException.class, () -> new KeyValueMessage(null));
    }

    @Test
    void entriesAreImmutableAndDetachedFromSource()
    {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("k", "v");
        KeyValueMessage m = KeyValueMessage.of(source);

        source.put("other", "x");
        assertEquals(1, m.size());
        assertThrows(UnsupportedOperationException.class, () -> m.entries().put("x", "y"));
    }
}
