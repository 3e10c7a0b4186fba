package com.questrail.courier.model;

import com.questrail.courier.error.InvalidPayloadException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RawStringMessageTest
{
    @Test
    void holdsText()
    {
        RawStringMessage m = Message.newRawMessage("<xml>ok</xml>");
        assertEquals(MessageKind.RAW_STRING, m.kind());
        assertEquals("<xml>ok</xml>", m.text());
    }

    @Test
    void emptyTextIsAllowed()
    {
        assertEquals("", Message.newRawMessage("").text());
    }

    @Test
    void supplementaryCharactersAreAllowed()
    {
        String emoji = "😀";
        assertEquals(emoji, Message.newRawMessage(emoji).text());
    }

    @Test
    void unpairedSurrogateIsRejected()
    {
        assertThrows(InvalidPayloadException.class, () -> Message.newRawMessage("a\uD83Db"));
        assertThrows(InvalidPayloadException.class, () -> Message.newRawMessage("\uDE00"));
    }

    @Test
    void nullIsRejected()
    {
        assertThrows(InvalidPayloadException.class, () -> Message.newRawMessage(null));
    }

    @Test
    void wireTagsRoundTrip()
    {
        assertEquals(0, MessageKind.KEY_VALUE.wireTag());
        assertEquals(1, MessageKind.RAW_STRING.wireTag());
        assertEquals(MessageKind.RAW_STRING, MessageKind.fromWireTag(1).orElseThrow());
        assertTrue(MessageKind.fromWireTag(2).isEmpty());
    }
}
