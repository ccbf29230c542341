package org.abstractica.gameservices;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Reply}.
 */
class ReplyTest
{
    @Test
    void ok_carriesValue()
    {
        Reply<String> reply = Reply.ok("value");

        assertTrue(reply.isOk());
        assertEquals("value", reply.orElseThrow());
    }

    @Test
    void of_failureStatus_hasNoValue()
    {
        Reply<String> reply = Reply.of(Status.NOT_FOUND);

        assertFalse(reply.isOk());
        assertTrue(reply.value().isEmpty());
        assertThrows(NoSuchElementException.class, reply::orElseThrow);
    }

    @Test
    void constructor_okWithoutValue_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new Reply<>(Status.OK, Optional.empty()));
    }

    @Test
    void constructor_failureWithValue_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new Reply<>(Status.ALREADY_EXISTS, Optional.of(1)));
    }

    @Test
    void capabilityRef_nonPositiveId_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new CapabilityRef(0, "ChatRoom"));
        assertEquals("ChatRoom#3", new CapabilityRef(3, "ChatRoom").toString());
    }
}
