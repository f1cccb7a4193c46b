package org.abstractica.sessionsync;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MessageType} and {@link ConnectionState}.
 */
class MessageTypeTest
{
    @Test
    void everyTypeResolvesByWireName()
    {
        for (MessageType type : MessageType.values())
        {
            assertEquals(Optional.of(type), MessageType.fromWireName(type.getWireName()));
        }
    }

    @Test
    void unknownWireName()
    {
        assertTrue(MessageType.fromWireName("chat_message").isEmpty());
        assertTrue(MessageType.fromWireName(null).isEmpty());
    }

    @Test
    void failedStatesCompareByReason()
    {
        assertEquals(new ConnectionState.Failed("boom"), ConnectionState.failed(new IllegalStateException("boom")));
        assertEquals(new ConnectionState.Failed("IllegalStateException"),
                ConnectionState.failed(new IllegalStateException()));
        assertTrue(ConnectionState.CONNECTED.isConnected());
        assertFalse(ConnectionState.RECONNECTING.isConnected());
    }

    @Test
    void authFailures()
    {
        assertTrue(new RealtimeException.Unauthorized("bad token").isAuthFailure());
        assertTrue(new RealtimeException.AuthenticationRequired("chat").isAuthFailure());
        assertFalse(new RealtimeException.ServerError("overloaded").isAuthFailure());
    }
}
