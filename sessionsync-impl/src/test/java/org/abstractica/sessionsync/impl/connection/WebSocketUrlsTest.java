package org.abstractica.sessionsync.impl.connection;

import org.abstractica.sessionsync.RealtimeException;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketUrls}.
 */
class WebSocketUrlsTest
{
    @Test
    void httpsBecomesWss()
    {
        assertEquals(URI.create("wss://api.example.com/session/ws/"),
                WebSocketUrls.build(URI.create("https://api.example.com"), "/session/ws/"));
    }

    @Test
    void httpBecomesWs()
    {
        assertEquals(URI.create("ws://localhost:8000/session/ws/"),
                WebSocketUrls.build(URI.create("http://localhost:8000"), "/session/ws/"));
    }

    @Test
    void websocketSchemesAreKept()
    {
        assertEquals("ws", WebSocketUrls.build(URI.create("ws://host"), "/a").getScheme());
        assertEquals("wss", WebSocketUrls.build(URI.create("WSS://host"), "/a").getScheme());
    }

    @Test
    void endpointReplacesPathAndQueryIsKept()
    {
        URI url = WebSocketUrls.build(URI.create("https://api.example.com/v1/ignored?tenant=gym"), "/session/ws/");

        assertEquals("/session/ws/", url.getPath());
        assertEquals("tenant=gym", url.getQuery());
    }

    @Test
    void rejectsUnsupportedScheme()
    {
        assertThrows(RealtimeException.InvalidUrl.class,
                () -> WebSocketUrls.build(URI.create("ftp://files.example.com"), "/session/ws/"));
    }

    @Test
    void rejectsMissingHost()
    {
        assertThrows(RealtimeException.InvalidUrl.class,
                () -> WebSocketUrls.build(URI.create("localhost"), "/session/ws/"));
        assertThrows(RealtimeException.InvalidUrl.class,
                () -> WebSocketUrls.build(URI.create("mailto:someone@example.com"), "/session/ws/"));
    }
}
