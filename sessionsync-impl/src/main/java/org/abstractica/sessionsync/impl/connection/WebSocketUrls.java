package org.abstractica.sessionsync.impl.connection;

import org.abstractica.sessionsync.RealtimeException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a server base URL and a channel endpoint to a WebSocket URL.
 *
 * <p>{@code http} becomes {@code ws}, {@code https} becomes {@code wss};
 * {@code ws} and {@code wss} are kept. The base path is replaced by the
 * endpoint and the base query is kept.</p>
 */
public final class WebSocketUrls
{
    private WebSocketUrls() {}

    /**
     * Builds the WebSocket URL for a channel.
     *
     * @param baseUrl  the server base URL
     * @param endpoint the channel path, starting with {@code /}
     * @return the WebSocket URL
     * @throws RealtimeException.InvalidUrl if the base URL has no host or an unsupported scheme
     */
    public static URI build(URI baseUrl, String endpoint)
    {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(endpoint, "endpoint");

        String scheme = baseUrl.getScheme();
        if (scheme == null || baseUrl.getHost() == null)
        {
            throw new RealtimeException.InvalidUrl(baseUrl.toString());
        }

        String wsScheme;
        switch (scheme.toLowerCase(Locale.ROOT))
        {
            case "http", "ws" -> wsScheme = "ws";
            case "https", "wss" -> wsScheme = "wss";
            default -> throw new RealtimeException.InvalidUrl(baseUrl.toString());
        }

        try
        {
            return new URI(
                    wsScheme,
                    baseUrl.getUserInfo(),
                    baseUrl.getHost(),
                    baseUrl.getPort(),
                    endpoint,
                    baseUrl.getQuery(),
                    null
            );
        }
        catch (URISyntaxException e)
        {
            throw new RealtimeException.InvalidUrl(baseUrl + endpoint);
        }
    }
}
