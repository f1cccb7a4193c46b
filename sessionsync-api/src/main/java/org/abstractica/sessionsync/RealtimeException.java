package org.abstractica.sessionsync;

import java.util.Objects;

/**
 * Failure raised by the real-time layer.
 *
 * <p>Sealed hierarchy enabling exhaustive handling of every failure case.
 * Asynchronous operations complete their futures exceptionally with one of
 * these; synchronous lookups throw them directly.</p>
 */
public abstract sealed class RealtimeException extends RuntimeException
{
    protected RealtimeException(String message)
    {
        super(message);
    }

    protected RealtimeException(String message, Throwable cause)
    {
        super(message, cause);
    }

    /**
     * Returns true if retrying the same connection cannot succeed without
     * new credentials.
     *
     * @return true for authentication failures
     */
    public boolean isAuthFailure()
    {
        return false;
    }

    /**
     * The base URL cannot be mapped to a WebSocket URL.
     */
    public static final class InvalidUrl extends RealtimeException
    {
        public InvalidUrl(String url)
        {
            super("Invalid WebSocket URL: " + url);
        }
    }

    /**
     * The socket could not be opened or was lost.
     */
    public static final class ConnectionFailed extends RealtimeException
    {
        public ConnectionFailed(String details)
        {
            super("Failed to connect to WebSocket: " + details);
        }

        public ConnectionFailed(String details, Throwable cause)
        {
            super("Failed to connect to WebSocket: " + details, cause);
        }
    }

    /**
     * A send was attempted while the channel is not connected.
     */
    public static final class Disconnected extends RealtimeException
    {
        public Disconnected(String channelId)
        {
            super("WebSocket disconnected: " + channelId);
        }
    }

    /**
     * The channel requires credentials that are not available.
     */
    public static final class AuthenticationRequired extends RealtimeException
    {
        public AuthenticationRequired(String channelId)
        {
            super("Authentication required: " + channelId);
        }

        @Override
        public boolean isAuthFailure()
        {
            return true;
        }
    }

    /**
     * An outgoing message could not be serialized.
     */
    public static final class Encoding extends RealtimeException
    {
        public Encoding(Throwable cause)
        {
            super("Encoding error: " + cause.getMessage(), cause);
        }
    }

    /**
     * An incoming frame or payload could not be decoded.
     */
    public static final class Decoding extends RealtimeException
    {
        public Decoding(String details)
        {
            super("Decoding error: " + details);
        }

        public Decoding(String details, Throwable cause)
        {
            super("Decoding error: " + details, cause);
        }
    }

    /**
     * The server reported an error.
     */
    public static final class ServerError extends RealtimeException
    {
        private final String serverMessage;

        public ServerError(String serverMessage)
        {
            super("Server error: " + serverMessage);
            this.serverMessage = Objects.requireNonNull(serverMessage, "serverMessage");
        }

        public String getServerMessage()
        {
            return serverMessage;
        }
    }

    /**
     * The connection attempt did not complete in time.
     */
    public static final class Timeout extends RealtimeException
    {
        public Timeout(String channelId)
        {
            super("WebSocket connection timeout: " + channelId);
        }
    }

    /**
     * The server rejected the credentials.
     */
    public static final class Unauthorized extends RealtimeException
    {
        public Unauthorized(String details)
        {
            super("Unauthorized access: " + details);
        }

        @Override
        public boolean isAuthFailure()
        {
            return true;
        }
    }

    /**
     * No channel is registered under the given id.
     */
    public static final class ChannelNotFound extends RealtimeException
    {
        private final String channelId;

        public ChannelNotFound(String channelId)
        {
            super("WebSocket connection not found: " + channelId);
            this.channelId = channelId;
        }

        public String getChannelId()
        {
            return channelId;
        }
    }
}
