package org.abstractica.sessionsync;

import java.util.Objects;

/**
 * Lifecycle state of a channel connection.
 *
 * <p>Sealed interface enabling exhaustive handling of states. Records give
 * value equality; two {@link Failed} states are equal when their reasons
 * are equal.</p>
 */
public sealed interface ConnectionState
{
    ConnectionState DISCONNECTED = new Disconnected();
    ConnectionState CONNECTING = new Connecting();
    ConnectionState CONNECTED = new Connected();
    ConnectionState RECONNECTING = new Reconnecting();

    /**
     * No socket is open and none is being opened.
     */
    record Disconnected() implements ConnectionState {}

    /**
     * A socket is being opened.
     */
    record Connecting() implements ConnectionState {}

    /**
     * The socket is open.
     */
    record Connected() implements ConnectionState {}

    /**
     * The socket was lost and a reconnect attempt is pending.
     */
    record Reconnecting() implements ConnectionState {}

    /**
     * The last attempt failed.
     *
     * @param reason description of the failure
     */
    record Failed(String reason) implements ConnectionState
    {
        public Failed
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * Creates a failed state from an exception.
     *
     * @param cause the failure
     * @return the failed state
     */
    static ConnectionState failed(Throwable cause)
    {
        String message = cause.getMessage();
        return new Failed(message != null ? message : cause.getClass().getSimpleName());
    }

    /**
     * Returns true if this is the connected state.
     *
     * @return true when connected
     */
    default boolean isConnected()
    {
        return this instanceof Connected;
    }
}
