package org.abstractica.sessionsync.impl.transport;

/**
 * Receives inbound events for one socket.
 */
public interface FrameListener
{
    /**
     * A complete text frame arrived.
     *
     * @param text the frame content
     */
    void onText(String text);

    /**
     * A complete binary frame arrived.
     *
     * @param data the frame content
     */
    void onBinary(byte[] data);

    /**
     * The server answered a ping.
     */
    void onPong();

    /**
     * The server closed the socket.
     *
     * @param statusCode the close code
     * @param reason     the close reason, may be empty
     */
    void onClosed(int statusCode, String reason);

    /**
     * The socket failed.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
