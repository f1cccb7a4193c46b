package org.abstractica.sessionsync.handlers;

import org.abstractica.sessionsync.ProtocolMessage;

/**
 * Handles inbound messages that could not be decoded or applied.
 *
 * <p>The message is dropped either way; the channel keeps running.</p>
 */
@FunctionalInterface
public interface MessageErrorHandler
{
    /**
     * Called when a message is dropped.
     *
     * @param message   the message that failed
     * @param exception the failure
     */
    void handle(ProtocolMessage message, Exception exception);
}
