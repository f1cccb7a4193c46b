/**
 * Session sync implementation module.
 *
 * <p>Provides the default implementation of the session sync API over
 * WebSocket.</p>
 */
module sessionsync.impl
{
    requires transitive sessionsync.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;
    requires java.net.http;

    // Export the registry and session client for applications
    exports org.abstractica.sessionsync.impl.connection;
    exports org.abstractica.sessionsync.impl.session;

    // Export codec and transport for custom transports and tests
    exports org.abstractica.sessionsync.impl.codec;
    exports org.abstractica.sessionsync.impl.transport;
}
