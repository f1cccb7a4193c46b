/**
 * Session sync API module.
 *
 * <p>Provides the channel and registry interfaces, the protocol envelope and
 * the session model shared by the participants of a realtime session.</p>
 */
module sessionsync.api
{
    requires transitive reactor.core;
    requires com.fasterxml.jackson.annotation;

    exports org.abstractica.sessionsync;
    exports org.abstractica.sessionsync.handlers;
    exports org.abstractica.sessionsync.model;
    exports org.abstractica.sessionsync.payload;

    // Records are bound reflectively by the JSON codec
    opens org.abstractica.sessionsync.model to com.fasterxml.jackson.databind;
    opens org.abstractica.sessionsync.payload to com.fasterxml.jackson.databind;
}
