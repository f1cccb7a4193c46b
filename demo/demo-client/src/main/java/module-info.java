/**
 * Demo client module.
 *
 * <p>Demonstrates client-side library usage with a shared workout session.</p>
 */
module demo.client
{
    requires sessionsync.api;
    requires sessionsync.impl;
    requires org.slf4j;
    requires reactor.core;
}
