package org.abstractica.sessionsync;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for one named channel.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ChannelConfig config = ChannelConfig.builder("exercise_session", "/session/ws/")
 *     .maxReconnectAttempts(3)
 *     .heartbeatInterval(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 *
 * @param id                   unique channel name
 * @param endpoint             path appended to the base URL
 * @param requiresAuth         attach a bearer token when one is available
 * @param autoReconnect        reconnect after an unexpected drop
 * @param maxReconnectAttempts reconnect attempts before giving up
 * @param reconnectDelay       constant delay before each reconnect attempt
 * @param heartbeatInterval    interval between pings
 * @param connectTimeout       maximum time for the opening handshake
 * @param extraHeaders         headers added to the opening request
 */
public record ChannelConfig(
        String id,
        String endpoint,
        boolean requiresAuth,
        boolean autoReconnect,
        int maxReconnectAttempts,
        Duration reconnectDelay,
        Duration heartbeatInterval,
        Duration connectTimeout,
        Map<String, String> extraHeaders
)
{
    public static final String EXERCISE_SESSION = "exercise_session";

    public ChannelConfig
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(extraHeaders, "extraHeaders");

        if (id.isBlank())
        {
            throw new IllegalArgumentException("Channel id must not be blank");
        }
        if (!endpoint.startsWith("/"))
        {
            throw new IllegalArgumentException("Endpoint must start with '/': " + endpoint);
        }
        if (maxReconnectAttempts < 0)
        {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0: " + maxReconnectAttempts);
        }
        requirePositive(reconnectDelay, "reconnectDelay");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(connectTimeout, "connectTimeout");

        extraHeaders = Map.copyOf(extraHeaders);
    }

    /**
     * Creates a builder with default settings.
     *
     * @param id       unique channel name
     * @param endpoint path appended to the base URL
     * @return a new builder
     */
    public static Builder builder(String id, String endpoint)
    {
        return new Builder(id, endpoint);
    }

    /**
     * Settings for the shared exercise session channel.
     *
     * @return the exercise session channel config
     */
    public static ChannelConfig exerciseSession()
    {
        return builder(EXERCISE_SESSION, "/session/ws/")
                .requiresAuth(true)
                .autoReconnect(true)
                .maxReconnectAttempts(3)
                .reconnectDelay(Duration.ofSeconds(2))
                .heartbeatInterval(Duration.ofSeconds(30))
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    private static void requirePositive(Duration duration, String name)
    {
        if (duration.isNegative() || duration.isZero())
        {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    /**
     * Builder for {@link ChannelConfig}.
     */
    public static final class Builder
    {
        private final String id;
        private final String endpoint;
        private boolean requiresAuth = true;
        private boolean autoReconnect = true;
        private int maxReconnectAttempts = 5;
        private Duration reconnectDelay = Duration.ofSeconds(2);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private final Map<String, String> extraHeaders = new LinkedHashMap<>();

        private Builder(String id, String endpoint)
        {
            this.id = Objects.requireNonNull(id, "id");
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        }

        public Builder requiresAuth(boolean requiresAuth)
        {
            this.requiresAuth = requiresAuth;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect)
        {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts)
        {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay)
        {
            this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval)
        {
            this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout)
        {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder header(String name, String value)
        {
            extraHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public ChannelConfig build()
        {
            return new ChannelConfig(
                    id,
                    endpoint,
                    requiresAuth,
                    autoReconnect,
                    maxReconnectAttempts,
                    reconnectDelay,
                    heartbeatInterval,
                    connectTimeout,
                    extraHeaders
            );
        }
    }
}
