package org.abstractica.sessionsync;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operations exchanged on the exercise session channel.
 */
public enum MessageType
{
    SESSION_JOIN("session_join"),
    SESSION_LEAVE("session_leave"),
    SESSION_UPDATE("session_update"),
    SESSION_SYNC("session_sync"),

    EXERCISE_ADD("exercise_add"),
    EXERCISE_UPDATE("exercise_update"),
    EXERCISE_DELETE("exercise_delete"),
    EXERCISE_REORDER("exercise_reorder"),

    SET_ADD("set_add"),
    SET_UPDATE("set_update"),
    SET_DELETE("set_delete"),
    SET_COMPLETE("set_complete"),
    SET_REORDER("set_reorder"),

    CURSOR_MOVE("cursor_move"),
    SYNC_REQUEST("sync_request"),
    SYNC_RESPONSE("sync_response");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::getWireName, Function.identity()));

    private final String wireName;

    MessageType(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the name used on the wire.
     *
     * @return the wire name, e.g. {@code session_join}
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Looks up a type by its wire name.
     *
     * @param wireName the wire name
     * @return the type, or empty if unknown
     */
    public static Optional<MessageType> fromWireName(String wireName)
    {
        if (wireName == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
