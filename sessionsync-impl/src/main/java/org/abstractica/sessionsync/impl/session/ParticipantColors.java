package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.model.Participant;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Display colors assigned to participants when they join.
 */
public final class ParticipantColors
{
    public static final List<String> PALETTE = List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4",
            "#FFEAA7", "#DDA0DD", "#FF9FF3", "#54A0FF"
    );

    private ParticipantColors() {}

    /**
     * Picks the first palette color no current participant uses.
     *
     * <p>Once all colors are taken, colors repeat in palette order.</p>
     *
     * @param participants the current participants
     * @return a color in {@code #RRGGBB} form
     */
    public static String nextColor(List<Participant> participants)
    {
        Objects.requireNonNull(participants, "participants");

        Set<String> used = new HashSet<>();
        for (Participant participant : participants)
        {
            if (participant.color() != null)
            {
                used.add(participant.color().toUpperCase(Locale.ROOT));
            }
        }
        for (String color : PALETTE)
        {
            if (!used.contains(color))
            {
                return color;
            }
        }
        return PALETTE.get(participants.size() % PALETTE.size());
    }
}
