package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An exercise entry in the session state.
 *
 * <p>Position in the state's item list is not meaningful; {@link #order()}
 * defines display order.</p>
 *
 * @param id           unique item id
 * @param order        display order, 1-based
 * @param participants accounts performing this exercise
 * @param type         single or compound
 * @param rest         rest between sets in seconds, may be null
 * @param meta         catalogue entries, more than one for compound items
 * @param sets         the sets, in list order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExerciseItem(
        String id,
        int order,
        List<String> participants,
        ExerciseItemType type,
        Integer rest,
        List<ExerciseMeta> meta,
        List<ExerciseSet> sets
)
{
    public ExerciseItem
    {
        Objects.requireNonNull(id, "id");
        participants = participants == null ? List.of() : List.copyOf(participants);
        type = type == null ? ExerciseItemType.SINGLE : type;
        meta = meta == null ? List.of() : List.copyOf(meta);
        sets = sets == null ? List.of() : List.copyOf(sets);
    }

    /**
     * Finds a set by id.
     *
     * @param setId the set id
     * @return the set, or empty if absent
     */
    public Optional<ExerciseSet> findSet(String setId)
    {
        return sets.stream().filter(s -> s.id().equals(setId)).findFirst();
    }

    public ExerciseItem withOrder(int newOrder)
    {
        return new ExerciseItem(id, newOrder, participants, type, rest, meta, sets);
    }

    public ExerciseItem withSets(List<ExerciseSet> newSets)
    {
        return new ExerciseItem(id, order, participants, type, rest, meta, newSets);
    }

    public ExerciseItem withType(ExerciseItemType newType)
    {
        return new ExerciseItem(id, order, participants, newType, rest, meta, sets);
    }

    public ExerciseItem withRest(Integer newRest)
    {
        return new ExerciseItem(id, order, participants, type, newRest, meta, sets);
    }

    public ExerciseItem withMeta(List<ExerciseMeta> newMeta)
    {
        return new ExerciseItem(id, order, participants, type, rest, newMeta, sets);
    }

    public ExerciseItem withParticipants(List<String> newParticipants)
    {
        return new ExerciseItem(id, order, newParticipants, type, rest, meta, sets);
    }
}
