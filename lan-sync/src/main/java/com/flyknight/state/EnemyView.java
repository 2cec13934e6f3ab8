package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Network view of one enemy, as produced by the AI collaborator.
 *
 * The host only ever touches {@code hp}; every other field is relayed as-is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnemyView(
        int id,
        String type,
        double x,
        double y,
        int hp,
        @JsonProperty("max_hp") int maxHp,
        String state,
        @JsonProperty("room_id") int roomId,
        @JsonProperty("has_bow") boolean hasBow) {

    /**
     * Creates a new EnemyView with updated health.
     */
    public EnemyView withHp(int newHp) {
        return new EnemyView(id, type, x, y, newHp, maxHp, state, roomId, hasBow);
    }

    /**
     * Minimal enemy, handy for seeding a world before AI has run.
     */
    public static EnemyView of(int id, String type, int hp) {
        return new EnemyView(id, type, 0, 0, hp, hp, "idle", 0, false);
    }
}
