package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Client intent: "my hit took {@code damage} off this enemy".
 *
 * {@code drops} is what the enemy leaves behind if this hit kills it; it is
 * echoed in {@code enemy_died} and ignored otherwise.
 */
public record EnemyDamage(
        @JsonProperty("enemy_id") int enemyId,
        int damage,
        List<String> drops) {

    public EnemyDamage {
        drops = drops == null ? List.of() : List.copyOf(drops);
    }

    public static EnemyDamage of(int enemyId, int damage) {
        return new EnemyDamage(enemyId, damage, List.of());
    }
}
