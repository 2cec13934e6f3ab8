package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EnemyDied(@JsonProperty("enemy_id") int enemyId, List<String> drops) {

    public EnemyDied {
        drops = drops == null ? List.of() : List.copyOf(drops);
    }
}
