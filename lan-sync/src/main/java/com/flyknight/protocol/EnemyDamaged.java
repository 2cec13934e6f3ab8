package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnemyDamaged(@JsonProperty("enemy_id") int enemyId, int hp) {
}
