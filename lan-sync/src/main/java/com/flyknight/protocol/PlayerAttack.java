package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record PlayerAttack(
        @JsonProperty("player_id") int playerId,
        @JsonProperty("attack_data") AttackData attackData) {

    public PlayerAttack {
        Objects.requireNonNull(attackData, "attackData");
    }
}
