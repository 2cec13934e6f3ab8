package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flyknight.state.GameStateSnapshot;

import java.util.Objects;

/**
 * First message a new session receives: its player id and the world as it
 * stood when the session was accepted.
 */
public record Welcome(
        @JsonProperty("player_id") int playerId,
        @JsonProperty("game_state") GameStateSnapshot gameState) {

    public Welcome {
        Objects.requireNonNull(gameState, "gameState");
    }
}
