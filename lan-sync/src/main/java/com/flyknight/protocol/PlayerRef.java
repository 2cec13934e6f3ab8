package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of {@code player_joined} and {@code player_left}.
 */
public record PlayerRef(@JsonProperty("player_id") int playerId) {
}
