package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ItemPickedUp(
        @JsonProperty("item_id") int itemId,
        @JsonProperty("player_id") int playerId) {
}
