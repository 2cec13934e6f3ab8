package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item occupying one equipment slot of a player.
 */
public record EquippedItem(
        @JsonProperty("item_type") String itemType,
        @JsonProperty("item_class") String itemClass,
        String name) {
}
