package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item lying in the world, waiting to be picked up.
 */
public record ItemView(
        @JsonProperty("item_id") int itemId,
        @JsonProperty("item_type") String itemType,
        @JsonProperty("item_class") String itemClass,
        String name,
        double x,
        double y) {
}
