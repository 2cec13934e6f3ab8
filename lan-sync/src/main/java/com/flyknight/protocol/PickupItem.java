package com.flyknight.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PickupItem(@JsonProperty("item_id") int itemId) {
}
