package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Layout of the current dungeon as handed over by world generation.
 *
 * The sync layer never interprets it; it is carried in every snapshot so a
 * late joiner can rebuild the level.
 */
public record DungeonDescriptor(
        int level,
        @JsonProperty("room_count") int roomCount,
        List<RoomView> rooms,
        @JsonProperty("spawn_x") double spawnX,
        @JsonProperty("spawn_y") double spawnY) {

    public DungeonDescriptor {
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
    }
}
