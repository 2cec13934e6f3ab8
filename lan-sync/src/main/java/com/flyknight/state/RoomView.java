package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RoomView(
        @JsonProperty("room_id") int roomId,
        double x,
        double y,
        double width,
        double height,
        boolean cleared,
        @JsonProperty("connected_rooms") List<Integer> connectedRooms) {

    public RoomView {
        connectedRooms = connectedRooms == null ? List.of() : List.copyOf(connectedRooms);
    }
}
