package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Full world state as broadcast on every tick.
 *
 * Deeply immutable: the maps are unmodifiable copies and every value is a
 * record. A snapshot handed out by the store or the client mirror can
 * therefore be read from any thread without further copying.
 *
 * JSON format:
 * {
 *     "players": { "0": { ... } },
 *     "enemies": { "7": { "id": 7, "hp": 60, ... } },
 *     "items":   { },
 *     "dungeon": { "level": 1, "rooms": [ ... ] },
 *     "level": 1
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameStateSnapshot(
        Map<Integer, PlayerView> players,
        Map<Integer, EnemyView> enemies,
        Map<Integer, ItemView> items,
        DungeonDescriptor dungeon,
        int level) {

    public GameStateSnapshot {
        players = players == null ? Map.of() : Map.copyOf(players);
        enemies = enemies == null ? Map.of() : Map.copyOf(enemies);
        items = items == null ? Map.of() : Map.copyOf(items);
    }

    /**
     * An empty level-1 world with no dungeon generated yet.
     */
    public static GameStateSnapshot empty() {
        return new GameStateSnapshot(Map.of(), Map.of(), Map.of(), null, 1);
    }
}
