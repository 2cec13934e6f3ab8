package com.flyknight.state;

import java.util.Map;

/**
 * Partial update handed in by world generation, AI or combat logic.
 *
 * Every non-null section replaces the corresponding section of the
 * authoritative snapshot wholesale; null sections are left untouched.
 */
public record GameStateUpdate(
        Map<Integer, PlayerView> players,
        Map<Integer, EnemyView> enemies,
        Map<Integer, ItemView> items,
        DungeonDescriptor dungeon,
        Integer level) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Map<Integer, PlayerView> players;
        private Map<Integer, EnemyView> enemies;
        private Map<Integer, ItemView> items;
        private DungeonDescriptor dungeon;
        private Integer level;

        public Builder players(Map<Integer, PlayerView> players) {
            this.players = players;
            return this;
        }

        public Builder enemies(Map<Integer, EnemyView> enemies) {
            this.enemies = enemies;
            return this;
        }

        public Builder items(Map<Integer, ItemView> items) {
            this.items = items;
            return this;
        }

        public Builder dungeon(DungeonDescriptor dungeon) {
            this.dungeon = dungeon;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public GameStateUpdate build() {
            return new GameStateUpdate(players, enemies, items, dungeon, level);
        }
    }
}
