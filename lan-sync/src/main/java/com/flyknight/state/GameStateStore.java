package com.flyknight.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The host's authoritative world state.
 *
 * Thread Safety Strategy:
 * 1. One coarse lock (this object's monitor) guards every field
 * 2. Each public method is one short critical section: a single
 *    read-modify-write or a single snapshot copy, never network I/O
 * 3. Readers get an immutable {@link GameStateSnapshot}, so nothing
 *    leaks a reference to the mutable maps
 *
 * Enemy and item ids that leave the world are retired. A collaborator merge
 * that tries to bring a retired id back is filtered, so a death or pickup is
 * resolved at most once even if stale AI output arrives late.
 */
public class GameStateStore {

    private static final Logger logger = LoggerFactory.getLogger(GameStateStore.class);

    private final Map<Integer, PlayerView> players = new LinkedHashMap<>();
    private final Map<Integer, EnemyView> enemies = new LinkedHashMap<>();
    private final Map<Integer, ItemView> items = new LinkedHashMap<>();
    private DungeonDescriptor dungeon;
    private int level;

    private final Set<Integer> retiredEnemyIds = new HashSet<>();
    private final Set<Integer> retiredItemIds = new HashSet<>();

    public GameStateStore() {
        this(GameStateSnapshot.empty());
    }

    public GameStateStore(GameStateSnapshot initial) {
        players.putAll(initial.players());
        enemies.putAll(initial.enemies());
        items.putAll(initial.items());
        dungeon = initial.dungeon();
        level = initial.level();
    }

    // === Reads ===

    /**
     * Copies the whole world under the lock.
     */
    public synchronized GameStateSnapshot snapshot() {
        return new GameStateSnapshot(players, enemies, items, dungeon, level);
    }

    public synchronized PlayerView getPlayer(int playerId) {
        return players.get(playerId);
    }

    public synchronized EnemyView getEnemy(int enemyId) {
        return enemies.get(enemyId);
    }

    public synchronized boolean hasItem(int itemId) {
        return items.containsKey(itemId);
    }

    // === Players ===

    /**
     * Replaces a player's entry with the latest view from its owner.
     */
    public synchronized void replacePlayer(int playerId, PlayerView view) {
        players.put(playerId, view.withPlayerId(playerId));
    }

    /**
     * Removes a player's entry. Returns the removed view, or null if absent.
     */
    public synchronized PlayerView removePlayer(int playerId) {
        return players.remove(playerId);
    }

    // === Enemies ===

    /**
     * Subtracts damage from an enemy and removes it once its health reaches
     * zero. Damage must not be negative. Concurrent callers are serialized, so exactly one of them sees
     * {@link DamageOutcome.Kind#DIED} and later ones see ABSENT.
     */
    public synchronized DamageOutcome damageEnemy(int enemyId, int damage) {
        if (damage < 0) {
            throw new IllegalArgumentException("Damage must not be negative, was " + damage);
        }
        EnemyView enemy = enemies.get(enemyId);
        if (enemy == null) {
            return DamageOutcome.absent(enemyId);
        }

        // Compared before subtracting so huge values cannot wrap around
        if (damage >= enemy.hp()) {
            enemies.remove(enemyId);
            retiredEnemyIds.add(enemyId);
            return DamageOutcome.died(enemyId);
        }

        int remaining = enemy.hp() - damage;
        enemies.put(enemyId, enemy.withHp(remaining));
        return DamageOutcome.damaged(enemyId, remaining);
    }

    // === Items ===

    /**
     * Removes an item from the world. Returns false if someone else got it first.
     */
    public synchronized boolean removeItem(int itemId) {
        if (items.remove(itemId) == null) {
            return false;
        }
        retiredItemIds.add(itemId);
        return true;
    }

    // === Collaborator merges ===

    /**
     * Merges a partial update from game logic. Each non-null section replaces
     * the current one; retired enemy and item ids are dropped on the way in.
     */
    public synchronized void update(GameStateUpdate update) {
        if (update.players() != null) {
            players.clear();
            update.players().forEach((id, view) -> players.put(id, view.withPlayerId(id)));
        }
        if (update.enemies() != null) {
            enemies.clear();
            update.enemies().forEach((id, enemy) -> {
                if (retiredEnemyIds.contains(id)) {
                    logger.debug("Ignoring retired enemy id {} in state update", id);
                } else {
                    enemies.put(id, enemy);
                }
            });
        }
        if (update.items() != null) {
            items.clear();
            update.items().forEach((id, item) -> {
                if (retiredItemIds.contains(id)) {
                    logger.debug("Ignoring retired item id {} in state update", id);
                } else {
                    items.put(id, item);
                }
            });
        }
        if (update.dungeon() != null) {
            dungeon = update.dungeon();
        }
        if (update.level() != null) {
            level = update.level();
        }
    }

    @Override
    public synchronized String toString() {
        return "GameStateStore{" +
                "players=" + players.size() +
                ", enemies=" + enemies.size() +
                ", items=" + items.size() +
                ", level=" + level +
                '}';
    }
}
