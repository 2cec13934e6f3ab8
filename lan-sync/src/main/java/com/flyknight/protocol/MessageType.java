package com.flyknight.protocol;

import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.PlayerView;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Defines all message types of the sync protocol together with their payload
 * schema: the record each payload binds to and the fields it must carry.
 *
 * Client → Host (intents):
 * - PLAYER_UPDATE: latest view of the sender's own player
 * - ATTACK: the sender swung; relayed for visuals only
 * - ENEMY_DAMAGE: the sender's hit landed on an enemy
 * - PICKUP_ITEM: the sender grabbed an item
 *
 * Host → Client:
 * - WELCOME: assigned id plus the current world
 * - PLAYER_JOINED / PLAYER_LEFT: session lifecycle
 * - PLAYER_ATTACK: another player's swing
 * - ENEMY_DAMAGED / ENEMY_DIED: resolution of ENEMY_DAMAGE
 * - ITEM_PICKED_UP: resolution of PICKUP_ITEM
 * - GAME_STATE: full snapshot, once per tick
 */
public enum MessageType {
    // Client → Host
    PLAYER_UPDATE("player_update", PlayerView.class, true, "x", "y", "hp"),
    ATTACK("attack", AttackData.class, true, "damage", "range", "angle", "x", "y"),
    ENEMY_DAMAGE("enemy_damage", EnemyDamage.class, true, "enemy_id", "damage"),
    PICKUP_ITEM("pickup_item", PickupItem.class, true, "item_id"),

    // Host → Client
    WELCOME("welcome", Welcome.class, false, "player_id", "game_state"),
    PLAYER_JOINED("player_joined", PlayerRef.class, false, "player_id"),
    PLAYER_LEFT("player_left", PlayerRef.class, false, "player_id"),
    PLAYER_ATTACK("player_attack", PlayerAttack.class, false, "player_id", "attack_data"),
    ENEMY_DAMAGED("enemy_damaged", EnemyDamaged.class, false, "enemy_id", "hp"),
    ENEMY_DIED("enemy_died", EnemyDied.class, false, "enemy_id"),
    ITEM_PICKED_UP("item_picked_up", ItemPickedUp.class, false, "item_id", "player_id"),
    GAME_STATE("game_state", GameStateSnapshot.class, false, "level");

    private static final Map<String, MessageType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::tag, Function.identity()));

    private final String tag;
    private final Class<?> payloadType;
    private final boolean clientIntent;
    private final List<String> requiredFields;

    MessageType(String tag, Class<?> payloadType, boolean clientIntent, String... requiredFields) {
        this.tag = tag;
        this.payloadType = payloadType;
        this.clientIntent = clientIntent;
        this.requiredFields = List.of(requiredFields);
    }

    /**
     * The string tag used on the wire.
     */
    public String tag() {
        return tag;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    /**
     * True for messages a client may send to the host.
     */
    public boolean isClientIntent() {
        return clientIntent;
    }

    /**
     * Payload fields that must be present for a message of this type to decode.
     */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Optional<MessageType> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
