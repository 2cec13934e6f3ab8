package com.flyknight.client;

import com.flyknight.protocol.EnemyDamaged;
import com.flyknight.protocol.EnemyDied;
import com.flyknight.protocol.ItemPickedUp;
import com.flyknight.protocol.MessageType;
import com.flyknight.protocol.PlayerAttack;
import com.flyknight.protocol.PlayerRef;
import com.flyknight.protocol.Welcome;
import com.flyknight.state.GameStateSnapshot;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed key for a host → client message. Subscribing with a kind fixes the
 * payload type the handler receives, so handlers never cast.
 *
 * <pre>
 * client.events().subscribe(EventKind.ENEMY_DIED, died -> removeSprite(died.enemyId()));
 * </pre>
 *
 * @param <P> payload record delivered to handlers
 */
public final class EventKind<P> {

    public static final EventKind<Welcome> WELCOME = new EventKind<>(MessageType.WELCOME, Welcome.class);
    public static final EventKind<PlayerRef> PLAYER_JOINED = new EventKind<>(MessageType.PLAYER_JOINED, PlayerRef.class);
    public static final EventKind<PlayerRef> PLAYER_LEFT = new EventKind<>(MessageType.PLAYER_LEFT, PlayerRef.class);
    public static final EventKind<PlayerAttack> PLAYER_ATTACK = new EventKind<>(MessageType.PLAYER_ATTACK, PlayerAttack.class);
    public static final EventKind<EnemyDamaged> ENEMY_DAMAGED = new EventKind<>(MessageType.ENEMY_DAMAGED, EnemyDamaged.class);
    public static final EventKind<EnemyDied> ENEMY_DIED = new EventKind<>(MessageType.ENEMY_DIED, EnemyDied.class);
    public static final EventKind<ItemPickedUp> ITEM_PICKED_UP = new EventKind<>(MessageType.ITEM_PICKED_UP, ItemPickedUp.class);
    public static final EventKind<GameStateSnapshot> GAME_STATE = new EventKind<>(MessageType.GAME_STATE, GameStateSnapshot.class);

    private static final Map<MessageType, EventKind<?>> BY_TYPE = new EnumMap<>(MessageType.class);

    static {
        for (EventKind<?> kind : new EventKind<?>[] {
                WELCOME, PLAYER_JOINED, PLAYER_LEFT, PLAYER_ATTACK,
                ENEMY_DAMAGED, ENEMY_DIED, ITEM_PICKED_UP, GAME_STATE}) {
            BY_TYPE.put(kind.messageType, kind);
        }
    }

    private final MessageType messageType;
    private final Class<P> payloadType;

    private EventKind(MessageType messageType, Class<P> payloadType) {
        if (messageType.isClientIntent()) {
            throw new IllegalArgumentException(messageType.tag() + " is not delivered to clients");
        }
        this.messageType = messageType;
        this.payloadType = payloadType;
    }

    public MessageType messageType() {
        return messageType;
    }

    public Class<P> payloadType() {
        return payloadType;
    }

    /**
     * Looks up the kind for a message type; empty for client intents.
     */
    public static Optional<EventKind<?>> of(MessageType type) {
        return Optional.ofNullable(BY_TYPE.get(type));
    }

    @Override
    public String toString() {
        return "EventKind{" + messageType.tag() + '}';
    }
}
