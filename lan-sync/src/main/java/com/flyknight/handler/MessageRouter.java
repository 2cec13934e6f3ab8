package com.flyknight.handler;

import com.flyknight.protocol.AttackData;
import com.flyknight.protocol.EnemyDamage;
import com.flyknight.protocol.EnemyDamaged;
import com.flyknight.protocol.EnemyDied;
import com.flyknight.protocol.ItemPickedUp;
import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageType;
import com.flyknight.protocol.PickupItem;
import com.flyknight.protocol.PlayerAttack;
import com.flyknight.session.SessionRegistry;
import com.flyknight.state.DamageOutcome;
import com.flyknight.state.GameStateStore;
import com.flyknight.state.PlayerView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies client intents to the authoritative store.
 *
 * This is where the core sync logic lives:
 * - PLAYER_UPDATE: replace the sender's player entry, no broadcast
 * - ATTACK: relay as PLAYER_ATTACK to everyone
 * - ENEMY_DAMAGE: subtract health, broadcast ENEMY_DAMAGED or ENEMY_DIED
 * - PICKUP_ITEM: remove the item, broadcast ITEM_PICKED_UP
 *
 * Threading Model:
 * - Called from each session's event loop, one message at a time per session
 * - Several sessions route concurrently; the store's lock serializes the
 *   effects, and each effect's broadcast is sent after the lock is released
 * - Preconditions are checked against the store inside the same critical
 *   section that applies the effect, so two players hitting the same enemy
 *   can never both kill it
 *
 * The router never computes damage. It only applies outcomes that combat
 * logic already decided.
 */
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final GameStateStore store;
    private final SessionRegistry registry;

    public MessageRouter(GameStateStore store, SessionRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    /**
     * Routes one message from a session to its handler.
     */
    public void route(int senderId, Message message) {
        logger.debug("Received {} from player {}", message.getType(), senderId);

        switch (message.getType()) {
            case PLAYER_UPDATE -> handlePlayerUpdate(senderId, message.payloadAs(PlayerView.class));
            case ATTACK -> handleAttack(senderId, message.payloadAs(AttackData.class));
            case ENEMY_DAMAGE -> handleEnemyDamage(senderId, message.payloadAs(EnemyDamage.class));
            case PICKUP_ITEM -> handlePickupItem(senderId, message.payloadAs(PickupItem.class));
            default -> logger.warn("Player {} sent host-only message type {}, dropping",
                    senderId, message.getType().tag());
        }
    }

    /**
     * Handles a player's own state. Absorbed into the next periodic broadcast.
     */
    private void handlePlayerUpdate(int senderId, PlayerView view) {
        // Check and replace under the registry lock, or a concurrent remove
        // could leave a departed player in the world
        if (!registry.applyIfLive(senderId, () -> store.replacePlayer(senderId, view))) {
            logger.debug("Ignoring player_update from unknown player {}", senderId);
        }
    }

    /**
     * Relays a swing. Purely cosmetic: hits arrive separately as enemy_damage.
     */
    private void handleAttack(int senderId, AttackData attackData) {
        registry.broadcast(Message.of(MessageType.PLAYER_ATTACK, new PlayerAttack(senderId, attackData)));
    }

    private void handleEnemyDamage(int senderId, EnemyDamage damage) {
        if (damage.damage() < 0) {
            logger.warn("Player {} sent negative damage {} for enemy {}, dropping",
                    senderId, damage.damage(), damage.enemyId());
            return;
        }
        DamageOutcome outcome = store.damageEnemy(damage.enemyId(), damage.damage());

        switch (outcome.kind()) {
            case DIED -> {
                logger.info("Enemy {} killed by player {} (drops: {})",
                        damage.enemyId(), senderId, damage.drops());
                registry.broadcast(Message.of(MessageType.ENEMY_DIED,
                        new EnemyDied(damage.enemyId(), damage.drops())));
            }
            case DAMAGED -> registry.broadcast(Message.of(MessageType.ENEMY_DAMAGED,
                    new EnemyDamaged(damage.enemyId(), outcome.hp())));
            case ABSENT -> logger.debug("Player {} hit enemy {} which is already gone",
                    senderId, damage.enemyId());
        }
    }

    private void handlePickupItem(int senderId, PickupItem pickup) {
        if (!store.removeItem(pickup.itemId())) {
            logger.debug("Player {} tried to pick up item {} which is already gone",
                    senderId, pickup.itemId());
            return;
        }
        logger.debug("Player {} picked up item {}", senderId, pickup.itemId());
        registry.broadcast(Message.of(MessageType.ITEM_PICKED_UP, new ItemPickedUp(pickup.itemId(), senderId)));
    }
}
