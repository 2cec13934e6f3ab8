package com.flyknight.session;

import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageType;
import com.flyknight.protocol.PlayerRef;
import com.flyknight.protocol.Welcome;
import com.flyknight.state.GameStateStore;
import com.flyknight.transport.ConnectionException;
import com.flyknight.transport.Transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tracks the live sessions of the host.
 *
 * Thread Safety:
 * - One registry lock guards the session map and the id counter
 * - A session and its transport are added and removed together under
 *   that lock, so a session is registered exactly while its transport is open
 * - Lifecycle broadcasts (welcome, joined, left) and every other broadcast
 *   are posted under the same lock, so all sessions observe them in one
 *   consistent order. Posting only enqueues writes; it never waits on a socket.
 * - Lock order is registry → store; the store never calls back into the registry
 *
 * Design Notes:
 * - Player ids come from a counter that only moves forward; a departed id
 *   is retired, never handed out again by this registry
 * - Capacity is measured in live sessions, so a freed slot can be reused
 *   under a fresh id
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    /** Passed to {@link #broadcastExcept} when nobody is excluded. */
    public static final int NO_ONE = -1;

    private final Object lock = new Object();
    private final GameStateStore store;
    private final int maxPlayers;

    // Guarded by lock
    private final Map<Integer, Session> sessions = new LinkedHashMap<>();
    private int nextPlayerId = 0;

    public SessionRegistry(GameStateStore store, int maxPlayers) {
        this.store = store;
        this.maxPlayers = maxPlayers;
    }

    /**
     * Admits a freshly connected peer.
     *
     * If the host is full the transport is closed and nothing else happens.
     * Otherwise the peer gets the next player id, a {@code welcome} with the
     * current world, and every other session gets {@code player_joined}.
     * No broadcast can reach the new session ahead of its welcome.
     *
     * @return the new session, or empty if the peer was rejected
     */
    public Optional<Session> accept(Transport transport) {
        synchronized (lock) {
            if (sessions.size() >= maxPlayers) {
                logger.info("Rejecting connection from {}: server full ({}/{})",
                        transport.remoteAddress(), sessions.size(), maxPlayers);
                transport.close();
                return Optional.empty();
            }

            int playerId = nextPlayerId++;
            Session session = new Session(playerId, transport);
            sessions.put(playerId, session);

            try {
                transport.post(Message.of(MessageType.WELCOME, new Welcome(playerId, store.snapshot())));
            } catch (ConnectionException e) {
                logger.info("Player {} disconnected before welcome: {}", playerId, e.getMessage());
                sessions.remove(playerId);
                transport.close();
                return Optional.empty();
            }

            logger.info("Player {} connected from {} ({}/{} players)",
                    playerId, session.getAddress(), sessions.size(), maxPlayers);

            broadcastExcept(Message.of(MessageType.PLAYER_JOINED, new PlayerRef(playerId)), playerId);
            return Optional.of(session);
        }
    }

    /**
     * Ends a session: closes its transport, drops its player from the world
     * and tells everyone else. Removing an id that is not live does nothing,
     * so duplicate failure signals never produce a second {@code player_left}.
     *
     * @return true if this call removed the session
     */
    public boolean remove(int playerId) {
        synchronized (lock) {
            Session session = sessions.remove(playerId);
            if (session == null) {
                return false;
            }

            session.getTransport().close();
            store.removePlayer(playerId);

            logger.info("Player {} disconnected ({} remaining)", playerId, sessions.size());

            broadcast(Message.of(MessageType.PLAYER_LEFT, new PlayerRef(playerId)));
            return true;
        }
    }

    /**
     * Sends a message to every live session.
     */
    public void broadcast(Message message) {
        broadcastExcept(message, NO_ONE);
    }

    /**
     * Builds a message and sends it to every live session in one step under
     * the registry lock. A message built from store state, such as a
     * {@code game_state} snapshot, can then never be overtaken by an effect
     * broadcast that happened after it was built.
     */
    public void broadcast(Supplier<Message> messageSupplier) {
        synchronized (lock) {
            broadcastExcept(messageSupplier.get(), NO_ONE);
        }
    }

    /**
     * Sends a message to every live session but one. A session whose
     * connection turns out to be closed is removed; the others still get
     * the message.
     */
    public void broadcastExcept(Message message, int excludedPlayerId) {
        synchronized (lock) {
            List<Integer> failed = new ArrayList<>();
            for (Session session : sessions.values()) {
                if (session.getId() == excludedPlayerId) {
                    continue;
                }
                try {
                    session.getTransport().post(message);
                } catch (ConnectionException e) {
                    logger.debug("Broadcast of {} to player {} failed: {}",
                            message.getType(), session.getId(), e.getMessage());
                    failed.add(session.getId());
                }
            }
            for (int playerId : failed) {
                remove(playerId);
            }
        }
    }

    /**
     * Closes every session, e.g. on shutdown.
     */
    public void closeAll() {
        synchronized (lock) {
            for (Integer playerId : new ArrayList<>(sessions.keySet())) {
                remove(playerId);
            }
        }
    }

    /**
     * Runs an action only while the player is live, holding the registry lock
     * so a concurrent {@link #remove} cannot slip in between check and action.
     *
     * @return true if the player was live and the action ran
     */
    public boolean applyIfLive(int playerId, Runnable action) {
        synchronized (lock) {
            if (!sessions.containsKey(playerId)) {
                return false;
            }
            action.run();
            return true;
        }
    }

    public boolean isLive(int playerId) {
        synchronized (lock) {
            return sessions.containsKey(playerId);
        }
    }

    public Optional<Session> getSession(int playerId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(playerId));
        }
    }

    /**
     * Returns the ids of the live sessions, in join order.
     */
    public List<Integer> getLivePlayerIds() {
        synchronized (lock) {
            return List.copyOf(sessions.keySet());
        }
    }

    public int getSessionCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }
}
