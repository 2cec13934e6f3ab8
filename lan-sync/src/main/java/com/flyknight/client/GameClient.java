package com.flyknight.client;

import com.flyknight.config.SyncConfig;
import com.flyknight.protocol.AttackData;
import com.flyknight.protocol.EnemyDamage;
import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageCodec;
import com.flyknight.protocol.MessageType;
import com.flyknight.protocol.PickupItem;
import com.flyknight.protocol.Welcome;
import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.PlayerView;
import com.flyknight.transport.ChannelTransport;
import com.flyknight.transport.ConnectionException;
import com.flyknight.transport.FramePipeline;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A peer's read-only mirror of the host's world.
 *
 * A dedicated receive worker reads messages in arrival order:
 * - WELCOME: remembers the assigned player id and seeds the cached snapshot
 * - GAME_STATE: replaces the cached snapshot wholesale
 * - then every handler subscribed to the message's type runs, outside the
 *   cache lock
 *
 * The game loop reads {@link #getSnapshot()} once per frame and sends its
 * own intents through the {@code send*} helpers.
 *
 * When the host goes away the mirror marks itself disconnected and runs the
 * {@link #onDisconnect} hooks. It never reconnects on its own.
 */
public class GameClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GameClient.class);

    private static final int NO_PLAYER_ID = -1;

    private final SyncConfig config;
    private final MessageCodec codec = new MessageCodec();
    private final ClientEventBus events = new ClientEventBus();
    private final List<Runnable> disconnectHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private final Object cacheLock = new Object();
    // Guarded by cacheLock
    private GameStateSnapshot snapshot = GameStateSnapshot.empty();
    private int playerId = NO_PLAYER_ID;

    private EventLoopGroup group;
    private volatile ChannelTransport transport;
    private Thread receiver;

    public GameClient() {
        this(SyncConfig.load());
    }

    public GameClient(SyncConfig config) {
        this.config = config;
    }

    /**
     * Opens the connection and starts the receive worker.
     *
     * @throws ConnectionException if the host cannot be reached in time
     */
    public synchronized void connect(String host, int port) throws ConnectionException {
        if (transport != null) {
            // One connection per mirror; reconnecting means a new mirror
            throw new IllegalStateException("Mirror already used for " + transport.remoteAddress());
        }

        group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        FramePipeline.installBuffered(ch.pipeline(), codec, config.getMaxFrameLength());
                    }
                });

        ChannelFuture future = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            group.shutdownGracefully(0, 0, TimeUnit.SECONDS);
            group = null;
            throw new ConnectionException("Cannot connect to " + host + ":" + port, future.cause());
        }

        transport = new ChannelTransport(future.channel(), config);
        connected.set(true);

        receiver = new Thread(this::receiveLoop, "mirror-receive");
        receiver.setDaemon(true);
        receiver.start();

        logger.info("Connected to host {}:{}", host, port);
    }

    private void receiveLoop() {
        try {
            while (connected.get()) {
                Optional<Message> next = transport.receive();
                if (next.isEmpty()) {
                    logger.info("Host closed the connection");
                    break;
                }
                handle(next.get());
            }
        } catch (ConnectionException e) {
            if (connected.get()) {
                logger.warn("Connection to host lost: {}", e.getMessage());
            }
        } finally {
            markDisconnected();
        }
    }

    /**
     * Applies one host message to the cache, then notifies subscribers.
     */
    void handle(Message message) {
        switch (message.getType()) {
            case WELCOME -> {
                Welcome welcome = message.payloadAs(Welcome.class);
                synchronized (cacheLock) {
                    playerId = welcome.playerId();
                    snapshot = welcome.gameState();
                }
                logger.info("Joined as player {}", welcome.playerId());
            }
            case GAME_STATE -> {
                GameStateSnapshot state = message.payloadAs(GameStateSnapshot.class);
                synchronized (cacheLock) {
                    snapshot = state;
                }
            }
            default -> {
                if (message.getType().isClientIntent()) {
                    logger.warn("Host sent client-only message type {}, dropping", message.getType().tag());
                    return;
                }
            }
        }
        events.dispatch(message);
    }

    private void markDisconnected() {
        if (!connected.compareAndSet(true, false)) {
            return;
        }
        transport.close();
        logger.info("Disconnected from host");

        for (Runnable hook : disconnectHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                logger.error("Disconnect hook failed", e);
            }
        }
    }

    // === Reads for the game loop ===

    /**
     * The latest world received from the host; an empty level-1 world until
     * the welcome arrives. Never observed half-updated.
     */
    public GameStateSnapshot getSnapshot() {
        synchronized (cacheLock) {
            return snapshot;
        }
    }

    /**
     * The id the host assigned to this peer, once welcomed.
     */
    public OptionalInt getPlayerId() {
        synchronized (cacheLock) {
            return playerId == NO_PLAYER_ID ? OptionalInt.empty() : OptionalInt.of(playerId);
        }
    }

    public boolean isConnected() {
        return connected.get();
    }

    public ClientEventBus events() {
        return events;
    }

    /**
     * Registers a callback run on the receive worker when the connection ends
     * for any reason other than {@link #disconnect()}.
     */
    public void onDisconnect(Runnable hook) {
        disconnectHooks.add(hook);
    }

    // === Intents ===

    /**
     * Sends a client intent to the host, blocking until it is written.
     */
    public void send(Message message) throws ConnectionException {
        if (!message.getType().isClientIntent()) {
            throw new IllegalArgumentException(message.getType().tag() + " is not a client intent");
        }
        ChannelTransport current = transport;
        if (current == null || !connected.get()) {
            throw new ConnectionException("Not connected to a host");
        }
        current.send(message);
    }

    public void sendPlayerUpdate(PlayerView view) throws ConnectionException {
        send(Message.of(MessageType.PLAYER_UPDATE, view));
    }

    public void sendAttack(AttackData attack) throws ConnectionException {
        send(Message.of(MessageType.ATTACK, attack));
    }

    public void sendEnemyDamage(int enemyId, int damage) throws ConnectionException {
        sendEnemyDamage(enemyId, damage, List.of());
    }

    /**
     * Reports a hit. {@code drops} is what the enemy should leave behind if
     * the hit turns out to be lethal.
     */
    public void sendEnemyDamage(int enemyId, int damage, List<String> drops) throws ConnectionException {
        send(Message.of(MessageType.ENEMY_DAMAGE, new EnemyDamage(enemyId, damage, drops)));
    }

    public void sendPickupItem(int itemId) throws ConnectionException {
        send(Message.of(MessageType.PICKUP_ITEM, new PickupItem(itemId)));
    }

    // === Shutdown ===

    /**
     * Closes the connection, stops the receive worker and releases the I/O
     * thread. Disconnect hooks do not run. Safe to call more than once.
     */
    public synchronized void disconnect() {
        boolean wasConnected = connected.getAndSet(false);

        if (transport != null) {
            transport.close();
        }
        if (receiver != null && receiver != Thread.currentThread()) {
            try {
                receiver.join(config.getReceiveTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (group != null) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            group = null;
        }

        if (wasConnected) {
            logger.info("Disconnected from host");
        }
    }

    @Override
    public void close() {
        disconnect();
    }
}
