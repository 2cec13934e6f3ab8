package com.flyknight.server;

import com.flyknight.config.SyncConfig;
import com.flyknight.handler.SessionHandler;
import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.GameStateUpdate;
import com.flyknight.transport.FramePipeline;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The host: accepts peers over length-prefixed TCP, routes their intents
 * into the authoritative store and broadcasts the world at the tick rate.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that decode, route and write
 * - Broadcast loop: 1 dedicated thread ticking at the configured rate
 *
 * The host's own game loop shares the store through {@link #snapshot()} and
 * {@link #updateGameState(GameStateUpdate)}.
 */
public class SyncServer {

    private static final Logger logger = LoggerFactory.getLogger(SyncServer.class);

    private final ServerContext context;
    private final BroadcastLoop broadcastLoop;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SyncServer(SyncConfig config) {
        this(config, GameStateSnapshot.empty());
    }

    public SyncServer(SyncConfig config, GameStateSnapshot initialState) {
        this.context = new ServerContext(config, initialState);
        this.broadcastLoop = new BroadcastLoop(context.getStore(), context.getRegistry(), config.getTickPeriod());
    }

    /**
     * Binds the listening socket and starts the broadcast loop. Returns once
     * the host is accepting connections.
     *
     * @throws BindFailedException if the address or port cannot be bound
     */
    public void start() throws BindFailedException {
        SyncConfig config = context.getConfig();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 16)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Drop peers that stop talking, only if configured
                        if (config.getIdleTimeoutSeconds() > 0) {
                            pipeline.addLast("idle", new IdleStateHandler(
                                    config.getIdleTimeoutSeconds(), 0, 0, TimeUnit.SECONDS));
                        }

                        FramePipeline.install(pipeline, context.getCodec(), config.getMaxFrameLength());

                        pipeline.addLast("session", new SessionHandler(context));
                    }
                });

        ChannelFuture bind = bootstrap.bind(config.getBindAddress(), config.getPort()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            bossGroup.shutdownGracefully(0, 0, TimeUnit.SECONDS);
            workerGroup.shutdownGracefully(0, 0, TimeUnit.SECONDS);
            throw new BindFailedException("Cannot bind " + config.getBindAddress() + ":" + config.getPort(), bind.cause());
        }
        serverChannel = bind.channel();

        broadcastLoop.start();

        logger.info("Host listening on {}:{} ({} players max, {} Hz)",
                config.getBindAddress(), getPort(), config.getMaxPlayers(), config.getTickRate());
    }

    /**
     * Blocks until the listening socket is closed.
     */
    public void awaitShutdown() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * Gracefully shuts down the host.
     * - Stops the broadcast loop
     * - Closes every session (remaining peers see end-of-stream)
     * - Stops accepting connections and releases the event loops
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down host...");

        broadcastLoop.stop();
        context.getRegistry().closeAll();

        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }

        // Graceful shutdown of event loops
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }

        logger.info("Host shutdown complete.");
    }

    /**
     * The port actually bound; differs from the configured one when that was 0.
     */
    public int getPort() {
        if (serverChannel == null) {
            return context.getConfig().getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public GameStateSnapshot snapshot() {
        return context.getStore().snapshot();
    }

    /**
     * Merges output of the host's own simulation (AI, spawns, level change)
     * into the authoritative world.
     */
    public void updateGameState(GameStateUpdate update) {
        context.getStore().update(update);
    }

    public BroadcastLoop getBroadcastLoop() {
        return broadcastLoop;
    }

    public ServerContext getContext() {
        return context;
    }
}
