package com.flyknight;

import com.flyknight.client.EventKind;
import com.flyknight.client.GameClient;
import com.flyknight.config.SyncConfig;
import com.flyknight.server.BindFailedException;
import com.flyknight.server.SyncServer;
import com.flyknight.transport.ConnectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point for the FlyKnight LAN sync layer.
 *
 * <pre>
 * host [port]            run a dedicated host with an empty level-1 world
 * join address [port]    watch a running host from a headless mirror
 * </pre>
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            usage();
            System.exit(2);
        }

        SyncConfig config = SyncConfig.load();

        switch (args[0]) {
            case "host" -> host(config.withPort(port(args, 1, config.getPort())));
            case "join" -> {
                if (args.length < 2) {
                    usage();
                    System.exit(2);
                }
                join(config, args[1], port(args, 2, config.getPort()));
            }
            default -> {
                usage();
                System.exit(2);
            }
        }
    }

    private static void host(SyncConfig config) {
        logger.info("===========================================");
        logger.info("  FlyKnight LAN Host");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");

        SyncServer server = new SyncServer(config);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping host...");
            server.shutdown();
        }));

        try {
            server.start();
            server.awaitShutdown();
        } catch (BindFailedException e) {
            logger.error("Failed to start host", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdown();
        }
    }

    private static void join(SyncConfig config, String address, int port) {
        CountDownLatch gone = new CountDownLatch(1);

        try (GameClient client = new GameClient(config)) {
            client.events().subscribe(EventKind.PLAYER_JOINED,
                    joined -> logger.info("Player {} joined", joined.playerId()));
            client.events().subscribe(EventKind.PLAYER_LEFT,
                    left -> logger.info("Player {} left", left.playerId()));
            client.events().subscribe(EventKind.ENEMY_DIED,
                    died -> logger.info("Enemy {} died, drops {}", died.enemyId(), died.drops()));
            client.events().subscribe(EventKind.ITEM_PICKED_UP,
                    picked -> logger.info("Item {} picked up by player {}", picked.itemId(), picked.playerId()));
            client.onDisconnect(gone::countDown);

            client.connect(address, port);
            gone.await();
        } catch (ConnectionException e) {
            logger.error("Failed to join {}:{}", address, port, e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static int port(String[] args, int index, int fallback) {
        if (args.length <= index) {
            return fallback;
        }
        try {
            return Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            logger.warn("Invalid port argument '{}', using port {}", args[index], fallback);
            return fallback;
        }
    }

    private static void usage() {
        logger.error("Usage: Main host [port] | Main join <address> [port]");
    }
}
