package com.flyknight.server;

import com.flyknight.client.EventKind;
import com.flyknight.client.GameClient;
import com.flyknight.config.SyncConfig;
import com.flyknight.protocol.*;
import com.flyknight.state.*;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over loopback sockets:
 * - Join handshake and snapshot delivery
 * - Capacity, disconnect and combat scenarios
 * - Peers converge on host changes within a few ticks
 */
@DisplayName("Sync Server Integration Tests")
class SyncServerIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private SyncServer server;
    private final List<GameClient> clients = new ArrayList<>();

    @BeforeEach
    void startServer() throws Exception {
        SyncConfig config = SyncConfig.builder()
                .bindAddress("127.0.0.1")
                .port(0)
                .tickRate(30)
                .build();
        GameStateSnapshot world = new GameStateSnapshot(
                Map.of(),
                Map.of(7, EnemyView.of(7, "goblin", 30), 8, EnemyView.of(8, "skeleton", 500)),
                Map.of(3, new ItemView(3, "potion", "health", "Red Flask", 50, 60)),
                new DungeonDescriptor(1, 0, List.of(), 10, 10),
                1);
        server = new SyncServer(config, world);
        server.start();
    }

    @AfterEach
    void stopServer() {
        clients.forEach(GameClient::close);
        server.shutdown();
    }

    private GameClient newClient() {
        GameClient client = new GameClient(SyncConfig.builder().receiveTimeout(Duration.ofMillis(200)).build());
        clients.add(client);
        return client;
    }

    private GameClient join() throws Exception {
        GameClient client = newClient();
        client.connect("127.0.0.1", server.getPort());
        awaitCondition(() -> client.getPlayerId().isPresent(), "welcome");
        return client;
    }

    private static void awaitCondition(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    // ==========================================
    // Test: Join
    // ==========================================

    @Test
    @DisplayName("Joiner gets welcome first, with the exact host world")
    void testJoinHandshake() throws Exception {
        GameStateSnapshot expected = server.snapshot();
        List<MessageType> order = new CopyOnWriteArrayList<>();
        CompletableFuture<Welcome> welcome = new CompletableFuture<>();

        GameClient client = newClient();
        client.events().subscribe(EventKind.WELCOME, w -> {
            order.add(MessageType.WELCOME);
            welcome.complete(w);
        });
        client.events().subscribe(EventKind.GAME_STATE, state -> order.add(MessageType.GAME_STATE));
        client.connect("127.0.0.1", server.getPort());

        Welcome received = welcome.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        awaitCondition(() -> order.size() >= 2, "first game_state");

        assertEquals(0, received.playerId());
        assertEquals(expected, received.gameState(), "Welcome should carry the world byte for byte");
        assertEquals(MessageType.WELCOME, order.get(0), "Welcome must precede any game_state");
        System.out.println("✓ Join handshake: welcome then game_state");
    }

    @Test
    @DisplayName("Existing players hear about the newcomer")
    void testPlayerJoinedBroadcast() throws Exception {
        GameClient first = join();
        CompletableFuture<PlayerRef> joined = new CompletableFuture<>();
        first.events().subscribe(EventKind.PLAYER_JOINED, joined::complete);

        GameClient second = join();

        assertEquals(second.getPlayerId().getAsInt(),
                joined.get(WAIT.toMillis(), TimeUnit.MILLISECONDS).playerId());
    }

    @Test
    @DisplayName("A fifth peer is disconnected without an id")
    void testCapacity() throws Exception {
        for (int i = 0; i < 4; i++) {
            join();
        }
        CountDownLatch dropped = new CountDownLatch(1);

        GameClient fifth = newClient();
        fifth.onDisconnect(dropped::countDown);
        fifth.connect("127.0.0.1", server.getPort());

        assertTrue(dropped.await(WAIT.toMillis(), TimeUnit.MILLISECONDS), "Fifth peer should be dropped");
        assertTrue(fifth.getPlayerId().isEmpty(), "Fifth peer should never be welcomed");
        assertEquals(4, server.getContext().getRegistry().getSessionCount());
    }

    // ==========================================
    // Test: Disconnect
    // ==========================================

    @Test
    @DisplayName("A leaving peer produces exactly one player_left")
    void testDisconnect() throws Exception {
        GameClient stayer = join();
        GameClient leaver = join();
        int leaverId = leaver.getPlayerId().getAsInt();
        leaver.sendPlayerUpdate(PlayerView.builder().name("Leaver").build());
        awaitCondition(() -> stayer.getSnapshot().players().containsKey(leaverId), "leaver in snapshot");

        AtomicInteger leftEvents = new AtomicInteger();
        stayer.events().subscribe(EventKind.PLAYER_LEFT, ref -> {
            if (ref.playerId() == leaverId) {
                leftEvents.incrementAndGet();
            }
        });

        leaver.disconnect();

        awaitCondition(() -> leftEvents.get() == 1, "player_left");
        awaitCondition(() -> !stayer.getSnapshot().players().containsKey(leaverId), "leaver gone from snapshot");
        Thread.sleep(200);
        assertEquals(1, leftEvents.get(), "player_left must be sent once");
        assertFalse(server.getContext().getRegistry().isLive(leaverId));
    }

    @Test
    @DisplayName("Host shutdown reaches peers as a disconnect")
    void testHostShutdown() throws Exception {
        GameClient client = join();
        CountDownLatch gone = new CountDownLatch(1);
        client.onDisconnect(gone::countDown);

        server.shutdown();

        assertTrue(gone.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertFalse(client.isConnected());
    }

    // ==========================================
    // Test: Combat and Items
    // ==========================================

    @Test
    @DisplayName("A lethal hit removes the enemy for everyone")
    void testLethalDamage() throws Exception {
        GameClient attacker = join();
        GameClient witness = join();
        CompletableFuture<EnemyDied> died = new CompletableFuture<>();
        witness.events().subscribe(EventKind.ENEMY_DIED, died::complete);

        attacker.sendEnemyDamage(7, 50, List.of("gold"));

        assertEquals(new EnemyDied(7, List.of("gold")), died.get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        awaitCondition(() -> !witness.getSnapshot().enemies().containsKey(7), "enemy gone from snapshot");
        assertNull(server.getContext().getStore().getEnemy(7));
    }

    @Test
    @DisplayName("A non-lethal hit is announced with the remaining hp")
    void testNonLethalDamage() throws Exception {
        GameClient attacker = join();
        CompletableFuture<EnemyDamaged> damaged = new CompletableFuture<>();
        attacker.events().subscribe(EventKind.ENEMY_DAMAGED, damaged::complete);

        attacker.sendEnemyDamage(8, 120);

        assertEquals(new EnemyDamaged(8, 380), damaged.get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        awaitCondition(() -> attacker.getSnapshot().enemies().get(8).hp() == 380, "hp in snapshot");
    }

    @Test
    @DisplayName("Two players killing the same enemy at once yield one death")
    void testSimultaneousKill() throws Exception {
        GameClient first = join();
        GameClient second = join();
        AtomicInteger deaths = new AtomicInteger();
        first.events().subscribe(EventKind.ENEMY_DIED, died -> deaths.incrementAndGet());

        first.sendEnemyDamage(7, 100);
        second.sendEnemyDamage(7, 100);

        awaitCondition(() -> deaths.get() >= 1, "enemy_died");
        Thread.sleep(300);
        assertEquals(1, deaths.get(), "Enemy can die only once");
    }

    @Test
    @DisplayName("An item goes to whoever grabs it first")
    void testPickup() throws Exception {
        GameClient grabber = join();
        GameClient other = join();
        CompletableFuture<ItemPickedUp> picked = new CompletableFuture<>();
        other.events().subscribe(EventKind.ITEM_PICKED_UP, picked::complete);

        grabber.sendPickupItem(3);

        ItemPickedUp event = picked.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertEquals(3, event.itemId());
        assertEquals(grabber.getPlayerId().getAsInt(), event.playerId());
        assertFalse(server.getContext().getStore().hasItem(3));
    }

    @Test
    @DisplayName("Attacks are relayed to the other players")
    void testAttackRelay() throws Exception {
        GameClient attacker = join();
        GameClient watcher = join();
        CompletableFuture<PlayerAttack> seen = new CompletableFuture<>();
        watcher.events().subscribe(EventKind.PLAYER_ATTACK, seen::complete);
        AttackData swing = new AttackData(25, 60, 0.5, 100, 120);

        attacker.sendAttack(swing);

        PlayerAttack attack = seen.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertEquals(attacker.getPlayerId().getAsInt(), attack.playerId());
        assertEquals(swing, attack.attackData());
    }

    // ==========================================
    // Test: Staleness
    // ==========================================

    @Test
    @DisplayName("Host-side changes reach every peer within a few ticks")
    void testStalenessBound() throws Exception {
        GameClient first = join();
        GameClient second = join();

        long start = System.nanoTime();
        server.updateGameState(GameStateUpdate.builder().level(3).build());

        awaitCondition(() -> first.getSnapshot().level() == 3 && second.getSnapshot().level() == 3, "level 3");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        System.out.println("✓ Level change visible on all peers after " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "Peers should converge well within a second, took " + elapsedMs + "ms");
    }

    // ==========================================
    // Test: Bind Failure
    // ==========================================

    @Test
    @DisplayName("Binding a taken port fails with BindFailedException")
    void testBindFailure() throws IOException {
        try (ServerSocket taken = new ServerSocket(0)) {
            SyncServer second = new SyncServer(SyncConfig.builder()
                    .port(taken.getLocalPort())
                    .build());

            assertThrows(BindFailedException.class, second::start);
        }
    }
}
