package com.flyknight.server;

import com.flyknight.handler.MessageRouter;
import com.flyknight.protocol.EnemyDamage;
import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageType;
import com.flyknight.session.SessionRegistry;
import com.flyknight.state.EnemyView;
import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.GameStateStore;
import com.flyknight.transport.ChannelTransport;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Broadcast Loop Tests")
class BroadcastLoopTest {

    private GameStateStore store;
    private SessionRegistry registry;
    private BroadcastLoop loop;

    @BeforeEach
    void setUp() {
        store = new GameStateStore(new GameStateSnapshot(
                Map.of(), Map.of(7, EnemyView.of(7, "goblin", 60)), Map.of(), null, 1));
        registry = new SessionRegistry(store, 4);
        loop = new BroadcastLoop(store, registry, Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    private EmbeddedChannel connect() {
        EmbeddedChannel channel = new EmbeddedChannel();
        registry.accept(new ChannelTransport(channel, Duration.ofSeconds(1), Duration.ofSeconds(1)));
        return channel;
    }

    private static List<Message> drain(EmbeddedChannel channel) {
        List<Message> messages = new ArrayList<>();
        Message next;
        while ((next = channel.readOutbound()) != null) {
            messages.add(next);
        }
        return messages;
    }

    @Test
    @DisplayName("One tick sends the current snapshot to every session")
    void testTickReachesEveryone() {
        EmbeddedChannel first = connect();
        EmbeddedChannel second = connect();
        drain(first);
        drain(second);
        store.damageEnemy(7, 15);

        loop.tick();

        for (EmbeddedChannel peer : List.of(first, second)) {
            List<Message> received = drain(peer);
            assertEquals(1, received.size());
            assertEquals(MessageType.GAME_STATE, received.get(0).getType());
            assertEquals(store.snapshot(), received.get(0).getPayload());
        }
        assertEquals(1, loop.getTickCount());
    }

    @Test
    @DisplayName("A dead session does not stop delivery to the others")
    void testDeadSessionIsolated() {
        EmbeddedChannel dead = connect();
        EmbeddedChannel alive = connect();
        drain(alive);
        dead.close();

        loop.tick();

        List<Message> received = drain(alive);
        assertEquals(MessageType.GAME_STATE, received.get(0).getType());
        assertEquals(1, registry.getSessionCount());
    }

    @Test
    @DisplayName("A kill landing mid-tick never lets a stale snapshot revive the enemy")
    void testKillDuringTickStaysDead() throws Exception {
        AtomicBoolean armed = new AtomicBoolean(false);
        AtomicReference<MessageRouter> routerRef = new AtomicReference<>();
        AtomicReference<Thread> killer = new AtomicReference<>();
        GameStateStore racingStore = new GameStateStore(new GameStateSnapshot(
                Map.of(), Map.of(7, EnemyView.of(7, "goblin", 60)), Map.of(), null, 1)) {
            @Override
            public GameStateSnapshot snapshot() {
                GameStateSnapshot copy = super.snapshot();
                if (armed.compareAndSet(true, false)) {
                    // The enemy dies right after the tick copied the world
                    Thread thread = new Thread(() -> routerRef.get().route(0,
                            Message.of(MessageType.ENEMY_DAMAGE, EnemyDamage.of(7, 60))));
                    killer.set(thread);
                    thread.start();
                    try {
                        thread.join(200);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return copy;
            }
        };
        SessionRegistry racingRegistry = new SessionRegistry(racingStore, 4);
        routerRef.set(new MessageRouter(racingStore, racingRegistry));
        BroadcastLoop racingLoop = new BroadcastLoop(racingStore, racingRegistry, Duration.ofMillis(20));
        EmbeddedChannel peer = new EmbeddedChannel();
        racingRegistry.accept(new ChannelTransport(peer, Duration.ofSeconds(1), Duration.ofSeconds(1)));
        drain(peer);

        armed.set(true);
        racingLoop.tick();
        killer.get().join(5000);
        racingLoop.tick();

        List<Message> received = drain(peer);
        List<MessageType> types = new ArrayList<>();
        boolean died = false;
        for (Message message : received) {
            types.add(message.getType());
            if (message.getType() == MessageType.ENEMY_DIED) {
                died = true;
            } else if (died && message.getType() == MessageType.GAME_STATE) {
                GameStateSnapshot snapshot = (GameStateSnapshot) message.getPayload();
                assertFalse(snapshot.enemies().containsKey(7),
                        "game_state after enemy_died must not contain the enemy, order was " + types);
            }
        }
        assertTrue(died, "enemy_died should have been broadcast");
        assertNull(racingStore.getEnemy(7));
    }

    @Test
    @DisplayName("Running loop ticks repeatedly and stops cleanly")
    void testRunningLoop() throws Exception {
        EmbeddedChannel peer = connect();
        drain(peer);

        loop.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (loop.getTickCount() < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        loop.stop();

        assertTrue(loop.getTickCount() >= 5, "Loop should have ticked at least 5 times");
        assertFalse(loop.isRunning());

        long stoppedAt = loop.getTickCount();
        Thread.sleep(100);
        assertEquals(stoppedAt, loop.getTickCount(), "No ticks after stop");
    }
}
