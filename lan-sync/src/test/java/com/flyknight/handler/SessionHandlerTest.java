package com.flyknight.handler;

import com.flyknight.config.SyncConfig;
import com.flyknight.protocol.*;
import com.flyknight.server.ServerContext;
import com.flyknight.state.EnemyView;
import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.PlayerView;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Session Handler Tests")
class SessionHandlerTest {

    private ServerContext context;

    @BeforeEach
    void setUp() {
        context = new ServerContext(SyncConfig.defaults(), new GameStateSnapshot(
                Map.of(), Map.of(7, EnemyView.of(7, "goblin", 60)), Map.of(), null, 1));
    }

    @Test
    @DisplayName("Connecting registers a session and sends welcome")
    void testConnectRegisters() {
        EmbeddedChannel channel = new EmbeddedChannel(new SessionHandler(context));

        Message welcome = channel.readOutbound();

        assertEquals(MessageType.WELCOME, welcome.getType());
        assertEquals(0, welcome.payloadAs(Welcome.class).playerId());
        assertTrue(context.getRegistry().isLive(0));
    }

    @Test
    @DisplayName("Inbound messages are routed under the session's id")
    void testInboundRouted() {
        EmbeddedChannel channel = new EmbeddedChannel(new SessionHandler(context));
        channel.readOutbound();

        channel.writeInbound(Message.of(MessageType.PLAYER_UPDATE, PlayerView.builder().playerId(5).build()));
        channel.writeInbound(Message.of(MessageType.ENEMY_DAMAGE, EnemyDamage.of(7, 10)));

        assertNotNull(context.getStore().getPlayer(0));
        assertEquals(50, context.getStore().getEnemy(7).hp());
        Message damaged = channel.readOutbound();
        assertEquals(new EnemyDamaged(7, 50), damaged.getPayload());
    }

    @Test
    @DisplayName("Closing the connection removes the session")
    void testCloseRemoves() {
        EmbeddedChannel channel = new EmbeddedChannel(new SessionHandler(context));

        channel.close();

        assertFalse(context.getRegistry().isLive(0));
        assertEquals(0, context.getRegistry().getSessionCount());
    }

    @Test
    @DisplayName("A connection beyond capacity is closed without a session")
    void testRejectedConnection() {
        for (int i = 0; i < context.getConfig().getMaxPlayers(); i++) {
            new EmbeddedChannel(new SessionHandler(context));
        }

        EmbeddedChannel rejected = new EmbeddedChannel(new SessionHandler(context));

        assertFalse(rejected.isOpen());
        assertNull(rejected.readOutbound(), "No welcome for a rejected peer");
        assertEquals(context.getConfig().getMaxPlayers(), context.getRegistry().getSessionCount());
    }

    @Test
    @DisplayName("Reader idle closes the connection")
    void testIdleCloses() {
        EmbeddedChannel channel = new EmbeddedChannel(new SessionHandler(context));

        channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);
        channel.runPendingTasks();

        assertFalse(channel.isOpen());
        assertFalse(context.getRegistry().isLive(0));
    }
}
