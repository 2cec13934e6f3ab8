package com.flyknight.transport;

import com.flyknight.protocol.*;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the framing layer:
 * - Length prefix is 4 bytes, big-endian
 * - Partial frames are held back until complete
 * - Bad frames are dropped without closing the connection
 */
@DisplayName("Frame Pipeline Tests")
class FramePipelineTest {

    private MessageCodec codec;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        codec = new MessageCodec();
        channel = new EmbeddedChannel();
        FramePipeline.install(channel.pipeline(), codec, 1024);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ByteBuf frame(byte[] body) {
        return Unpooled.buffer().writeInt(body.length).writeBytes(body);
    }

    // ==========================================
    // Test: Inbound
    // ==========================================

    @Test
    @DisplayName("A frame split across reads decodes once it is complete")
    void testPartialFrame() {
        Message original = Message.of(MessageType.PICKUP_ITEM, new PickupItem(9), 3.0);
        ByteBuf whole = frame(codec.encode(original));
        ByteBuf head = whole.readRetainedSlice(6);

        channel.writeInbound(head);
        assertNull(channel.readInbound(), "Nothing should surface from a partial frame");

        channel.writeInbound(whole);
        assertEquals(original, channel.readInbound());
    }

    @Test
    @DisplayName("Several frames in one read decode in order")
    void testCoalescedFrames() {
        Message first = Message.of(MessageType.PICKUP_ITEM, new PickupItem(1), 1.0);
        Message second = Message.of(MessageType.ENEMY_DAMAGE, EnemyDamage.of(7, 20), 2.0);
        ByteBuf both = Unpooled.wrappedBuffer(frame(codec.encode(first)), frame(codec.encode(second)));

        channel.writeInbound(both);

        assertEquals(first, channel.readInbound());
        assertEquals(second, channel.readInbound());
    }

    @Test
    @DisplayName("A malformed frame is dropped and the next one still decodes")
    void testMalformedFrameDropped() {
        Message valid = Message.of(MessageType.PICKUP_ITEM, new PickupItem(4), 1.0);

        channel.writeInbound(frame("{\"v\":1,\"type\":".getBytes(StandardCharsets.UTF_8)));
        channel.writeInbound(frame(codec.encode(valid)));

        assertEquals(valid, channel.readInbound());
        assertNull(channel.readInbound());
        assertTrue(channel.isOpen(), "Connection should survive a bad frame");
    }

    @Test
    @DisplayName("A frame longer than the limit fails the channel")
    void testOversizedFrame() {
        ByteBuf huge = Unpooled.buffer().writeInt(4096).writeBytes(new byte[16]);

        assertThrows(TooLongFrameException.class, () -> channel.writeInbound(huge));
    }

    // ==========================================
    // Test: Outbound
    // ==========================================

    @Test
    @DisplayName("Outbound messages get a big-endian length prefix")
    void testOutboundFraming() {
        Message message = Message.of(MessageType.PLAYER_JOINED, new PlayerRef(2), 5.0);
        byte[] body = codec.encode(message);

        channel.writeOutbound(message);

        ByteBuf written = Unpooled.buffer();
        ByteBuf part;
        while ((part = channel.readOutbound()) != null) {
            written.writeBytes(part);
            part.release();
        }
        assertEquals(4 + body.length, written.readableBytes());
        assertEquals(body.length, written.readInt());
        byte[] actual = new byte[body.length];
        written.readBytes(actual);
        assertArrayEquals(body, actual);
        written.release();
    }
}
