package com.flyknight.transport;

import com.flyknight.protocol.MessageCodec;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Installs the wire format on a channel pipeline.
 *
 * Inbound:  bytes → [4-byte length | body] frames → Message
 * Outbound: Message → body → length-prefixed frame → bytes
 */
public final class FramePipeline {

    public static final int LENGTH_FIELD_BYTES = 4;

    private FramePipeline() {
    }

    /**
     * Adds the framing and message codec handlers. Application handlers go after these.
     */
    public static void install(ChannelPipeline pipeline, MessageCodec codec, int maxFrameLength) {
        // Strips the length field; frames above the limit fail the channel
        pipeline.addLast("frame-decoder", new LengthFieldBasedFrameDecoder(
                maxFrameLength, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("frame-prepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast("message-decoder", new MessageFrameDecoder(codec));
        pipeline.addLast("message-encoder", new MessageFrameEncoder(codec));
    }

    /**
     * Wire format plus an inbound queue, for channels read through
     * {@link Transport#receive()} rather than by a pipeline handler.
     */
    public static void installBuffered(ChannelPipeline pipeline, MessageCodec codec, int maxFrameLength) {
        install(pipeline, codec, maxFrameLength);
        pipeline.addLast("inbound-queue", new InboundQueue());
    }
}
