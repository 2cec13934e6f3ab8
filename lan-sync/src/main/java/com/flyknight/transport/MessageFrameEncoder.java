package com.flyknight.transport;

import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageCodec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes the encoded body of a message; the length prefix is added further
 * down the pipeline.
 */
public class MessageFrameEncoder extends MessageToByteEncoder<Message> {

    private final MessageCodec codec;

    public MessageFrameEncoder(MessageCodec codec) {
        super(Message.class);
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Message message, ByteBuf out) {
        out.writeBytes(codec.encode(message));
    }
}
