package com.flyknight.transport;

import com.flyknight.protocol.CodecException;
import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageCodec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns complete frame bodies into messages.
 *
 * Sits behind the length-field decoder, so every buffer it sees is exactly
 * one frame. A frame that does not decode is logged and dropped; the
 * connection stays open.
 */
public class MessageFrameDecoder extends MessageToMessageDecoder<ByteBuf> {

    private static final Logger logger = LoggerFactory.getLogger(MessageFrameDecoder.class);

    private final MessageCodec codec;

    public MessageFrameDecoder(MessageCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        byte[] bytes = ByteBufUtil.getBytes(frame);
        try {
            Message message = codec.decode(bytes);
            out.add(message);
        } catch (CodecException e) {
            logger.warn("Dropping undecodable frame ({} bytes) from {}: {}",
                    bytes.length, ctx.channel().remoteAddress(), e.getMessage());
        }
    }
}
