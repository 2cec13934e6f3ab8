package com.flyknight.transport;

import com.flyknight.protocol.Message;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Last handler of a buffered pipeline: parks decoded messages until a
 * blocking reader picks them up, and marks the end of the stream once the
 * channel goes inactive.
 */
class InboundQueue extends ChannelInboundHandlerAdapter {

    private static final Logger logger = LoggerFactory.getLogger(InboundQueue.class);

    static final Object END_OF_STREAM = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof Message) {
            queue.offer(msg);
        } else {
            logger.warn("Discarding unexpected inbound object: {}", msg.getClass().getName());
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        endOfStream();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("Connection error on {}, closing", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    void endOfStream() {
        queue.offer(END_OF_STREAM);
    }

    /**
     * Waits up to {@code timeout} for the next message or the end-of-stream
     * marker. The marker is never consumed, so every later poll sees it too.
     *
     * @return a {@link Message}, {@link #END_OF_STREAM}, or null on timeout
     */
    Object poll(Duration timeout) throws InterruptedException {
        Object next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == END_OF_STREAM) {
            queue.offer(END_OF_STREAM);
        }
        return next;
    }
}
