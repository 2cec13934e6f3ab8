package com.flyknight.handler;

import com.flyknight.protocol.Message;
import com.flyknight.server.ServerContext;
import com.flyknight.session.Session;
import com.flyknight.transport.ChannelTransport;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Binds one accepted connection to a session for its whole lifetime.
 *
 * - Connection up: ask the registry for a session (it may refuse when full)
 * - Message in: hand it to the router under the session's player id
 * - Connection down, for any reason: remove the session
 *
 * Threading Model:
 * - One instance per channel, always invoked on that channel's event loop
 * - Messages of a session are therefore routed strictly in arrival order,
 *   while different sessions route in parallel on their own loops
 *
 * Important: Never block in this handler! Writes go through
 * {@link ChannelTransport#post}, which only enqueues.
 */
public class SessionHandler extends SimpleChannelInboundHandler<Message> {

    private static final Logger logger = LoggerFactory.getLogger(SessionHandler.class);

    private final ServerContext context;
    private Session session;

    public SessionHandler(ServerContext context) {
        this.context = context;
    }

    /**
     * Called when a new connection is established.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ChannelTransport transport = new ChannelTransport(ctx.channel(), context.getConfig());
        session = context.getRegistry().accept(transport).orElse(null);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message message) {
        if (session == null) {
            logger.debug("Dropping {} from unregistered connection {}", message.getType(), ctx.channel().remoteAddress());
            return;
        }
        context.getRouter().route(session.getId(), message);
    }

    /**
     * Called when the connection is closed, by either side.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            context.getRegistry().remove(session.getId());
        }
        super.channelInactive(ctx);
    }

    // === Netty Event Handlers ===

    /**
     * Handles idle state events, installed only when an idle timeout is configured.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Player {} idle for {}s, closing",
                        session != null ? session.getId() : "?", context.getConfig().getIdleTimeoutSeconds());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String who = session != null ? "player " + session.getId() : String.valueOf(ctx.channel().remoteAddress());
        if (cause instanceof TooLongFrameException) {
            logger.warn("Oversized frame from {}, closing: {}", who, cause.getMessage());
        } else if (cause instanceof IOException) {
            logger.info("Connection error for {}: {}", who, cause.getMessage());
        } else {
            logger.error("Unexpected error for {}", who, cause);
        }
        ctx.close();
    }
}
