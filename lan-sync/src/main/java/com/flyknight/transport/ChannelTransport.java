package com.flyknight.transport;

import com.flyknight.config.SyncConfig;
import com.flyknight.protocol.Message;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over a Netty channel whose pipeline was set up by
 * {@link FramePipeline}.
 *
 * Threading Model:
 * - {@link #post} only enqueues a write on the channel's event loop and is
 *   safe to call from event-loop threads (the host uses it everywhere)
 * - {@link #send} waits for the write to complete and must not be called
 *   from the channel's own event loop
 * - {@link #receive} needs the buffered pipeline and is meant for one
 *   dedicated reader thread (the client mirror's receive worker)
 */
public class ChannelTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(ChannelTransport.class);

    private final Channel channel;
    private final Duration receiveTimeout;
    private final Duration sendTimeout;
    private final InboundQueue inbound;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ChannelTransport(Channel channel, SyncConfig config) {
        this(channel, config.getReceiveTimeout(), config.getSendTimeout());
    }

    public ChannelTransport(Channel channel, Duration receiveTimeout, Duration sendTimeout) {
        this.channel = channel;
        this.receiveTimeout = receiveTimeout;
        this.sendTimeout = sendTimeout;
        this.inbound = channel.pipeline().get(InboundQueue.class);
    }

    @Override
    public void send(Message message) throws ConnectionException {
        ChannelFuture future = write(message);
        try {
            if (!future.await(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new ConnectionException("Send to " + remoteAddress() + " timed out after " + sendTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while sending to " + remoteAddress(), e);
        }
        if (!future.isSuccess()) {
            throw new ConnectionException("Send to " + remoteAddress() + " failed", future.cause());
        }
    }

    @Override
    public void post(Message message) throws ConnectionException {
        write(message).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.debug("Write of {} to {} failed, closing", message.getType(), remoteAddress(), future.cause());
                future.channel().close();
            }
        });
    }

    private ChannelFuture write(Message message) throws ConnectionException {
        if (closed.get() || !channel.isActive()) {
            throw new ConnectionException("Connection to " + remoteAddress() + " is closed");
        }
        return channel.writeAndFlush(message);
    }

    @Override
    public Optional<Message> receive() throws ConnectionException {
        if (inbound == null) {
            throw new IllegalStateException("Channel " + channel + " has no inbound queue; "
                    + "messages are consumed by its pipeline");
        }
        while (true) {
            if (closed.get()) {
                throw new ConnectionException("Transport to " + remoteAddress() + " is closed");
            }

            Object next;
            try {
                next = inbound.poll(receiveTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while receiving from " + remoteAddress(), e);
            }

            if (next == null) {
                // Read timeout: nothing arrived yet, keep waiting
                continue;
            }
            if (next == InboundQueue.END_OF_STREAM) {
                if (closed.get()) {
                    throw new ConnectionException("Transport to " + remoteAddress() + " is closed");
                }
                return Optional.empty();
            }
            return Optional.of((Message) next);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Closes the channel and wakes any reader blocked in {@link #receive()}.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (inbound != null) {
                inbound.endOfStream();
            }
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "ChannelTransport{" +
                "remote=" + remoteAddress() +
                ", open=" + isOpen() +
                '}';
    }
}
