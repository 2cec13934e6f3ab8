package com.flyknight.transport;

import com.flyknight.protocol.Message;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * Reliable, ordered, framed connection to one peer.
 *
 * Each frame is a 4-byte big-endian length followed by exactly that many
 * bytes of encoded {@link Message}. A partially received frame is never
 * surfaced as a message.
 *
 * Closing is scoped: once {@link #close()} returns, every blocked or later
 * {@link #send} and {@link #receive} fails with {@link ConnectionException}.
 */
public interface Transport extends AutoCloseable {

    /**
     * Writes one complete frame, blocking until it is handed to the socket.
     *
     * @throws ConnectionException if the connection is closed or the write fails
     */
    void send(Message message) throws ConnectionException;

    /**
     * Queues one frame without waiting. A failed write closes the connection,
     * which the owner observes as end-of-stream.
     *
     * @throws ConnectionException if the connection is already closed
     */
    void post(Message message) throws ConnectionException;

    /**
     * Blocks until the next message arrives. Read timeouts are absorbed.
     *
     * @return the next message, or empty once the peer has closed the stream
     * @throws ConnectionException if this side closed the transport
     */
    Optional<Message> receive() throws ConnectionException;

    boolean isOpen();

    SocketAddress remoteAddress();

    @Override
    void close();
}
