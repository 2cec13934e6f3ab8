package com.flyknight.session;

import com.flyknight.transport.Transport;

import java.net.SocketAddress;

/**
 * Represents a connected player's session on the host.
 *
 * Each accepted connection that fits under the player cap gets a Session
 * that tracks:
 * - The player id allocated by the registry
 * - The transport used to reach the player
 * - The peer address, kept for logging after the channel is gone
 *
 * Thread Safety:
 * - All fields are immutable after creation
 * - The transport itself is safe to post to from any thread
 */
public class Session {

    private final int id;
    private final Transport transport;
    private final SocketAddress address;
    private final long connectedAt;

    public Session(int id, Transport transport) {
        this.id = id;
        this.transport = transport;
        this.address = transport.remoteAddress();
        this.connectedAt = System.currentTimeMillis();
    }

    public int getId() {
        return id;
    }

    public Transport getTransport() {
        return transport;
    }

    public SocketAddress getAddress() {
        return address;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    /**
     * Checks if the session's connection is still open.
     */
    public boolean isActive() {
        return transport.isOpen();
    }

    @Override
    public String toString() {
        return "Session{" +
                "id=" + id +
                ", address=" + address +
                ", active=" + isActive() +
                '}';
    }
}
