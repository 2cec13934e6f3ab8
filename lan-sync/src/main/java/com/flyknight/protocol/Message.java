package com.flyknight.protocol;

import java.util.Objects;

/**
 * Represents a message in the sync protocol.
 *
 * This class is immutable for thread safety - once created, it cannot be modified.
 * The host hands the same instance to every session during a broadcast.
 *
 * The payload is always an instance of {@link MessageType#payloadType()};
 * construction fails otherwise, so a message can never carry a payload its
 * receiver does not expect.
 *
 * JSON format (see {@link MessageCodec}):
 * {
 *     "v": 1,
 *     "type": "enemy_damage",
 *     "timestamp": 1718000000.125,
 *     "payload": { "enemy_id": 7, "damage": 20, "drops": [] }
 * }
 */
public final class Message {

    private final MessageType type;
    private final Object payload;
    private final double timestamp;

    private Message(MessageType type, Object payload, double timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = Objects.requireNonNull(payload, "payload");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload for " + type.tag() + " must be "
                    + type.payloadType().getSimpleName() + ", got " + payload.getClass().getSimpleName());
        }
        this.timestamp = timestamp;
    }

    /**
     * Creates a message stamped with the current wall-clock time.
     */
    public static Message of(MessageType type, Object payload) {
        return new Message(type, payload, System.currentTimeMillis() / 1000.0);
    }

    public static Message of(MessageType type, Object payload, double timestamp) {
        return new Message(type, payload, timestamp);
    }

    public MessageType getType() {
        return type;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * Returns the payload cast to the record registered for this type.
     */
    public <P> P payloadAs(Class<P> payloadClass) {
        return payloadClass.cast(payload);
    }

    /**
     * Seconds since the epoch at which the sender created the message.
     */
    public double getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return type == other.type
                && Double.compare(timestamp, other.timestamp) == 0
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload, timestamp);
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type.tag() +
                ", timestamp=" + timestamp +
                '}';
    }
}
