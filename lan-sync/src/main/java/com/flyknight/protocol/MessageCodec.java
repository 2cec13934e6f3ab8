package com.flyknight.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Turns messages into frame bodies and back.
 *
 * Current Implementation: JSON using Jackson, one versioned envelope per frame.
 * Decoding is schema-driven: the type tag selects the payload record from
 * {@link MessageType}, the type's required fields must all be present, and
 * the payload may not carry properties the record does not declare. Anything
 * else fails with {@link CodecException}; a partially-filled message is never
 * returned.
 *
 * The codec is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageCodec {

    /**
     * Envelope version written by this codec and the only one it accepts.
     */
    public static final int SCHEMA_VERSION = 1;

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this.objectMapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                // 12.9 must not silently become 12 in an int field
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    /**
     * Serializes a message to the UTF-8 JSON body of one frame.
     *
     * @param message The message to serialize
     * @return Encoded bytes, without the length prefix
     */
    public byte[] encode(Message message) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("v", SCHEMA_VERSION);
            root.put("type", message.getType().tag());
            root.put("timestamp", message.getTimestamp());
            root.set("payload", objectMapper.valueToTree(message.getPayload()));
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException("Failed to encode " + message, e);
        }
    }

    /**
     * Deserializes one frame body into a message.
     *
     * @param bytes The frame body, without the length prefix
     * @return Fully-initialized message
     * @throws CodecException if the bytes do not describe a valid message
     */
    public Message decode(byte[] bytes) {
        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new CodecException("Malformed frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("Frame is not a JSON object");
        }

        JsonNode version = root.get("v");
        if (version == null || !version.canConvertToInt() || version.intValue() != SCHEMA_VERSION) {
            throw new CodecException("Unsupported schema version: " + version);
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new CodecException("Missing message type");
        }
        MessageType type = MessageType.fromTag(typeNode.textValue())
                .orElseThrow(() -> new CodecException("Unknown message type: " + typeNode.textValue()));

        JsonNode timestamp = root.get("timestamp");
        if (timestamp == null || !timestamp.isNumber()) {
            throw new CodecException("Missing timestamp on " + type.tag());
        }

        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) {
            throw new CodecException("Missing payload on " + type.tag());
        }
        for (String field : type.requiredFields()) {
            if (!payloadNode.hasNonNull(field)) {
                throw new CodecException("Payload of " + type.tag() + " is missing '" + field + "'");
            }
        }

        Object payload;
        try {
            payload = objectMapper.treeToValue(payloadNode, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException("Invalid payload for " + type.tag(), e);
        }
        if (payload == null) {
            throw new CodecException("Empty payload for " + type.tag());
        }

        return Message.of(type, payload, timestamp.doubleValue());
    }
}
