package com.questrail.shepherd.protocol.internal.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Shared Jackson mapper for JSON control payloads.
 *
 * <p>Control payloads are compact single-line UTF-8 JSON. The mapper is
 * thread-safe once configured and is never reconfigured after class init.</p>
 */
public final class ProtocolJson
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProtocolJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize control payload", e);
        }
    }

    /**
     * Parses a control payload.
     *
     * @throws IOException if the payload is not well-formed JSON
     */
    public static JsonNode readTree(byte[] payload) throws IOException {
        JsonNode node = MAPPER.readTree(payload);
        if (node == null || node.isMissingNode()) {
            throw new IOException("empty control payload");
        }
        return node;
    }
}
