package com.switchboard.protocol;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON encoding of terminal frames.
 * <p>
 * {@link #readTargetTerminalId(String)} is the router's only view into a frame: it streams
 * the top-level object until {@code target_terminal_id} is found and never materialises the
 * payload. Full decoding is used only by the host terminal.
 */
public final class FrameCodec {

    public static final String TARGET_FIELD = "target_terminal_id";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final JsonFactory FACTORY = MAPPER.getFactory();

    private FrameCodec() {
        // utility class
    }

    /**
     * Reads the routing target of a frame.
     *
     * @return the target id, or empty when the frame has no string target
     * @throws FrameCodecException if the frame is not a JSON object
     */
    public static Optional<String> readTargetTerminalId(String frame) {
        if (frame == null) {
            throw new FrameCodecException("frame must not be null", null);
        }
        try (JsonParser parser = FACTORY.createParser(frame)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new FrameCodecException("frame is not a JSON object", null);
            }
            JsonToken token;
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (TARGET_FIELD.equals(field)) {
                    return value == JsonToken.VALUE_STRING ? Optional.of(parser.getText()) : Optional.empty();
                }
                parser.skipChildren();
            }
            if (token != JsonToken.END_OBJECT) {
                throw new FrameCodecException("frame is truncated", null);
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new FrameCodecException("frame is not valid JSON", e);
        }
    }

    /**
     * Decodes a full envelope.
     *
     * @throws FrameCodecException if the frame is malformed
     */
    public static TerminalMessage decode(String frame) {
        try {
            return MAPPER.readValue(frame, TerminalMessage.class);
        } catch (JsonProcessingException e) {
            throw new FrameCodecException("failed to decode terminal message", e);
        }
    }

    /**
     * Encodes an envelope to frame text.
     *
     * @throws FrameCodecException if serialization fails
     */
    public static String encode(TerminalMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new FrameCodecException("failed to encode terminal message " + message.traceId(), e);
        }
    }

    /** Converts a value (service response, terminal info) into a tree for embedding in an envelope. */
    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Converts a tree into {@code type}.
     *
     * @throws FrameCodecException if the tree does not bind
     */
    public static <T> T fromTree(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FrameCodecException("failed to bind " + type.getSimpleName(), e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
