package com.switchboard.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire envelope exchanged between terminals.
 * <p>
 * The hub itself only reads {@code target_terminal_id} when routing; the full envelope
 * matters only to terminals, including the hub's own host terminal. A request carries
 * {@code method} and {@code req}; its response reuses the {@code trace_id}, swaps source
 * and target, and carries {@code res} with {@code done = true}. Channel pushes carry
 * {@code channel_id} and {@code frame}.
 *
 * @param traceId          correlates a request with its responses
 * @param method           service name for requests (nullable otherwise)
 * @param channelId        channel name for channel frames (nullable otherwise)
 * @param sourceTerminalId sending terminal
 * @param targetTerminalId receiving terminal; the only field the router reads
 * @param req              request body
 * @param res              response body
 * @param frame            channel payload
 * @param done             true on the last response for a trace
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerminalMessage(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("method") String method,
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("source_terminal_id") String sourceTerminalId,
        @JsonProperty("target_terminal_id") String targetTerminalId,
        @JsonProperty("req") JsonNode req,
        @JsonProperty("res") JsonNode res,
        @JsonProperty("frame") JsonNode frame,
        @JsonProperty("done") Boolean done) {

    /** Creates a request for {@code method} on {@code target}. */
    public static TerminalMessage request(String traceId, String method, String source, String target, JsonNode req) {
        return new TerminalMessage(traceId, method, null, source, target, req, null, null, null);
    }

    /** Creates the final response to {@code request}, sent back to its source. */
    public static TerminalMessage responseTo(TerminalMessage request, JsonNode res) {
        return new TerminalMessage(request.traceId(), request.method(), null,
                request.targetTerminalId(), request.sourceTerminalId(), null, res, null, true);
    }

    /** Creates a channel push. */
    public static TerminalMessage channelFrame(String traceId, String channelId, String source, String target,
                                               JsonNode frame) {
        return new TerminalMessage(traceId, null, channelId, source, target, null, null, frame, null);
    }

    /** True when the envelope is a service request. */
    public boolean isRequest() {
        return method != null && !isResponse();
    }

    /** True when the envelope is a response to an earlier request. */
    public boolean isResponse() {
        return res != null && !res.isNull();
    }
}
