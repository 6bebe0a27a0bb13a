package com.switchboard.hub.domain;

import com.switchboard.observability.MetricFactory;
import com.switchboard.protocol.FrameCodec;
import com.switchboard.protocol.FrameCodecException;
import io.micrometer.core.instrument.Counter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards frames between the terminals of one tenant.
 *
 * <p>Only {@code target_terminal_id} is read from a frame; the text that reaches the target
 * is the exact text that was received. Frames whose target is unknown, not connected or
 * unreadable are dropped without notifying the sender.
 *
 * <p>A request from {@code t1} to {@code t2}, as written by {@code t1} and as read by {@code t2}:
 *
 * <pre>{@code
 * {"trace_id":"7f0c","method":"Echo","source_terminal_id":"t1",
 *  "target_terminal_id":"t2","req":{"v":7}}
 * }</pre>
 *
 * <p>Fields the router does not know, key order and whitespace survive untouched. Frames
 * addressed to the host terminal go to {@link com.switchboard.hub.domain.host.HostTerminal#receive(String)}
 * instead of a socket; the host answers through this same router.
 *
 * <p>WHY: terminals sign nothing per frame, so the router never trusts {@code source_terminal_id}
 * for authorisation. Tenant isolation comes from the connection: a frame can only reach the
 * terminals of the tenant whose socket it arrived on.
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    /** Outcome of routing one frame. */
    public enum RouteResult {
        DELIVERED(true),
        TO_HOST(true),
        MALFORMED(false),
        NO_TARGET(false),
        UNKNOWN_TARGET(false),
        NOT_CONNECTED(false),
        SEND_FAILED(false);

        private final boolean delivered;

        RouteResult(boolean delivered) {
            this.delivered = delivered;
        }

        public boolean delivered() {
            return delivered;
        }
    }

    private final Counter routed;
    private final Map<RouteResult, Counter> dropped = new EnumMap<>(RouteResult.class);

    public MessageRouter(MetricFactory metrics) {
        this.routed = metrics.counter("hub.frames.routed", "Frames delivered to a terminal");
        for (RouteResult result : RouteResult.values()) {
            if (!result.delivered()) {
                dropped.put(result, metrics.counter("hub.frames.dropped", "Frames dropped by the router",
                        "reason", result.name().toLowerCase()));
            }
        }
    }

    public RouteResult route(Tenant tenant, String frame) {
        Optional<String> target;
        try {
            target = FrameCodec.readTargetTerminalId(frame);
        } catch (FrameCodecException e) {
            log.debug("dropping malformed frame: {}", e.getMessage());
            return drop(RouteResult.MALFORMED);
        }
        if (target.isEmpty()) {
            log.debug("dropping frame without {}", FrameCodec.TARGET_FIELD);
            return drop(RouteResult.NO_TARGET);
        }
        String targetId = target.get();
        if (tenant.hostTerminalId().equals(targetId)) {
            tenant.host().receive(frame);
            routed.increment();
            return RouteResult.TO_HOST;
        }
        if (!tenant.isRoutable(targetId)) {
            log.debug("dropping frame for unknown terminal {}", targetId);
            return drop(RouteResult.UNKNOWN_TARGET);
        }
        Optional<TerminalConnection> connection = tenant.connection(targetId);
        if (connection.isEmpty() || !connection.get().isOpen()) {
            log.debug("dropping frame for disconnected terminal {}", targetId);
            return drop(RouteResult.NOT_CONNECTED);
        }
        if (!connection.get().send(frame)) {
            log.debug("send to terminal {} failed", targetId);
            return drop(RouteResult.SEND_FAILED);
        }
        routed.increment();
        return RouteResult.DELIVERED;
    }

    private RouteResult drop(RouteResult result) {
        dropped.get(result).increment();
        return result;
    }
}
