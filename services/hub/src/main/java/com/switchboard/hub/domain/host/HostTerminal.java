package com.switchboard.hub.domain.host;

import com.switchboard.protocol.FrameCodec;
import com.switchboard.protocol.FrameCodecException;
import com.switchboard.protocol.ServiceResponse;
import com.switchboard.protocol.TerminalMessage;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The hub's own logical terminal inside one tenant.
 *
 * <p>It speaks the same envelope protocol as any terminal: it answers requests addressed to
 * it, issues requests of its own (liveness probes) and pushes channel frames to subscribers.
 * It has no socket. Inbound frames are handed to {@link #receive(String)} by the router, and
 * every outbound frame goes to {@code outbound}, which feeds the same router, so host traffic
 * takes exactly the path ordinary traffic takes.
 *
 * <p>Only terminals accepted by {@code knownTerminals} may subscribe to a channel. Subscriber
 * sets are pruned through {@link #dropSubscriber(String)} when a terminal goes away, which
 * only works for ids the tenant tracks.
 */
public final class HostTerminal {

    private static final Logger log = LoggerFactory.getLogger(HostTerminal.class);

    public static final String TERMINAL_INFO_CHANNEL = "TerminalInfo";
    public static final String SUBSCRIBE_CHANNEL = "SubscribeChannel";
    public static final String UNSUBSCRIBE_CHANNEL = "UnsubscribeChannel";
    public static final String CHANNEL_ID_FIELD = "channel_id";

    private final String terminalId;
    private final Predicate<String> knownTerminals;
    private final Consumer<String> outbound;
    private final Map<String, TerminalService> services = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TerminalMessage>> pending = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscribers = new ConcurrentHashMap<>();

    public HostTerminal(String terminalId, Consumer<String> outbound) {
        this(terminalId, id -> true, outbound);
    }

    public HostTerminal(String terminalId, Predicate<String> knownTerminals, Consumer<String> outbound) {
        if (terminalId == null || terminalId.isBlank()) {
            throw new IllegalArgumentException("terminalId must not be null or blank");
        }
        if (knownTerminals == null) {
            throw new IllegalArgumentException("knownTerminals must not be null");
        }
        if (outbound == null) {
            throw new IllegalArgumentException("outbound must not be null");
        }
        this.terminalId = terminalId;
        this.knownTerminals = knownTerminals;
        this.outbound = outbound;
        services.put(SUBSCRIBE_CHANNEL, this::subscribe);
        services.put(UNSUBSCRIBE_CHANNEL, this::unsubscribe);
    }

    public String terminalId() {
        return terminalId;
    }

    /**
     * Provides {@code method}; a later registration under the same name replaces the earlier one.
     */
    public void provideService(String method, TerminalService service) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (service == null) {
            throw new IllegalArgumentException("service must not be null");
        }
        services.put(method, service);
    }

    /** Makes {@code channelId} available for subscription. */
    public void provideChannel(String channelId) {
        subscribers.computeIfAbsent(channelId, id -> ConcurrentHashMap.newKeySet());
    }

    public Set<String> services() {
        return Set.copyOf(services.keySet());
    }

    public Set<String> subscribers(String channelId) {
        Set<String> current = subscribers.get(channelId);
        return current == null ? Set.of() : Set.copyOf(current);
    }

    /**
     * Handles one frame routed to this terminal. Responses complete the matching pending
     * request; requests are dispatched to the provided service and answered.
     */
    public void receive(String frame) {
        TerminalMessage message;
        try {
            message = FrameCodec.decode(frame);
        } catch (FrameCodecException e) {
            log.debug("host terminal ignored malformed frame: {}", e.getMessage());
            return;
        }
        if (message.isResponse()) {
            CompletableFuture<TerminalMessage> waiting = message.traceId() == null ? null : pending.get(message.traceId());
            if (waiting != null) {
                waiting.complete(message);
            }
            return;
        }
        if (message.isRequest()) {
            respond(message, dispatch(message));
        }
    }

    /**
     * Sends a request to {@code target}. The returned future completes with the first
     * response; it never times out by itself, callers bound the wait.
     */
    public CompletableFuture<TerminalMessage> request(String target, String method, Object body) {
        String traceId = UUID.randomUUID().toString();
        CompletableFuture<TerminalMessage> response = new CompletableFuture<>();
        pending.put(traceId, response);
        response.whenComplete((message, error) -> pending.remove(traceId, response));
        send(TerminalMessage.request(traceId, method, terminalId, target, FrameCodec.toTree(body)));
        return response;
    }

    /** Pushes {@code value} to every subscriber of {@code channelId}. */
    public void publish(String channelId, Object value) {
        Set<String> current = subscribers.get(channelId);
        if (current == null || current.isEmpty()) {
            return;
        }
        var frame = FrameCodec.toTree(value);
        for (String subscriber : current) {
            send(TerminalMessage.channelFrame(UUID.randomUUID().toString(), channelId, terminalId, subscriber, frame));
        }
    }

    /** Removes {@code subscriberId} from every channel. */
    public void dropSubscriber(String subscriberId) {
        subscribers.values().forEach(set -> set.remove(subscriberId));
    }

    public int pendingRequests() {
        return pending.size();
    }

    /** Fails every outstanding request; used on shutdown. */
    public void cancelPending() {
        pending.values().forEach(f -> f.completeExceptionally(new CancellationException("host terminal stopped")));
    }

    private ServiceResponse dispatch(TerminalMessage request) {
        TerminalService service = services.get(request.method());
        if (service == null) {
            return ServiceResponse.error(ServiceResponse.NOT_FOUND, "service not found: " + request.method());
        }
        try {
            return service.handle(request);
        } catch (IllegalArgumentException | FrameCodecException e) {
            return ServiceResponse.error(ServiceResponse.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("service {} failed for {}", request.method(), request.sourceTerminalId(), e);
            return ServiceResponse.error(ServiceResponse.INTERNAL_ERROR, "service failed: " + request.method());
        }
    }

    private void respond(TerminalMessage request, ServiceResponse response) {
        if (request.sourceTerminalId() == null) {
            log.debug("request {} has no source terminal, response dropped", request.traceId());
            return;
        }
        send(TerminalMessage.responseTo(request, FrameCodec.toTree(response)));
    }

    private ServiceResponse subscribe(TerminalMessage request) {
        String channelId = channelOf(request);
        Set<String> current = subscribers.get(channelId);
        if (current == null) {
            return ServiceResponse.error(ServiceResponse.NOT_FOUND, "channel not found: " + channelId);
        }
        String subscriber = request.sourceTerminalId();
        if (subscriber == null) {
            throw new IllegalArgumentException("source_terminal_id is required");
        }
        if (!knownTerminals.test(subscriber)) {
            return ServiceResponse.error(ServiceResponse.NOT_FOUND, "terminal not found: " + subscriber);
        }
        current.add(subscriber);
        // the terminal may have gone between the check and the add
        if (!knownTerminals.test(subscriber)) {
            current.remove(subscriber);
            return ServiceResponse.error(ServiceResponse.NOT_FOUND, "terminal not found: " + subscriber);
        }
        return ServiceResponse.ok();
    }

    private ServiceResponse unsubscribe(TerminalMessage request) {
        Set<String> current = subscribers.get(channelOf(request));
        if (current != null && request.sourceTerminalId() != null) {
            current.remove(request.sourceTerminalId());
        }
        return ServiceResponse.ok();
    }

    private static String channelOf(TerminalMessage request) {
        if (request.req() == null || !request.req().hasNonNull(CHANNEL_ID_FIELD)) {
            throw new IllegalArgumentException("channel_id is required");
        }
        return request.req().get(CHANNEL_ID_FIELD).asText();
    }

    private void send(TerminalMessage message) {
        outbound.accept(FrameCodec.encode(message));
    }
}
