package com.switchboard.hub.domain;

/**
 * A live transport to one terminal. The hub's domain code only ever talks to terminals
 * through this interface; the WebSocket adapter implements it for real sockets.
 * <p>
 * Implementations must tolerate concurrent {@link #send} calls from different threads and
 * must never block a caller indefinitely on a slow peer.
 */
public interface TerminalConnection {

    /** Transport-level id, unique per process. */
    String id();

    /** Terminal id the connection authenticated as. */
    String terminalId();

    boolean isOpen();

    /**
     * Sends one frame, unmodified.
     *
     * @return false if the frame could not be handed to the transport
     */
    boolean send(String frame);

    /** Closes gracefully; the peer observes a normal close and may reconnect. */
    void close();

    /** Closes abruptly; used when the peer is considered dead. */
    void terminate();
}
