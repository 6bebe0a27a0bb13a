package com.switchboard.hub.infrastructure.web;

import com.switchboard.hub.domain.TerminalConnection;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * {@link TerminalConnection} backed by a Spring WebSocket session.
 *
 * <p>The session is expected to be a {@code ConcurrentWebSocketSessionDecorator}, so concurrent
 * sends are serialised per connection and a slow peer only fills its own buffer.
 */
final class WebSocketTerminalConnection implements TerminalConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTerminalConnection.class);

    private final WebSocketSession session;
    private final String terminalId;

    WebSocketTerminalConnection(WebSocketSession session, String terminalId) {
        this.session = session;
        this.terminalId = terminalId;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String terminalId() {
        return terminalId;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public boolean send(String frame) {
        try {
            session.sendMessage(new TextMessage(frame));
            return true;
        } catch (IOException | SessionLimitExceededException | IllegalStateException e) {
            // send limits exceeded or peer gone; the decorator closes the session itself
            log.debug("send to {} on {} failed: {}", terminalId, session.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        closeWith(CloseStatus.NORMAL);
    }

    @Override
    public void terminate() {
        closeWith(CloseStatus.SESSION_NOT_RELIABLE);
    }

    private void closeWith(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("closing {} on {} failed: {}", terminalId, session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketTerminalConnection[" + terminalId + ", " + session.getId() + "]";
    }
}
