package com.switchboard.hub.domain.host;

import com.switchboard.protocol.ServiceResponse;
import com.switchboard.protocol.TerminalMessage;

/**
 * Handler for one named service provided by the host terminal.
 * <p>
 * Handlers run on the thread that delivered the request and must not block. An exception
 * thrown by a handler is answered with code 500.
 */
@FunctionalInterface
public interface TerminalService {

    ServiceResponse handle(TerminalMessage request);
}
