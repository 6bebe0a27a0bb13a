package com.switchboard.security;

/**
 * Thrown when a connection attempt fails authentication.
 * <p>
 * Authentication failures are final for the attempt: the hub rejects the upgrade and
 * never retries on the client's behalf. The message is the human-readable reason and
 * is safe to log.
 */
public class AuthenticationException extends RuntimeException {

    private final String reason;

    public AuthenticationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
