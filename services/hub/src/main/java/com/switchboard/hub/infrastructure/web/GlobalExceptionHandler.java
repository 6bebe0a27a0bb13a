package com.switchboard.hub.infrastructure.web;

import java.net.URI;
import java.time.Instant;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions thrown by the REST endpoints to RFC 7807 {@link ProblemDetail} responses.
 *
 * <table>
 *   <caption>Exception mapping</caption>
 *   <tr><th>Exception</th><th>Status</th><th>type</th></tr>
 *   <tr><td>{@link NoSuchElementException}</td><td>404</td><td>{@code urn:switchboard:error:not-found}</td></tr>
 *   <tr><td>{@link IllegalArgumentException}</td><td>400</td><td>{@code urn:switchboard:error:bad-request}</td></tr>
 *   <tr><td>anything else</td><td>500</td><td>{@code urn:switchboard:error:internal}</td></tr>
 * </table>
 *
 * <p>WHY: the 500 body carries a fixed detail, never the exception message, since messages
 * may quote tenant keys or signatures. The full stack trace goes to the log only.
 *
 * <p>WebSocket upgrades never reach this class; their rejections are plain status codes set by
 * {@link TerminalHandshakeInterceptor}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "urn:switchboard:error:";

    @ExceptionHandler(NoSuchElementException.class)
    public ProblemDetail handleNotFound(NoSuchElementException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
