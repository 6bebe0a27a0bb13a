package com.switchboard.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a service response ({@code res}). Code 0 means success; other codes follow
 * HTTP status semantics.
 *
 * @param code    0 on success
 * @param message human-readable status
 * @param data    optional result payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceResponse(
        @JsonProperty("code") int code,
        @JsonProperty("message") String message,
        @JsonProperty("data") Object data) {

    public static final int OK = 0;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int BAD_REQUEST = 400;
    public static final int INTERNAL_ERROR = 500;

    public static ServiceResponse ok() {
        return new ServiceResponse(OK, "OK", null);
    }

    public static ServiceResponse ok(Object data) {
        return new ServiceResponse(OK, "OK", data);
    }

    public static ServiceResponse error(int code, String message) {
        return new ServiceResponse(code, message, null);
    }
}
