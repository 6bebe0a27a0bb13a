package com.switchboard.hub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tenant as reported by {@code ListHost}: its public key and the signature of its latest
 * authenticated connection.
 */
public record HostRecord(
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("signature") String signature) {
}
