package com.switchboard.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata a terminal reports about itself.
 * <p>
 * Only {@code terminal_id} and {@code name} have meaning to the hub. Every other field a
 * terminal sends (service lists, channel lists, timestamps) is kept verbatim and returned
 * unchanged by discovery queries.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TerminalInfo {

    private final String terminalId;
    private final String name;
    private final Map<String, JsonNode> extra = new LinkedHashMap<>();

    @JsonCreator
    public TerminalInfo(@JsonProperty("terminal_id") String terminalId, @JsonProperty("name") String name) {
        this.terminalId = terminalId;
        this.name = name;
    }

    public TerminalInfo(String terminalId, String name, Map<String, JsonNode> extra) {
        this(terminalId, name);
        if (extra != null) {
            this.extra.putAll(extra);
        }
    }

    @JsonProperty("terminal_id")
    public String terminalId() {
        return terminalId;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extra() {
        return Collections.unmodifiableMap(extra);
    }

    @JsonAnySetter
    void putExtra(String key, JsonNode value) {
        extra.put(key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TerminalInfo other)) {
            return false;
        }
        return Objects.equals(terminalId, other.terminalId)
                && Objects.equals(name, other.name)
                && extra.equals(other.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terminalId, name, extra);
    }

    @Override
    public String toString() {
        return "TerminalInfo[terminalId=" + terminalId + ", name=" + name + ", extra=" + extra.keySet() + "]";
    }
}
