package com.switchboard.hub.domain;

import com.switchboard.hub.domain.host.HostTerminal;
import com.switchboard.protocol.TerminalInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routing state of one tenant: the connection map and the terminal-info map.
 *
 * <p>Every mutation runs under the tenant's lock so compound changes (replace a connection,
 * drop a connection together with its info) are atomic. Reads used on the routing hot path
 * are lock-free; the maps are concurrent and may be observed mid-update by a router, which
 * is acceptable for best-effort forwarding.
 *
 * <p>Tenants never share state: a {@code Tenant} only knows its own terminals.
 */
public final class Tenant {

    private static final Logger log = LoggerFactory.getLogger(Tenant.class);

    private final String publicKey;
    private final String hostTerminalId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TerminalConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, TerminalInfo> infos = new ConcurrentHashMap<>();

    private volatile String signature;
    private volatile HostTerminal host;
    private volatile LivenessMonitor monitor;

    public Tenant(String publicKey, String hostTerminalId) {
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("publicKey must not be null or blank");
        }
        if (hostTerminalId == null || hostTerminalId.isBlank()) {
            throw new IllegalArgumentException("hostTerminalId must not be null or blank");
        }
        this.publicKey = publicKey;
        this.hostTerminalId = hostTerminalId;
    }

    public String publicKey() {
        return publicKey;
    }

    public String hostTerminalId() {
        return hostTerminalId;
    }

    /** The signature presented by the latest authenticated connection, or null before any. */
    public String signature() {
        return signature;
    }

    public void recordSignature(String signature) {
        this.signature = signature;
    }

    public HostTerminal host() {
        HostTerminal current = host;
        if (current == null) {
            throw new IllegalStateException("host terminal not attached for tenant " + publicKey);
        }
        return current;
    }

    public Optional<LivenessMonitor> monitor() {
        return Optional.ofNullable(monitor);
    }

    void attachHost(HostTerminal host) {
        if (this.host != null) {
            throw new IllegalStateException("host terminal already attached");
        }
        this.host = host;
    }

    void attachMonitor(LivenessMonitor monitor) {
        if (this.monitor != null) {
            throw new IllegalStateException("liveness monitor already attached");
        }
        this.monitor = monitor;
    }

    /**
     * Registers {@code connection} under its terminal id. A connection already registered
     * under that id is replaced and then closed; by the time its close callback runs it is no
     * longer registered, so its release finds nothing to remove.
     *
     * @return the superseded connection, if any
     */
    public Optional<TerminalConnection> register(TerminalConnection connection) {
        String terminalId = connection.terminalId();
        if (hostTerminalId.equals(terminalId)) {
            throw new IllegalArgumentException("terminal id " + terminalId + " is reserved");
        }
        TerminalConnection superseded;
        lock.lock();
        try {
            TerminalConnection previous = connections.put(terminalId, connection);
            superseded = previous == connection ? null : previous;
        } finally {
            lock.unlock();
        }
        // closed outside the lock: a close handshake with a dead peer may block
        if (superseded != null) {
            superseded.close();
        }
        return Optional.ofNullable(superseded);
    }

    /**
     * Removes the connection and the info of {@code terminalId}. Idempotent.
     *
     * @return the connection that was registered, if any
     */
    public Optional<TerminalConnection> unregister(String terminalId) {
        TerminalConnection removed;
        lock.lock();
        try {
            removed = connections.remove(terminalId);
            infos.remove(terminalId);
        } finally {
            lock.unlock();
        }
        dropSubscriptions(terminalId);
        return Optional.ofNullable(removed);
    }

    /**
     * Close-path variant of {@link #unregister}: only acts if {@code connection} is still the
     * one registered for its terminal id, so a superseded connection closing late cannot
     * remove its successor.
     *
     * @return true if state was removed
     */
    public boolean release(TerminalConnection connection) {
        String terminalId = connection.terminalId();
        lock.lock();
        try {
            if (!connections.remove(terminalId, connection)) {
                return false;
            }
            infos.remove(terminalId);
        } finally {
            lock.unlock();
        }
        dropSubscriptions(terminalId);
        return true;
    }

    /**
     * Evicts a terminal that failed its liveness probes. {@code observed} is the connection
     * that was registered when probing started; if the terminal has reconnected since, the
     * new connection is left alone.
     *
     * @return true if the terminal was evicted
     */
    public boolean evict(String terminalId, TerminalConnection observed) {
        TerminalConnection removed;
        lock.lock();
        try {
            TerminalConnection current = connections.get(terminalId);
            if (current != observed) {
                if (current != null) {
                    log.info("terminal {} reconnected while being probed, keeping new connection", terminalId);
                }
                return false;
            }
            infos.remove(terminalId);
            removed = current == null ? null : connections.remove(terminalId);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            removed.terminate();
        }
        dropSubscriptions(terminalId);
        return true;
    }

    /**
     * Upserts a terminal's self-reported metadata and publishes it on the terminal-info channel.
     */
    public void updateInfo(TerminalInfo info) {
        if (info == null || info.terminalId() == null || info.terminalId().isBlank()) {
            throw new IllegalArgumentException("terminal_id is required");
        }
        lock.lock();
        try {
            infos.put(info.terminalId(), info);
        } finally {
            lock.unlock();
        }
        HostTerminal current = host;
        if (current != null) {
            current.publish(HostTerminal.TERMINAL_INFO_CHANNEL, info);
        }
    }

    /** All terminal infos currently known, ordered by terminal id. */
    public List<TerminalInfo> snapshot() {
        lock.lock();
        try {
            List<TerminalInfo> result = new ArrayList<>(infos.values());
            result.sort((a, b) -> a.terminalId().compareTo(b.terminalId()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Terminal ids with metadata; the set the liveness monitor probes. */
    public Set<String> knownTerminalIds() {
        return Set.copyOf(infos.keySet());
    }

    /** True if {@code terminalId} may receive routed frames. */
    public boolean isRoutable(String terminalId) {
        return hostTerminalId.equals(terminalId) || infos.containsKey(terminalId);
    }

    public Optional<TerminalInfo> info(String terminalId) {
        return Optional.ofNullable(infos.get(terminalId));
    }

    public Optional<TerminalConnection> connection(String terminalId) {
        return Optional.ofNullable(connections.get(terminalId));
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Closes every terminal connection of this tenant. Entries are removed by the
     * connections' own close callbacks.
     */
    public void closeAll() {
        List<TerminalConnection> open;
        lock.lock();
        try {
            open = List.copyOf(connections.values());
        } finally {
            lock.unlock();
        }
        for (TerminalConnection connection : open) {
            connection.close();
        }
    }

    private void dropSubscriptions(String terminalId) {
        HostTerminal current = host;
        if (current != null) {
            current.dropSubscriber(terminalId);
        }
    }

    @Override
    public String toString() {
        return "Tenant[" + publicKey + "]";
    }
}
