package com.switchboard.hub.domain;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.host.HostTerminal;
import com.switchboard.observability.ConnectionContext;
import com.switchboard.observability.ConnectionContextHolder;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Probes every terminal of one tenant and evicts the ones that stopped answering.
 *
 * <p>A sweep sends {@code Ping} from the host terminal to each terminal with metadata, through
 * the router like any other request. Each probe waits up to the probe timeout and is retried
 * until the attempt limit; probes of one sweep run concurrently. The next sweep is scheduled
 * once the current one has settled, or after the error retry delay if it failed.
 *
 * <p>Probe timeouts fire on the JDK's shared delay thread. Everything that follows a timeout
 * (the retry, which sends a frame, and the eviction, which closes a socket) is handed to the
 * probe executor so that a terminal whose socket blocks on write holds one of this pool's
 * threads and never the delay thread every other tenant's timeouts depend on.
 */
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final Tenant tenant;
    private final TaskScheduler scheduler;
    private final Executor probeExecutor;
    private final HubProperties.Liveness settings;
    private final Counter evictions;
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopped;
    private volatile ScheduledFuture<?> next;

    public LivenessMonitor(Tenant tenant, TaskScheduler scheduler, Executor probeExecutor,
            HubProperties.Liveness settings, Counter evictions) {
        this.tenant = tenant;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.settings = settings;
        this.evictions = evictions;
    }

    /** Schedules the first sweep immediately. Subsequent calls do nothing. */
    public void start() {
        if (started.compareAndSet(false, true)) {
            schedule(Duration.ZERO);
        }
    }

    /** Cancels the next sweep; a sweep in flight completes but does not reschedule. */
    public void stop() {
        stopped = true;
        ScheduledFuture<?> pending = next;
        if (pending != null) {
            pending.cancel(false);
        }
    }

    public boolean isRunning() {
        return started.get() && !stopped;
    }

    /**
     * Probes every terminal currently known to the tenant.
     *
     * @return a future completing once every probe has succeeded or been given up on
     */
    public CompletableFuture<SweepReport> sweep() {
        Set<String> targets = tenant.knownTerminalIds();
        Map<String, CompletableFuture<Outcome>> probes = new HashMap<>();
        for (String terminalId : targets) {
            TerminalConnection observed = tenant.connection(terminalId).orElse(null);
            probes.put(terminalId, probe(terminalId, 1)
                    .thenApplyAsync(alive -> settle(terminalId, observed, alive), probeExecutor));
        }
        return CompletableFuture.allOf(probes.values().toArray(CompletableFuture[]::new))
                .thenApply(ignored -> report(probes));
    }

    private CompletableFuture<Boolean> probe(String terminalId, int attempt) {
        HostTerminal host = tenant.host();
        return host.request(terminalId, HostServices.PING, Map.of())
                .orTimeout(settings.probeTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handleAsync((response, error) -> {
                    if (error != null) {
                        log.warn("Terminal ping failed: {} attempt {}/{}", terminalId, attempt, settings.maxAttempts());
                    }
                    return error == null;
                }, probeExecutor)
                .thenComposeAsync(alive -> alive || attempt >= settings.maxAttempts()
                        ? CompletableFuture.completedFuture(alive)
                        : probe(terminalId, attempt + 1), probeExecutor);
    }

    private Outcome settle(String terminalId, TerminalConnection observed, boolean alive) {
        if (alive) {
            return Outcome.ALIVE;
        }
        if (tenant.evict(terminalId, observed)) {
            evictions.increment();
            log.info("terminal {} evicted after {} failed probes", terminalId, settings.maxAttempts());
            return Outcome.EVICTED;
        }
        return Outcome.SPARED;
    }

    private static SweepReport report(Map<String, CompletableFuture<Outcome>> probes) {
        Set<String> alive = new HashSet<>();
        Set<String> evicted = new HashSet<>();
        Set<String> spared = new HashSet<>();
        probes.forEach((terminalId, outcome) -> {
            switch (outcome.join()) {
                case ALIVE -> alive.add(terminalId);
                case EVICTED -> evicted.add(terminalId);
                case SPARED -> spared.add(terminalId);
            }
        });
        return new SweepReport(alive, evicted, spared);
    }

    private void runSweep() {
        if (stopped) {
            return;
        }
        ConnectionContext context = ConnectionContext.internal(tenant.publicKey(), tenant.hostTerminalId());
        ConnectionContextHolder.runWithContext(context, () -> {
            try {
                sweep().whenComplete((report, error) -> {
                    if (error != null) {
                        log.error("liveness sweep failed, retrying in {}", settings.errorRetryDelay(), error);
                        schedule(settings.errorRetryDelay());
                    } else {
                        if (!report.evicted().isEmpty()) {
                            log.info("liveness sweep probed {} terminals, evicted {}", report.probed(), report.evicted());
                        }
                        schedule(settings.interval());
                    }
                });
            } catch (RuntimeException e) {
                log.error("liveness sweep failed, retrying in {}", settings.errorRetryDelay(), e);
                schedule(settings.errorRetryDelay());
            }
        });
    }

    private void schedule(Duration delay) {
        if (stopped) {
            return;
        }
        next = scheduler.schedule(this::runSweep, Instant.now().plus(delay));
    }

    private enum Outcome {
        ALIVE,
        EVICTED,
        SPARED
    }
}
