package com.switchboard.hub.domain;

import java.util.Set;

/**
 * Result of one liveness sweep.
 *
 * @param alive terminals that answered at least one probe
 * @param evicted terminals that failed every attempt and were removed
 * @param spared terminals that failed every attempt but reconnected meanwhile
 */
public record SweepReport(Set<String> alive, Set<String> evicted, Set<String> spared) {

    public SweepReport {
        alive = Set.copyOf(alive);
        evicted = Set.copyOf(evicted);
        spared = Set.copyOf(spared);
    }

    public int probed() {
        return alive.size() + evicted.size() + spared.size();
    }
}
