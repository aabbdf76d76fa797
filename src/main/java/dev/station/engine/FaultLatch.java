package dev.station.engine;

import dev.station.model.InfrastructureException;

/**
 * Remembers the first infrastructure failure seen during a run, so a step
 * that catches one cannot hide it from the sequencer.
 */
final class FaultLatch {
    private InfrastructureException first;

    <E extends InfrastructureException> E trip(E e) {
        if (first == null) {
            first = e;
        }
        return e;
    }

    InfrastructureException get() {
        return first;
    }

    boolean tripped() {
        return first != null;
    }
}
