package dev.station.model;

import java.time.Duration;

/**
 * Run-level policy knobs.
 */
public record SequencerSettings(
    boolean finalizerAffectsVerdict,
    Duration requestTimeout // nullable, wait for the operator indefinitely
) {
    public static final boolean DEFAULT_FINALIZER_AFFECTS_VERDICT = false;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = null;

    public static SequencerSettings defaults() {
        return new SequencerSettings(DEFAULT_FINALIZER_AFFECTS_VERDICT, DEFAULT_REQUEST_TIMEOUT);
    }

    public SequencerSettings withFinalizerAffectsVerdict(boolean value) {
        return new SequencerSettings(value, requestTimeout);
    }

    public SequencerSettings withRequestTimeout(Duration timeout) {
        return new SequencerSettings(finalizerAffectsVerdict, timeout);
    }
}
