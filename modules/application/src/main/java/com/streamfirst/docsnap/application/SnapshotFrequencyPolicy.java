package com.streamfirst.docsnap.application;

import lombok.Getter;

/**
 * Admission control for persisted snapshots: only every {@code frequency}-th version is
 * snapshotted. With the default of 1 every committed version gets a snapshot.
 */
@Getter
public final class SnapshotFrequencyPolicy {

    public static final int DEFAULT_FREQUENCY = 1;

    private final int frequency;

    public SnapshotFrequencyPolicy(int frequency) {
        if (frequency <= 0) {
            throw new IllegalArgumentException("Snapshot frequency must be > 0, got " + frequency);
        }
        this.frequency = frequency;
    }

    public static SnapshotFrequencyPolicy everyVersion() {
        return new SnapshotFrequencyPolicy(DEFAULT_FREQUENCY);
    }

    /** True when a snapshot should be persisted for the given committed version. */
    public boolean shouldSnapshot(long version) {
        return version % frequency == 0;
    }

    @Override
    public String toString() {
        return "SnapshotFrequencyPolicy{every " + frequency + " versions}";
    }
}
