package com.streamfirst.docsnap.application;

/** How a document state is rebuilt for a requested version. */
public enum ReconstructionStrategy {
    /** Seed from the closest earlier snapshot and replay only the changes after it */
    INCREMENTAL,
    /** Start from an empty document and replay the whole history up to the version */
    FULL_REPLAY;

    /**
     * Incremental reconstruction needs a snapshot store to seed from; version 0 has no prior state
     * to reuse, so it always replays (an empty range) from scratch.
     */
    public static ReconstructionStrategy select(boolean snapshotStoreConfigured, long version) {
        return snapshotStoreConfigured && version != 0 ? INCREMENTAL : FULL_REPLAY;
    }
}
