package com.tilestream.world.stream;

/**
 * Scheduling state of a chunk coordinate.
 *
 * UNSEEN → QUEUED → GENERATING → GENERATED. A failed generation goes back to
 * QUEUED through the retry path, or to ABANDONED once its retries are used up.
 * GENERATED and ABANDONED last until the next invalidation.
 */
public enum ChunkState {
    UNSEEN,
    QUEUED,
    GENERATING,
    GENERATED,
    ABANDONED
}
