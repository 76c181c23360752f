package com.tilestream.world.stream;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;

/**
 * Outcome of one generation task: either the chunk data or the failure cause.
 * The ticket identifies the dispatch that produced it, so results from an
 * earlier dispatch of the same coordinate can be recognised and dropped.
 */
public final class GenerationResult {

    private final ChunkCoordinate coord;
    private final long ticket;
    private final ChunkData data;
    private final Throwable failure;

    private GenerationResult(ChunkCoordinate coord, long ticket, ChunkData data, Throwable failure) {
        this.coord = coord;
        this.ticket = ticket;
        this.data = data;
        this.failure = failure;
    }

    public static GenerationResult success(ChunkCoordinate coord, long ticket, ChunkData data) {
        return new GenerationResult(coord, ticket, data, null);
    }

    public static GenerationResult failure(ChunkCoordinate coord, long ticket, Throwable cause) {
        return new GenerationResult(coord, ticket, null, cause);
    }

    public ChunkCoordinate getCoord() { return coord; }
    public long getTicket() { return ticket; }
    public boolean isSuccess() { return failure == null; }

    /** Chunk data; null for failures. */
    public ChunkData getData() { return data; }

    /** Failure cause; null for successes. */
    public Throwable getFailure() { return failure; }
}
