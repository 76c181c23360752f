package com.tilestream.world.stream;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;

/**
 * Produces the complete tile data for one chunk. Called from generation
 * threads, so implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface ChunkGenerator {
    ChunkData generate(ChunkCoordinate coord);
}
