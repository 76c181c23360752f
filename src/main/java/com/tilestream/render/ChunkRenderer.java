package com.tilestream.render;

import com.tilestream.world.ChunkData;
import com.tilestream.world.gen.GenConfig;

/**
 * Receives finished chunks on the scheduling thread. Implementations produce
 * visuals and register collision for tiles whose terrain class collides.
 * Ownership of the {@link ChunkData} passes to the renderer on {@link #apply}.
 */
public interface ChunkRenderer {

    void apply(ChunkData chunk);

    /** Drop everything applied so far. Called when all chunks are invalidated. */
    default void clear() {}

    /**
     * Adopt a new validated configuration (geometry and class table). Called
     * once when the scheduler is built and again on every reconfiguration,
     * before the chunks of the old configuration are cleared.
     */
    default void configure(GenConfig config) {}
}
