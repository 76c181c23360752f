package com.tilestream.world;

/** Default world dimension constants. */
public final class WorldConstants {

    /** Edge length of one tile in world pixels. */
    public static final int TILE_PIXEL_SIZE = 4;
    /** Edge length of one chunk in tiles. */
    public static final int CHUNK_SIZE = 600;

    private WorldConstants() {}
}
