package com.tilestream.world;

/**
 * Immutable 2D chunk coordinate (chunkX, chunkY) in chunk space.
 * Used as map keys and for priority distance.
 */
public record ChunkCoordinate(int x, int y) {

    /** Pack into a long key (pure math, no allocation). */
    public static long key(int x, int y) {
        return (((long) x) << 32) | (y & 0xFFFFFFFFL);
    }

    public static ChunkCoordinate fromKey(long key) {
        return new ChunkCoordinate((int) (key >> 32), (int) key);
    }

    public long key() {
        return key(x, y);
    }

    /** Manhattan distance in chunks. */
    public int manhattan(ChunkCoordinate other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
