package com.tilestream.world;

import org.joml.Vector2fc;

/**
 * Converts between world pixels, tiles and chunks.
 *
 * All conversions floor rather than truncate, so negative positions map to the
 * tile or chunk below/left of the origin: pixel -1 lands in chunk -1, not 0.
 */
public final class CoordinateMapper {

    private final int tileSize;
    private final int chunkSize;
    private final int chunkPixelSize;

    /**
     * @param tileSize  tile edge length in world pixels, must be positive
     * @param chunkSize chunk edge length in tiles, must be positive
     */
    public CoordinateMapper(int tileSize, int chunkSize) {
        if (tileSize <= 0) throw new IllegalArgumentException("tileSize must be > 0, got " + tileSize);
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
        this.tileSize = tileSize;
        this.chunkSize = chunkSize;
        this.chunkPixelSize = tileSize * chunkSize;
    }

    public int getTileSize() { return tileSize; }
    public int getChunkSize() { return chunkSize; }

    public ChunkCoordinate worldToChunk(Vector2fc pixelPos) {
        return worldToChunk(pixelPos.x(), pixelPos.y());
    }

    public ChunkCoordinate worldToChunk(double px, double py) {
        return new ChunkCoordinate(
            (int) Math.floor(px / chunkPixelSize),
            (int) Math.floor(py / chunkPixelSize)
        );
    }

    public TileCoordinate worldToTile(Vector2fc pixelPos) {
        return worldToTile(pixelPos.x(), pixelPos.y());
    }

    public TileCoordinate worldToTile(double px, double py) {
        return new TileCoordinate(
            (int) Math.floor(px / tileSize),
            (int) Math.floor(py / tileSize)
        );
    }

    public ChunkCoordinate tileToChunk(int tileX, int tileY) {
        return new ChunkCoordinate(Math.floorDiv(tileX, chunkSize), Math.floorDiv(tileY, chunkSize));
    }

    /** Top-left tile of the chunk. */
    public TileCoordinate chunkOrigin(ChunkCoordinate chunk) {
        return new TileCoordinate(chunk.x() * chunkSize, chunk.y() * chunkSize);
    }
}
