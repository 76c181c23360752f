package com.tilestream.world;

/**
 * Tile data for one chunk. Produced on a generation thread, then handed to the
 * renderer on the scheduling thread; the producing task keeps no reference
 * after the handoff, so no synchronization is needed.
 */
public class ChunkData {

    private final ChunkCoordinate coord;
    private final int startX;
    private final int startY;
    private final int width;
    private final int height;
    /** Row-major: tiles[localY * width + localX]. */
    private final TileInfo[] tiles;

    public ChunkData(ChunkCoordinate coord, int startX, int startY, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Chunk dimensions must be positive: " + width + "x" + height);
        }
        this.coord = coord;
        this.startX = startX;
        this.startY = startY;
        this.width = width;
        this.height = height;
        this.tiles = new TileInfo[width * height];
    }

    public ChunkCoordinate getCoord() { return coord; }
    public int getStartX() { return startX; }
    public int getStartY() { return startY; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public TileInfo getTile(int localX, int localY) {
        return tiles[index(localX, localY)];
    }

    public void setTile(int localX, int localY, TileInfo tile) {
        tiles[index(localX, localY)] = tile;
    }

    /** True if the world tile lies inside this chunk's bounds. */
    public boolean containsTile(int tileX, int tileY) {
        int lx = tileX - startX;
        int ly = tileY - startY;
        return lx >= 0 && lx < width && ly >= 0 && ly < height;
    }

    private int index(int localX, int localY) {
        if (localX < 0 || localX >= width || localY < 0 || localY >= height) {
            throw new IndexOutOfBoundsException("Tile (" + localX + ", " + localY + ") outside "
                + width + "x" + height + " chunk " + coord);
        }
        return localY * width + localX;
    }
}
