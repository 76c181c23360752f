package com.tilestream.render;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;
import com.tilestream.world.CoordinateMapper;
import com.tilestream.world.TileCoordinate;
import com.tilestream.world.TileInfo;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.gen.TerrainClass;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.joml.Vector2fc;

import java.util.List;

/**
 * In-memory renderer: keeps every applied chunk, registers a collision tile
 * for each tile whose terrain class collides, and answers terrain queries.
 * Supports editing single tiles after generation.
 *
 * Scheduling thread only; not thread-safe.
 */
public class TileWorld implements ChunkRenderer {

    private final Long2ObjectOpenHashMap<ChunkData> chunks = new Long2ObjectOpenHashMap<>();
    /** Packed world tile keys of collidable tiles. */
    private final LongOpenHashSet collisionTiles = new LongOpenHashSet();

    private CoordinateMapper mapper;
    private List<TerrainClass> classes;

    public TileWorld(GenConfig config) {
        configure(config);
    }

    /** Adopt a new geometry and class table. Drops all chunks. */
    @Override
    public void configure(GenConfig config) {
        this.mapper = new CoordinateMapper(config.tilePixelSize, config.chunkSize);
        this.classes = List.copyOf(config.classes);
        clear();
    }

    @Override
    public void apply(ChunkData chunk) {
        ChunkData previous = chunks.put(chunk.getCoord().key(), chunk);
        if (previous != null) {
            unregisterCollision(previous);
        }
        for (int ly = 0; ly < chunk.getHeight(); ly++) {
            for (int lx = 0; lx < chunk.getWidth(); lx++) {
                if (collides(chunk.getTile(lx, ly))) {
                    collisionTiles.add(tileKey(chunk.getStartX() + lx, chunk.getStartY() + ly));
                }
            }
        }
    }

    @Override
    public void clear() {
        chunks.clear();
        collisionTiles.clear();
    }

    /** Terrain class at a world pixel position, or null if its chunk is not loaded. */
    public TerrainClass terrainAt(Vector2fc worldPos) {
        TileCoordinate tile = mapper.worldToTile(worldPos);
        return terrainAtTile(tile.x(), tile.y());
    }

    /** Terrain class at a world tile, or null if its chunk is not loaded. */
    public TerrainClass terrainAtTile(int tileX, int tileY) {
        TileInfo info = tileAt(tileX, tileY);
        return info != null ? classes.get(info.classIndex()) : null;
    }

    /** Tile info at a world tile, or null if its chunk is not loaded. */
    public TileInfo tileAt(int tileX, int tileY) {
        ChunkData chunk = chunkForTile(tileX, tileY);
        if (chunk == null) return null;
        return chunk.getTile(tileX - chunk.getStartX(), tileY - chunk.getStartY());
    }

    /**
     * Replace the terrain of one tile (variant 0) and update its collision.
     *
     * @return true if the tile was modified, false if its chunk is not loaded
     *         or the class is not in the class table
     */
    public boolean modifyTile(int tileX, int tileY, TerrainClass terrain) {
        int classIndex = classes.indexOf(terrain);
        if (classIndex < 0) return false;
        ChunkData chunk = chunkForTile(tileX, tileY);
        if (chunk == null) return false;

        TileInfo info = new TileInfo(classIndex, 0);
        chunk.setTile(tileX - chunk.getStartX(), tileY - chunk.getStartY(), info);
        long key = tileKey(tileX, tileY);
        if (collides(info)) {
            collisionTiles.add(key);
        } else {
            collisionTiles.remove(key);
        }
        return true;
    }

    /** Same as {@link #modifyTile(int, int, TerrainClass)} addressed by world pixel position. */
    public boolean modifyTileAt(Vector2fc worldPos, TerrainClass terrain) {
        TileCoordinate tile = mapper.worldToTile(worldPos);
        return modifyTile(tile.x(), tile.y(), terrain);
    }

    public boolean isCollidable(int tileX, int tileY) {
        return collisionTiles.contains(tileKey(tileX, tileY));
    }

    public boolean isLoaded(ChunkCoordinate coord) {
        return chunks.containsKey(coord.key());
    }

    public int loadedChunkCount() {
        return chunks.size();
    }

    public int collisionTileCount() {
        return collisionTiles.size();
    }

    private ChunkData chunkForTile(int tileX, int tileY) {
        ChunkCoordinate coord = mapper.tileToChunk(tileX, tileY);
        return chunks.get(coord.key());
    }

    private boolean collides(TileInfo info) {
        return info != null && classes.get(info.classIndex()).collides();
    }

    private void unregisterCollision(ChunkData chunk) {
        for (int ly = 0; ly < chunk.getHeight(); ly++) {
            for (int lx = 0; lx < chunk.getWidth(); lx++) {
                collisionTiles.remove(tileKey(chunk.getStartX() + lx, chunk.getStartY() + ly));
            }
        }
    }

    private static long tileKey(int tileX, int tileY) {
        return ChunkCoordinate.key(tileX, tileY);
    }
}
