package com.tilestream.world;

import org.joml.Vector2f;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateMapperTest {

    private final CoordinateMapper mapper = new CoordinateMapper(4, 600);

    @Test
    void worldToChunkFloorsNegativePositions() {
        assertEquals(new ChunkCoordinate(0, 0), mapper.worldToChunk(0, 0));
        assertEquals(new ChunkCoordinate(0, 0), mapper.worldToChunk(2399.9, 2399.9));
        assertEquals(new ChunkCoordinate(1, 0), mapper.worldToChunk(2400, 0));
        assertEquals(new ChunkCoordinate(-1, -1), mapper.worldToChunk(-1, -0.5));
        assertEquals(new ChunkCoordinate(-2, 0), mapper.worldToChunk(new Vector2f(-2401f, 5f)));
    }

    @Test
    void worldToTileFloors() {
        assertEquals(new TileCoordinate(0, 0), mapper.worldToTile(3.9, 0));
        assertEquals(new TileCoordinate(-1, 1), mapper.worldToTile(-0.1, 4));
        assertEquals(new TileCoordinate(2, -3), mapper.worldToTile(new Vector2f(8f, -9f)));
    }

    @Test
    void tileToChunkAndOrigin() {
        CoordinateMapper small = new CoordinateMapper(4, 4);
        assertEquals(new ChunkCoordinate(-1, 0), small.tileToChunk(-1, 3));
        assertEquals(new ChunkCoordinate(-1, 1), small.tileToChunk(-4, 4));
        assertEquals(new TileCoordinate(-8, 12), small.chunkOrigin(new ChunkCoordinate(-2, 3)));
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> new CoordinateMapper(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new CoordinateMapper(4, -1));
    }

    @Test
    void chunkKeysSurviveNegativeCoordinates() {
        ChunkCoordinate c = new ChunkCoordinate(-7, Integer.MIN_VALUE);
        assertEquals(c, ChunkCoordinate.fromKey(c.key()));
        assertNotEquals(ChunkCoordinate.key(1, 0), ChunkCoordinate.key(0, 1));
        assertEquals(5, new ChunkCoordinate(1, -2).manhattan(new ChunkCoordinate(-1, 1)));
    }

    @Test
    void chunkDataBoundsChecks() {
        ChunkData data = new ChunkData(new ChunkCoordinate(-1, 0), -4, 0, 4, 4);
        data.setTile(3, 3, new TileInfo(1, 2));

        assertEquals(new TileInfo(1, 2), data.getTile(3, 3));
        assertTrue(data.containsTile(-1, 3));
        assertFalse(data.containsTile(0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> data.getTile(4, 0));
        assertThrows(IllegalArgumentException.class, () -> new ChunkData(new ChunkCoordinate(0, 0), 0, 0, 0, 4));
    }
}
