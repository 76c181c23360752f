package com.tilestream.world.stream;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.CoordinateMapper;
import org.joml.Vector2f;
import org.joml.Vector2fc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.LongPredicate;

/**
 * Works out which chunks the viewport needs and in what order.
 *
 * The visible world rectangle is {@code center ± (viewportSize / zoom) / 2}.
 * Its corners are converted to chunk coordinates and widened by the buffer on
 * every side. Untracked chunks in that range are returned closest first, by
 * Manhattan distance to the chunk holding the viewport centre.
 */
public class VisibilityPlanner {

    /** Inclusive chunk rectangle. */
    public record ChunkRect(int minX, int minY, int maxX, int maxY) {

        public boolean contains(ChunkCoordinate c) {
            return c.x() >= minX && c.x() <= maxX && c.y() >= minY && c.y() <= maxY;
        }

        public int area() {
            return (maxX - minX + 1) * (maxY - minY + 1);
        }
    }

    private final CoordinateMapper mapper;
    private final int buffer;

    public VisibilityPlanner(CoordinateMapper mapper, int buffer) {
        if (buffer < 0) throw new IllegalArgumentException("buffer must be >= 0, got " + buffer);
        this.mapper = mapper;
        this.buffer = buffer;
    }

    /** Visible chunk range including the buffer. */
    public ChunkRect visibleChunks(Vector2fc center, Vector2fc viewportSize, float zoom) {
        if (!(zoom > 0f)) throw new IllegalArgumentException("zoom must be > 0, got " + zoom);
        Vector2f half = new Vector2f(viewportSize).div(zoom).mul(0.5f);
        Vector2f topLeft = new Vector2f(center).sub(half);
        Vector2f bottomRight = new Vector2f(center).add(half);

        ChunkCoordinate min = mapper.worldToChunk(topLeft);
        ChunkCoordinate max = mapper.worldToChunk(bottomRight);
        return new ChunkRect(min.x() - buffer, min.y() - buffer, max.x() + buffer, max.y() + buffer);
    }

    /**
     * Chunks in the visible range that are not tracked yet, closest first.
     * Ties keep scan order (row by row, left to right).
     *
     * @param tracked tests a packed chunk key against every scheduler set
     */
    public List<ChunkCoordinate> plan(Vector2fc center, Vector2fc viewportSize, float zoom, LongPredicate tracked) {
        ChunkRect rect = visibleChunks(center, viewportSize, zoom);
        ChunkCoordinate centerChunk = mapper.worldToChunk(center);

        List<ChunkCoordinate> needed = new ArrayList<>();
        for (int cy = rect.minY(); cy <= rect.maxY(); cy++) {
            for (int cx = rect.minX(); cx <= rect.maxX(); cx++) {
                if (tracked.test(ChunkCoordinate.key(cx, cy))) continue;
                needed.add(new ChunkCoordinate(cx, cy));
            }
        }

        // List.sort is stable
        needed.sort(Comparator.comparingInt(c -> c.manhattan(centerChunk)));
        return needed;
    }
}
