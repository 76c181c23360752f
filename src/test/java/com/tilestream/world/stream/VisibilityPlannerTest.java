package com.tilestream.world.stream;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.CoordinateMapper;
import org.joml.Vector2f;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VisibilityPlannerTest {

    /** 16 world pixels per chunk. */
    private final CoordinateMapper mapper = new CoordinateMapper(4, 4);

    @Test
    void visibleRectangleCoversViewport() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 0);
        VisibilityPlanner.ChunkRect rect = planner.visibleChunks(new Vector2f(16, 16), new Vector2f(20, 20), 1f);

        assertEquals(new VisibilityPlanner.ChunkRect(0, 0, 1, 1), rect);
        assertEquals(4, rect.area());
        assertTrue(rect.contains(new ChunkCoordinate(1, 0)));
        assertFalse(rect.contains(new ChunkCoordinate(2, 0)));
    }

    @Test
    void bufferWidensEverySide() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 2);
        VisibilityPlanner.ChunkRect rect = planner.visibleChunks(new Vector2f(8, 8), new Vector2f(2, 2), 1f);

        assertEquals(new VisibilityPlanner.ChunkRect(-2, -2, 2, 2), rect);
        assertEquals(25, rect.area());
    }

    @Test
    void zoomShrinksOrGrowsTheWorldRectangle() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 0);

        // 64px at zoom 2 covers 32 world px: [0, 32]
        assertEquals(new VisibilityPlanner.ChunkRect(0, 0, 2, 2),
            planner.visibleChunks(new Vector2f(16, 16), new Vector2f(64, 64), 2f));
        // 16px at zoom 0.5 covers 32 world px: [0, 32]
        assertEquals(new VisibilityPlanner.ChunkRect(0, 0, 2, 2),
            planner.visibleChunks(new Vector2f(16, 16), new Vector2f(16, 16), 0.5f));
    }

    @Test
    void negativeCoordinatesFloor() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 0);
        VisibilityPlanner.ChunkRect rect = planner.visibleChunks(new Vector2f(-8, -8), new Vector2f(4, 4), 1f);

        assertEquals(new VisibilityPlanner.ChunkRect(-1, -1, -1, -1), rect);
    }

    @Test
    void planOrdersByDistanceThenScanOrder() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 1);
        List<ChunkCoordinate> plan = planner.plan(new Vector2f(8, 8), new Vector2f(2, 2), 1f, key -> false);

        assertEquals(9, plan.size());
        assertEquals(new ChunkCoordinate(0, 0), plan.get(0));
        assertEquals(List.of(
                new ChunkCoordinate(0, -1),
                new ChunkCoordinate(-1, 0),
                new ChunkCoordinate(1, 0),
                new ChunkCoordinate(0, 1)),
            plan.subList(1, 5));
        for (ChunkCoordinate corner : plan.subList(5, 9)) {
            assertEquals(2, corner.manhattan(new ChunkCoordinate(0, 0)));
        }
    }

    @Test
    void planSkipsTrackedChunks() {
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 1);
        long tracked = ChunkCoordinate.key(0, 0);

        List<ChunkCoordinate> plan = planner.plan(new Vector2f(8, 8), new Vector2f(2, 2), 1f, key -> key == tracked);

        assertEquals(8, plan.size());
        assertFalse(plan.contains(new ChunkCoordinate(0, 0)));
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new VisibilityPlanner(mapper, -1));
        VisibilityPlanner planner = new VisibilityPlanner(mapper, 0);
        assertThrows(IllegalArgumentException.class,
            () -> planner.visibleChunks(new Vector2f(), new Vector2f(10, 10), 0f));
        assertThrows(IllegalArgumentException.class,
            () -> planner.visibleChunks(new Vector2f(), new Vector2f(10, 10), Float.NaN));
    }
}
