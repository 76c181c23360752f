package com.tilestream.core;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.gen.TerrainClass;
import com.tilestream.world.gen.TerrainConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StreamLoopTest {

    private static GenConfig config() {
        GenConfig c = GenConfig.defaultConfig();
        c.chunkSize = 16;
        c.chunkBuffer = 0;
        return c;
    }

    @Test
    @Timeout(30)
    void loopFillsTheWorldAroundTheCamera() throws InterruptedException {
        StreamLoop loop = new StreamLoop(config(), 100, 100);
        loop.setTickRate(0);
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            // 64px chunks, viewport [-50, 50]: chunks -1..0 on both axes
            while (loop.getWorld().loadedChunkCount() < 4 && System.nanoTime() < deadline) {
                loop.run(10);
                Thread.sleep(1);
            }

            assertEquals(4, loop.getWorld().loadedChunkCount());
            assertEquals(4, loop.getScheduler().generatedCount());
            assertTrue(loop.getWorld().isLoaded(new ChunkCoordinate(-1, -1)));
            assertNotNull(loop.getWorld().terrainAtTile(0, 0));
        } finally {
            loop.shutdown();
        }
    }

    @Test
    @Timeout(30)
    void panningMovesTheCamera() throws InterruptedException {
        StreamLoop loop = new StreamLoop(config(), 100, 100);
        loop.setTickRate(0);
        loop.setPan(600, 0);
        try {
            loop.run(60);
            assertTrue(loop.getCamera().getTargetPosition().x() > 500f);
            assertTrue(loop.getCamera().getCenter().x() > 0f);
        } finally {
            loop.shutdown();
        }
    }

    @Test
    void reconfigureRejectsInvalidConfig() {
        StreamLoop loop = new StreamLoop(config(), 100, 100);
        try {
            GenConfig bad = config();
            bad.classes = new ArrayList<>(List.of(TerrainClass.WATER));
            assertThrows(TerrainConfigException.class, () -> loop.reconfigure(bad));

            GenConfig good = config();
            good.seed = 7L;
            loop.reconfigure(good);
            assertEquals(7L, loop.getScheduler().getConfig().seed);
            assertEquals(0, loop.getWorld().loadedChunkCount());
            assertThrows(IllegalArgumentException.class, () -> loop.setTickRate(-1));
        } finally {
            loop.shutdown();
        }
    }
}
