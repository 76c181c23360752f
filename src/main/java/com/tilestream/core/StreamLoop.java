package com.tilestream.core;

import com.tilestream.render.PanningCamera;
import com.tilestream.render.TileWorld;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.stream.ChunkScheduler;

import java.util.logging.Logger;

/**
 * Headless driver: pans a camera across the world at a fixed cadence and
 * ticks the scheduler once per frame, logging progress.
 */
public class StreamLoop {

    private static final Logger LOG = Logger.getLogger(StreamLoop.class.getName());

    private static final int DEFAULT_TICK_RATE = 60;
    private static final int STATUS_INTERVAL = 60; // ticks

    private final ChunkScheduler scheduler;
    private final PanningCamera camera;
    private final TileWorld world;

    private float panX;
    private float panY;
    private int tickRate = DEFAULT_TICK_RATE;

    public StreamLoop(GenConfig config, float viewportWidth, float viewportHeight) {
        this.camera = new PanningCamera(viewportWidth, viewportHeight);
        this.world = new TileWorld(config);
        this.scheduler = new ChunkScheduler(config, camera, world);
    }

    /** Camera movement in world pixels per second. */
    public void setPan(float dx, float dy) {
        this.panX = dx;
        this.panY = dy;
    }

    /** Frames per second; 0 runs frames back to back. */
    public void setTickRate(int tickRate) {
        if (tickRate < 0) throw new IllegalArgumentException("tickRate must be >= 0, got " + tickRate);
        this.tickRate = tickRate;
    }

    /** Run the given number of frames, then keep the scheduler alive for the caller. */
    public void run(int frames) throws InterruptedException {
        float dt = tickRate > 0 ? 1.0f / tickRate : 1.0f / DEFAULT_TICK_RATE;
        long frameNanos = tickRate > 0 ? 1_000_000_000L / tickRate : 0L;
        long start = System.nanoTime();

        for (int frame = 0; frame < frames; frame++) {
            long frameStart = System.nanoTime();

            camera.moveBy(panX * dt, panY * dt);
            camera.update(dt);
            scheduler.tick();

            if (scheduler.tickCount() % STATUS_INTERVAL == 0) {
                LOG.info(scheduler.status() + " loaded=" + world.loadedChunkCount());
            }

            long sleepNanos = frameNanos - (System.nanoTime() - frameStart);
            if (sleepNanos > 0) {
                Thread.sleep(sleepNanos / 1_000_000L, (int) (sleepNanos % 1_000_000L));
            }
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        LOG.info("Ran " + frames + " frames in " + elapsedMs + " ms: " + scheduler.status());
    }

    /**
     * Apply a new configuration. The scheduler passes it on to the tile world.
     *
     * @throws com.tilestream.world.gen.TerrainConfigException if the config is invalid; nothing changes then
     */
    public void reconfigure(GenConfig config) {
        scheduler.reconfigure(config);
    }

    public void shutdown() {
        scheduler.shutdown();
    }

    public ChunkScheduler getScheduler() { return scheduler; }
    public PanningCamera getCamera() { return camera; }
    public TileWorld getWorld() { return world; }
}
