package com.tilestream.world.gen;

import com.tilestream.world.WorldConstants;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Terrain streaming configuration. Holds every tunable parameter for chunk
 * geometry, scheduling budgets, noise and classification.
 *
 * All fields are public for easy slider binding. Consumers never read a live
 * instance: the scheduler and classifier take a validated {@link #copy()} at
 * construction or reconfiguration, so later edits only take effect through
 * {@code ChunkScheduler.reconfigure}.
 *
 * === Field groups ===
 * 1. Geometry (tile pixel size, chunk size)
 * 2. Scheduling (buffer, concurrency bound, apply throttle, retries, timeout)
 * 3. Noise (seed, main field, per-class variant field)
 * 4. Classification (class table, range table)
 */
public class GenConfig {

    // ========================================================
    // Geometry
    // ========================================================

    /** Tile edge length in world pixels. */
    public int tilePixelSize = WorldConstants.TILE_PIXEL_SIZE;

    /** Chunk edge length in tiles. */
    public int chunkSize = WorldConstants.CHUNK_SIZE;

    // ========================================================
    // Scheduling
    // ========================================================

    /** Extra chunks generated beyond the visible area on every side. */
    public int chunkBuffer = 1;

    /** Upper bound on chunks generating at once (K). */
    public int maxConcurrentGenerations = 4;

    /** Completed chunks handed to the renderer per tick (A). */
    public int chunksToApplyPerTick = 2;

    /** Retries after the first failed attempt before a chunk is abandoned. Negative = unlimited. */
    public int maxRetries = 5;

    /** Ticks a chunk may stay generating before it is treated as failed. 0 = never. */
    public int generationTimeoutTicks = 0;

    // ========================================================
    // Noise
    // ========================================================

    public long seed = 12345L;

    /** Field that decides the terrain class. */
    public NoiseSettings terrainNoise = new NoiseSettings(0.01, 3, 2.0, 0.5);

    /** Variant field settings for a class with no entry in {@link #variantNoise}. */
    public static final NoiseSettings DEFAULT_VARIANT_NOISE = new NoiseSettings(0.93, 2, 1.0, 0.28);

    /**
     * Field that picks the colour variant, per terrain class. Each class also
     * gets its own seed. A class appearing twice in the class table shares
     * its settings.
     */
    public Map<TerrainClass, NoiseSettings> variantNoise = defaultVariantNoise();

    // ========================================================
    // Classification
    // ========================================================

    /** Terrain class table; range entries refer to classes by index into this list. */
    public List<TerrainClass> classes = new ArrayList<>(List.of(
        TerrainClass.WATER, TerrainClass.GRASS, TerrainClass.SAND, TerrainClass.ROCK));

    /** Scaled-noise ranges mapped to class indices. */
    public GenRangeTable ranges = GenRangeTable.of(
        -3, -2, 0,
        -1,  1, 1,
         2,  2, 2,
         3,  3, 3);

    public static GenConfig defaultConfig() {
        return new GenConfig();
    }

    private static Map<TerrainClass, NoiseSettings> defaultVariantNoise() {
        Map<TerrainClass, NoiseSettings> map = new EnumMap<>(TerrainClass.class);
        for (TerrainClass terrain : TerrainClass.values()) {
            map.put(terrain, DEFAULT_VARIANT_NOISE);
        }
        return map;
    }

    /** Variant noise settings of one class, falling back to {@link #DEFAULT_VARIANT_NOISE}. */
    public NoiseSettings variantNoiseFor(TerrainClass terrain) {
        NoiseSettings settings = variantNoise != null ? variantNoise.get(terrain) : null;
        return settings != null ? settings : DEFAULT_VARIANT_NOISE;
    }

    /**
     * Check every invariant. Called before any scheduling begins.
     *
     * @throws TerrainConfigException on the first violation found
     */
    public GenConfig validate() {
        if (tilePixelSize <= 0) throw new TerrainConfigException("tilePixelSize must be > 0, got " + tilePixelSize);
        if (chunkSize <= 0) throw new TerrainConfigException("chunkSize must be > 0, got " + chunkSize);
        if (chunkBuffer < 0) throw new TerrainConfigException("chunkBuffer must be >= 0, got " + chunkBuffer);
        if (maxConcurrentGenerations <= 0) {
            throw new TerrainConfigException("maxConcurrentGenerations must be > 0, got " + maxConcurrentGenerations);
        }
        if (chunksToApplyPerTick <= 0) {
            throw new TerrainConfigException("chunksToApplyPerTick must be > 0, got " + chunksToApplyPerTick);
        }
        if (generationTimeoutTicks < 0) {
            throw new TerrainConfigException("generationTimeoutTicks must be >= 0, got " + generationTimeoutTicks);
        }
        if (terrainNoise == null) throw new TerrainConfigException("terrainNoise must not be null");
        if (variantNoise == null) throw new TerrainConfigException("variantNoise must not be null");
        terrainNoise.validate("terrainNoise");

        if (classes == null || classes.isEmpty()) {
            throw new TerrainConfigException("Terrain class table must not be null or empty");
        }
        for (TerrainClass c : classes) {
            if (c == null) throw new TerrainConfigException("Terrain class table must not contain null");
            variantNoiseFor(c).validate("variantNoise." + c.name());
        }
        if (ranges == null) throw new TerrainConfigException("GenRanges must not be null");
        ranges.validateClassIndices(classes.size());
        return this;
    }

    /** Deep copy this config for safe modification. */
    public GenConfig copy() {
        GenConfig c = new GenConfig();
        c.tilePixelSize = this.tilePixelSize;
        c.chunkSize = this.chunkSize;
        c.chunkBuffer = this.chunkBuffer;
        c.maxConcurrentGenerations = this.maxConcurrentGenerations;
        c.chunksToApplyPerTick = this.chunksToApplyPerTick;
        c.maxRetries = this.maxRetries;
        c.generationTimeoutTicks = this.generationTimeoutTicks;
        c.seed = this.seed;
        // records and the range table are immutable, sharing is safe
        c.terrainNoise = this.terrainNoise;
        c.variantNoise = new EnumMap<>(TerrainClass.class);
        if (this.variantNoise != null) c.variantNoise.putAll(this.variantNoise);
        c.classes = this.classes != null ? new ArrayList<>(this.classes) : null;
        c.ranges = this.ranges;
        return c;
    }

    @Override
    public String toString() {
        return "GenConfig{chunkSize=" + chunkSize +
            ", tilePixelSize=" + tilePixelSize +
            ", buffer=" + chunkBuffer +
            ", K=" + maxConcurrentGenerations +
            ", A=" + chunksToApplyPerTick +
            ", maxRetries=" + maxRetries +
            ", seed=" + seed +
            ", terrainNoise=" + terrainNoise +
            ", classes=" + classes +
            ", ranges=" + ranges + "}";
    }
}
