package com.tilestream.world.stream;

import com.tilestream.render.ChunkRenderer;
import com.tilestream.render.ViewportProvider;
import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.gen.NoiseParameter;
import com.tilestream.world.gen.NoiseSettings;
import com.tilestream.world.gen.TerrainClass;
import com.tilestream.world.gen.TerrainClassifier;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayFIFOQueue;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Streams terrain chunks around the viewport.
 *
 * Each {@link #tick()} runs, in order:
 * <ol>
 *   <li>queue visible chunks not seen yet, closest to the viewport centre first</li>
 *   <li>dispatch queued chunks to the generation pool while fewer than K are generating</li>
 *   <li>hand at most A completed chunks to the renderer</li>
 *   <li>fail chunks that exceeded the generation timeout</li>
 *   <li>drain failures and re-queue them, or abandon them once retries run out</li>
 * </ol>
 *
 * Threading: every method except the generation tasks themselves runs on the
 * single scheduling thread, so the scheduler's sets and queue need no locks.
 * Tasks communicate back only through the two concurrent result queues.
 *
 * Every dispatch gets a ticket. A result is applied only while its ticket is
 * still the current one for its coordinate, so results of dispatches made
 * before {@link #invalidateAll()} or before a timeout are dropped.
 */
public class ChunkScheduler {

    private static final Logger LOG = Logger.getLogger(ChunkScheduler.class.getName());

    private final ViewportProvider viewport;
    private final ChunkRenderer renderer;
    private final GenerationPool pool;
    private final Function<TerrainClassifier, ChunkGenerator> generatorFactory;

    private GenConfig config;
    private TerrainClassifier classifier;
    private ChunkGenerator generator;
    private VisibilityPlanner planner;

    // ---- Scheduling state (scheduling thread only) ----

    /** Chunks waiting for dispatch, in admission order. */
    private final LongArrayFIFOQueue pending = new LongArrayFIFOQueue();
    /** Membership mirror of {@link #pending} for O(1) dedup. */
    private final LongOpenHashSet queued = new LongOpenHashSet();
    /** Generating chunk → ticket of its current dispatch. */
    private final Long2LongOpenHashMap generating = new Long2LongOpenHashMap();
    /** Generating chunk → tick it was dispatched on. */
    private final Long2LongOpenHashMap dispatchedAt = new Long2LongOpenHashMap();
    private final LongOpenHashSet generated = new LongOpenHashSet();
    /** Chunks that used up their retries. Not re-admitted until invalidation. */
    private final LongOpenHashSet abandoned = new LongOpenHashSet();
    /** Failed attempts per chunk since its last success or invalidation. */
    private final Long2IntOpenHashMap failures = new Long2IntOpenHashMap();

    // ---- Result channels (many producers, one consumer) ----
    private final Queue<GenerationResult> completedQueue = new ConcurrentLinkedQueue<>();
    private final Queue<GenerationResult> failedQueue = new ConcurrentLinkedQueue<>();

    private long nextTicket = 1;
    private long tickCount;
    private long staleDropped;
    private boolean ticking;

    /**
     * Create a scheduler with its own generation thread pool of K threads.
     *
     * @throws com.tilestream.world.gen.TerrainConfigException if the config is invalid
     */
    public ChunkScheduler(GenConfig config, ViewportProvider viewport, ChunkRenderer renderer) {
        this(config, viewport, renderer, null, classifier -> classifier::generateChunk);
    }

    /**
     * Create a scheduler running generation on the given executor (null for an
     * owned thread pool) with a custom generator built from each classifier.
     *
     * @throws com.tilestream.world.gen.TerrainConfigException if the config is invalid
     */
    public ChunkScheduler(GenConfig config, ViewportProvider viewport, ChunkRenderer renderer,
                          Executor executor, Function<TerrainClassifier, ChunkGenerator> generatorFactory) {
        this.viewport = Objects.requireNonNull(viewport, "viewport");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.generatorFactory = Objects.requireNonNull(generatorFactory, "generatorFactory");
        install(TerrainClassifier.create(config));
        renderer.configure(this.config);
        generating.defaultReturnValue(0L);
        this.pool = executor != null
            ? new GenerationPool(executor)
            : new GenerationPool(this.config.maxConcurrentGenerations);
    }

    private void install(TerrainClassifier newClassifier) {
        this.classifier = newClassifier;
        this.config = newClassifier.getConfig();
        this.generator = generatorFactory.apply(newClassifier);
        this.planner = new VisibilityPlanner(newClassifier.getMapper(), config.chunkBuffer);
    }

    // ========================================================
    // Tick
    // ========================================================

    /** Run one scheduling pass. Not reentrant. */
    public void tick() {
        if (ticking) {
            throw new IllegalStateException("tick() called from within a tick");
        }
        ticking = true;
        try {
            tickCount++;
            queueVisibleChunks();
            startPendingGenerations();
            applyCompletedChunks();
            expireTimedOutGenerations();
            requeueFailedChunks();
        } finally {
            ticking = false;
        }
    }

    private void queueVisibleChunks() {
        List<ChunkCoordinate> needed = planner.plan(
            viewport.getCenter(), viewport.getViewportSize(), viewport.getZoom(), this::isTracked);
        for (ChunkCoordinate coord : needed) {
            enqueue(coord.key());
        }
    }

    private void startPendingGenerations() {
        while (!pending.isEmpty() && generating.size() < config.maxConcurrentGenerations) {
            long key = pending.dequeueLong();
            queued.remove(key);

            // Double-check it hasn't been generated
            if (generated.contains(key) || generating.containsKey(key)) continue;

            long ticket = nextTicket++;
            generating.put(key, ticket);
            dispatchedAt.put(key, tickCount);
            pool.submit(new ChunkGenerationTask(
                ChunkCoordinate.fromKey(key), ticket, generator, completedQueue, failedQueue));
        }
    }

    private void applyCompletedChunks() {
        int applied = 0;
        GenerationResult result;
        while (applied < config.chunksToApplyPerTick && (result = completedQueue.poll()) != null) {
            long key = result.getCoord().key();
            if (!isCurrent(key, result)) continue;

            generating.remove(key);
            dispatchedAt.remove(key);
            failures.remove(key);
            generated.add(key);
            renderer.apply(result.getData());
            applied++;
        }
    }

    private void expireTimedOutGenerations() {
        int timeout = config.generationTimeoutTicks;
        if (timeout <= 0 || generating.isEmpty()) return;

        LongArrayList expired = new LongArrayList();
        for (Long2LongMap.Entry e : dispatchedAt.long2LongEntrySet()) {
            if (tickCount - e.getLongValue() > timeout) {
                expired.add(e.getLongKey());
            }
        }
        for (int i = 0; i < expired.size(); i++) {
            long key = expired.getLong(i);
            LOG.warning("Chunk " + ChunkCoordinate.fromKey(key) + " timed out after " + timeout + " ticks");
            generating.remove(key);
            dispatchedAt.remove(key);
            retryOrAbandon(key);
        }
    }

    private void requeueFailedChunks() {
        GenerationResult result;
        while ((result = failedQueue.poll()) != null) {
            long key = result.getCoord().key();
            if (!isCurrent(key, result)) continue;

            generating.remove(key);
            dispatchedAt.remove(key);
            retryOrAbandon(key);
        }
    }

    private void retryOrAbandon(long key) {
        int attempts = failures.addTo(key, 1) + 1;
        if (config.maxRetries >= 0 && attempts > config.maxRetries) {
            failures.remove(key);
            abandoned.add(key);
            LOG.warning("Abandoning chunk " + ChunkCoordinate.fromKey(key) + " after " + attempts + " failed attempts");
            return;
        }
        // Only re-queue if not already generated or queued
        if (!generated.contains(key) && !queued.contains(key)) {
            enqueue(key);
        }
    }

    private void enqueue(long key) {
        pending.enqueue(key);
        queued.add(key);
    }

    private boolean isCurrent(long key, GenerationResult result) {
        if (generating.get(key) == result.getTicket()) return true;
        staleDropped++;
        LOG.fine("Dropping stale result for chunk " + result.getCoord() + " (ticket " + result.getTicket() + ")");
        return false;
    }

    private boolean isTracked(long key) {
        return queued.contains(key) || generating.containsKey(key)
            || generated.contains(key) || abandoned.contains(key);
    }

    // ========================================================
    // Invalidation and reconfiguration
    // ========================================================

    /**
     * Forget every tracked chunk. In-flight tasks keep running; their results
     * no longer match a current ticket and are dropped when they arrive.
     */
    public void invalidateAll() {
        int dropped = 0;
        while (completedQueue.poll() != null) dropped++;
        while (failedQueue.poll() != null) dropped++;
        staleDropped += dropped;

        int inFlight = generating.size();
        pending.clear();
        queued.clear();
        generating.clear();
        dispatchedAt.clear();
        generated.clear();
        abandoned.clear();
        failures.clear();
        renderer.clear();
        LOG.info("Invalidated all chunks (" + inFlight + " in flight, " + dropped + " queued results dropped)");
    }

    /**
     * Switch to a new configuration and regenerate everything. The config is
     * validated first; on failure nothing changes. The renderer is handed the
     * new config before its chunks are cleared.
     *
     * @throws com.tilestream.world.gen.TerrainConfigException if the config is invalid
     */
    public void reconfigure(GenConfig newConfig) {
        if (ticking) {
            throw new IllegalStateException("reconfigure() called from within a tick");
        }
        install(TerrainClassifier.create(newConfig));
        pool.resize(config.maxConcurrentGenerations);
        renderer.configure(config.copy());
        LOG.info("Reconfigured: " + config);
        invalidateAll();
    }

    /** Change one terrain noise parameter (snapped and clamped) and regenerate. */
    public void setNoiseParameter(NoiseParameter parameter, double value) {
        GenConfig c = config.copy();
        c.terrainNoise = parameter.apply(c.terrainNoise, value);
        LOG.info("Terrain noise " + parameter.format(parameter.read(c.terrainNoise)));
        reconfigure(c);
    }

    /**
     * Change one variant noise parameter of the class at {@code classIndex}
     * (snapped and clamped) and regenerate. Other classes keep their settings.
     */
    public void setVariantNoiseParameter(int classIndex, NoiseParameter parameter, double value) {
        if (classIndex < 0 || classIndex >= config.classes.size()) {
            throw new IllegalArgumentException("Class index " + classIndex + " out of range [0, "
                + config.classes.size() + ")");
        }
        GenConfig c = config.copy();
        TerrainClass terrain = c.classes.get(classIndex);
        NoiseSettings updated = parameter.apply(c.variantNoiseFor(terrain), value);
        c.variantNoise.put(terrain, updated);
        LOG.info(terrain.getDisplayName() + " variant noise " + parameter.format(parameter.read(updated)));
        reconfigure(c);
    }

    public void shutdown() {
        pool.shutdown();
    }

    // ========================================================
    // Queries
    // ========================================================

    public boolean isGenerated(ChunkCoordinate coord) {
        return generated.contains(coord.key());
    }

    public ChunkState state(ChunkCoordinate coord) {
        long key = coord.key();
        if (generated.contains(key)) return ChunkState.GENERATED;
        if (generating.containsKey(key)) return ChunkState.GENERATING;
        if (queued.contains(key)) return ChunkState.QUEUED;
        if (abandoned.contains(key)) return ChunkState.ABANDONED;
        return ChunkState.UNSEEN;
    }

    /** Chunks queued but not yet dispatched. */
    public int pendingCount() {
        return pending.size();
    }

    public int generatingCount() {
        return generating.size();
    }

    public int generatedCount() {
        return generated.size();
    }

    public int deadLetterCount() {
        return abandoned.size();
    }

    /** Completed results waiting for the apply throttle. */
    public int completedBacklog() {
        return completedQueue.size();
    }

    /** Results dropped because their dispatch was no longer current. */
    public long staleDroppedCount() {
        return staleDropped;
    }

    public long tickCount() {
        return tickCount;
    }

    public TerrainClassifier getClassifier() {
        return classifier;
    }

    /** A copy of the active configuration. */
    public GenConfig getConfig() {
        return config.copy();
    }

    /** Visible chunk range (including buffer) for the current viewport. */
    public VisibilityPlanner.ChunkRect visibleChunks() {
        return planner.visibleChunks(viewport.getCenter(), viewport.getViewportSize(), viewport.getZoom());
    }

    /** Log-friendly status line. */
    public String status() {
        return String.format("tick=%d queued=%d generating=%d generated=%d abandoned=%d backlog=%d stale=%d",
            tickCount, pendingCount(), generatingCount(), generatedCount(),
            deadLetterCount(), completedBacklog(), staleDropped);
    }

    /** True if no chunk is in more than one state and the concurrency bound holds. */
    boolean isInvariantHeld() {
        for (long key : queued) {
            if (generating.containsKey(key) || generated.contains(key)) return false;
        }
        for (long key : generating.keySet()) {
            if (generated.contains(key)) return false;
        }
        return generating.size() <= config.maxConcurrentGenerations && pending.size() == queued.size();
    }
}
