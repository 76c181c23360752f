package com.tilestream.world.gen;

import com.tilestream.math.FractalNoise;
import com.tilestream.math.Hashing;
import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;
import com.tilestream.world.CoordinateMapper;
import com.tilestream.world.TileCoordinate;
import com.tilestream.world.TileInfo;

import java.util.List;
import java.util.logging.Logger;

/**
 * Maps a world tile coordinate to a terrain class and colour variant.
 *
 * <ol>
 *   <li>Sample the terrain field, a value in [-1, 1].</li>
 *   <li>Scale by the range table extremum and round to the nearest integer.</li>
 *   <li>Look the integer up in the flattened range table to get the class index.</li>
 *   <li>Sample the class's own variant field, take |n| * variantCount, floor and clamp.</li>
 * </ol>
 *
 * A scaled value that falls in a gap of the range table has no class;
 * {@link #classify} throws for it, which fails the chunk being generated.
 *
 * A pure function of (x, y) and the captured configuration: identical inputs
 * always give identical output. All state is final, so one classifier can be
 * shared by every generation thread.
 */
public final class TerrainClassifier {

    private static final Logger LOG = Logger.getLogger(TerrainClassifier.class.getName());

    private final GenConfig config;
    private final CoordinateMapper mapper;
    private final FractalNoise terrainNoise;
    private final FractalNoise[] variantNoise;
    private final TerrainClass[] classes;
    private final GenRangeTable ranges;
    private final int extremum;

    private TerrainClassifier(GenConfig config) {
        this.config = config;
        this.mapper = new CoordinateMapper(config.tilePixelSize, config.chunkSize);
        this.ranges = config.ranges;
        this.extremum = ranges.extremum();
        this.classes = config.classes.toArray(new TerrainClass[0]);
        this.terrainNoise = config.terrainNoise.createNoise(config.seed);
        this.variantNoise = new FractalNoise[classes.length];
        for (int i = 0; i < classes.length; i++) {
            variantNoise[i] = config.variantNoiseFor(classes[i]).createNoise(Hashing.deriveSeed(config.seed, i));
        }
    }

    /**
     * Validate a copy of the given config and build a classifier from it.
     *
     * @throws TerrainConfigException if the configuration is invalid
     */
    public static TerrainClassifier create(GenConfig config) {
        if (config == null) throw new TerrainConfigException("GenConfig must not be null");
        TerrainClassifier classifier = new TerrainClassifier(config.copy().validate());
        if (classifier.ranges.hasGaps()) {
            LOG.warning("GenRanges " + classifier.ranges + " leave values unmapped; chunks hitting them fail to generate");
        }
        return classifier;
    }

    /** Class index and variant for one world tile. */
    public TileInfo classify(int worldX, int worldY) {
        int classIndex = classIndexAt(worldX, worldY);
        return new TileInfo(classIndex, variantAt(classIndex, worldX, worldY));
    }

    /** Scaled noise value before the range lookup. */
    public int rangeIndexAt(int worldX, int worldY) {
        double n = terrainNoise.sample(worldX, worldY);
        return (int) Math.round(n * extremum);
    }

    public int classIndexAt(int worldX, int worldY) {
        return ranges.classFor(rangeIndexAt(worldX, worldY));
    }

    /** False if the tile's scaled noise value falls in a gap of the range table. */
    public boolean isClassified(int worldX, int worldY) {
        return ranges.isMapped(rangeIndexAt(worldX, worldY));
    }

    public int variantAt(int classIndex, int worldX, int worldY) {
        int count = classes[classIndex].variantCount();
        double n = Math.abs(variantNoise[classIndex].sample(worldX, worldY));
        int variant = (int) Math.floor(n * count);
        return Math.max(0, Math.min(count - 1, variant));
    }

    /** Classify every tile in the chunk's bounds. */
    public ChunkData generateChunk(ChunkCoordinate coord) {
        TileCoordinate origin = mapper.chunkOrigin(coord);
        int size = config.chunkSize;
        ChunkData data = new ChunkData(coord, origin.x(), origin.y(), size, size);
        for (int ly = 0; ly < size; ly++) {
            for (int lx = 0; lx < size; lx++) {
                data.setTile(lx, ly, classify(origin.x() + lx, origin.y() + ly));
            }
        }
        return data;
    }

    public TerrainClass getTerrainClass(int classIndex) {
        return classes[classIndex];
    }

    public int getClassCount() {
        return classes.length;
    }

    public List<TerrainClass> getClasses() {
        return List.of(classes);
    }

    public CoordinateMapper getMapper() {
        return mapper;
    }

    /** A copy of the configuration this classifier was built from. */
    public GenConfig getConfig() {
        return config.copy();
    }
}
