package com.tilestream.world.gen;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Reads and writes {@link GenConfig} as a simple key=value properties file.
 * Missing keys fall back to {@link GenConfig#defaultConfig()} values.
 *
 * <pre>
 * chunkSize=600
 * terrain.frequency=0.01
 * variant.SAND.gain=0.4
 * classes=WATER,GRASS,SAND,ROCK
 * ranges=-3..-2:0,-1..1:1,2..2:2,3..3:3
 * </pre>
 */
public final class GenConfigLoader {

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULT_RESOURCE = "/tilestream.properties";

    private GenConfigLoader() {}

    /** Load the classpath defaults, or the built-in defaults if the resource is absent. */
    public static GenConfig loadDefaults() throws IOException {
        try (InputStream is = GenConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) return GenConfig.defaultConfig();
            Properties props = new Properties();
            props.load(is);
            return fromProperties(props);
        }
    }

    public static GenConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        }
        return fromProperties(props);
    }

    public static void save(GenConfig config, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream os = Files.newOutputStream(file)) {
            toProperties(config).store(os, "Terrain streaming configuration");
        }
    }

    /**
     * Build a config from properties. The result is not validated; callers run
     * {@link GenConfig#validate()} (the classifier does so on construction).
     *
     * @throws TerrainConfigException if a value cannot be parsed
     */
    public static GenConfig fromProperties(Properties props) {
        GenConfig c = GenConfig.defaultConfig();
        c.tilePixelSize = intValue(props, "tilePixelSize", c.tilePixelSize);
        c.chunkSize = intValue(props, "chunkSize", c.chunkSize);
        c.chunkBuffer = intValue(props, "chunkBuffer", c.chunkBuffer);
        c.maxConcurrentGenerations = intValue(props, "maxConcurrentGenerations", c.maxConcurrentGenerations);
        c.chunksToApplyPerTick = intValue(props, "chunksToApplyPerTick", c.chunksToApplyPerTick);
        c.maxRetries = intValue(props, "maxRetries", c.maxRetries);
        c.generationTimeoutTicks = intValue(props, "generationTimeoutTicks", c.generationTimeoutTicks);
        c.seed = longValue(props, "seed", c.seed);
        c.terrainNoise = noise(props, "terrain", c.terrainNoise);
        // variant.* is shared by every class, variant.<CLASS>.* overrides it
        NoiseSettings sharedVariant = noise(props, "variant", GenConfig.DEFAULT_VARIANT_NOISE);
        for (TerrainClass terrain : TerrainClass.values()) {
            c.variantNoise.put(terrain, noise(props, "variant." + terrain.name(), sharedVariant));
        }

        String classes = props.getProperty("classes");
        if (classes != null) {
            c.classes = parseClasses(classes);
        }
        String ranges = props.getProperty("ranges");
        if (ranges != null) {
            c.ranges = parseRanges(ranges);
        }
        return c;
    }

    public static Properties toProperties(GenConfig c) {
        Properties props = new Properties();
        props.setProperty("tilePixelSize", Integer.toString(c.tilePixelSize));
        props.setProperty("chunkSize", Integer.toString(c.chunkSize));
        props.setProperty("chunkBuffer", Integer.toString(c.chunkBuffer));
        props.setProperty("maxConcurrentGenerations", Integer.toString(c.maxConcurrentGenerations));
        props.setProperty("chunksToApplyPerTick", Integer.toString(c.chunksToApplyPerTick));
        props.setProperty("maxRetries", Integer.toString(c.maxRetries));
        props.setProperty("generationTimeoutTicks", Integer.toString(c.generationTimeoutTicks));
        props.setProperty("seed", Long.toString(c.seed));
        putNoise(props, "terrain", c.terrainNoise);
        for (TerrainClass terrain : TerrainClass.values()) {
            putNoise(props, "variant." + terrain.name(), c.variantNoiseFor(terrain));
        }

        List<String> names = new ArrayList<>();
        for (TerrainClass tc : c.classes) names.add(tc.name());
        props.setProperty("classes", String.join(",", names));
        props.setProperty("ranges", c.ranges.toString());
        return props;
    }

    /** Parse "WATER,GRASS,..." into a class table. */
    public static List<TerrainClass> parseClasses(String text) {
        List<TerrainClass> list = new ArrayList<>();
        for (String part : text.split(",")) {
            if (part.isBlank()) continue;
            list.add(TerrainClass.fromString(part));
        }
        return list;
    }

    /** Parse "-1..1:0,2..3:1" into a range table. */
    public static GenRangeTable parseRanges(String text) {
        List<GenRangeTable.Entry> entries = new ArrayList<>();
        for (String part : text.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) continue;
            int colon = entry.lastIndexOf(':');
            int dots = entry.indexOf("..", 1);
            if (colon < 0 || dots < 0 || dots > colon) {
                throw new TerrainConfigException("Malformed range entry '" + entry + "', expected first..last:class");
            }
            try {
                int first = Integer.parseInt(entry.substring(0, dots).trim());
                int last = Integer.parseInt(entry.substring(dots + 2, colon).trim());
                int classIndex = Integer.parseInt(entry.substring(colon + 1).trim());
                entries.add(new GenRangeTable.Entry(new GenRange(first, last), classIndex));
            } catch (NumberFormatException e) {
                throw new TerrainConfigException("Malformed range entry '" + entry + "'", e);
            }
        }
        return new GenRangeTable(entries);
    }

    private static NoiseSettings noise(Properties props, String prefix, NoiseSettings def) {
        return new NoiseSettings(
            doubleValue(props, prefix + ".frequency", def.frequency()),
            intValue(props, prefix + ".octaves", def.octaves()),
            doubleValue(props, prefix + ".lacunarity", def.lacunarity()),
            doubleValue(props, prefix + ".gain", def.gain()));
    }

    private static void putNoise(Properties props, String prefix, NoiseSettings n) {
        props.setProperty(prefix + ".frequency", Double.toString(n.frequency()));
        props.setProperty(prefix + ".octaves", Integer.toString(n.octaves()));
        props.setProperty(prefix + ".lacunarity", Double.toString(n.lacunarity()));
        props.setProperty(prefix + ".gain", Double.toString(n.gain()));
    }

    private static int intValue(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new TerrainConfigException("Property '" + key + "' is not an integer: " + v, e);
        }
    }

    private static long longValue(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new TerrainConfigException("Property '" + key + "' is not an integer: " + v, e);
        }
    }

    private static double doubleValue(Properties props, String key, double def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new TerrainConfigException("Property '" + key + "' is not a number: " + v, e);
        }
    }
}
