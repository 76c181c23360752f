package com.tilestream.tools;

import com.tilestream.world.TileInfo;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.gen.GenConfigLoader;
import com.tilestream.world.gen.TerrainClass;
import com.tilestream.world.gen.TerrainClassifier;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Standalone check of the terrain classifier: samples a square tile window
 * and prints how often each class and variant occurs.
 * Run: java -cp tilestream.jar com.tilestream.tools.ClassifierReport [seed] [radius] [config]
 */
public class ClassifierReport {

    public static void main(String[] args) throws IOException {
        GenConfig config = args.length > 2
            ? GenConfigLoader.load(Path.of(args[2]))
            : GenConfigLoader.loadDefaults();
        if (args.length > 0) config.seed = Long.parseLong(args[0]);
        int radius = args.length > 1 ? Integer.parseInt(args[1]) : 256;

        TerrainClassifier classifier = TerrainClassifier.create(config);
        Histogram histogram = sample(classifier, radius);
        System.out.print(format(classifier, histogram));
    }

    /**
     * Sample counts over tiles in [-radius, radius) on both axes.
     *
     * @param counts   counts[classIndex][variant]
     * @param unmapped tiles whose scaled value falls in a gap of the range table
     */
    public record Histogram(int[][] counts, int unmapped) {}

    public static Histogram sample(TerrainClassifier classifier, int radius) {
        int[][] counts = new int[classifier.getClassCount()][];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = new int[classifier.getTerrainClass(i).variantCount()];
        }
        int unmapped = 0;
        for (int y = -radius; y < radius; y++) {
            for (int x = -radius; x < radius; x++) {
                if (!classifier.isClassified(x, y)) {
                    unmapped++;
                    continue;
                }
                TileInfo info = classifier.classify(x, y);
                counts[info.classIndex()][info.variantIndex()]++;
            }
        }
        return new Histogram(counts, unmapped);
    }

    public static String format(TerrainClassifier classifier, Histogram histogram) {
        int[][] counts = histogram.counts();
        long total = histogram.unmapped();
        for (int[] row : counts) for (int n : row) total += n;

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("=== Terrain classes (%d samples) ===%n", total));
        for (int i = 0; i < counts.length; i++) {
            TerrainClass tc = classifier.getTerrainClass(i);
            long classTotal = 0;
            for (int n : counts[i]) classTotal += n;
            sb.append(String.format("%-6s %8d (%5.1f%%)  variants:", tc.getDisplayName(), classTotal,
                total > 0 ? 100.0 * classTotal / total : 0.0));
            for (int n : counts[i]) sb.append(' ').append(n);
            sb.append(String.format("%n"));
        }
        if (histogram.unmapped() > 0) {
            sb.append(String.format("%-6s %8d (%5.1f%%)%n", "None", histogram.unmapped(),
                100.0 * histogram.unmapped() / total));
        }
        return sb.toString();
    }
}
