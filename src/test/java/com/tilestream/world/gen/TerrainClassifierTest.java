package com.tilestream.world.gen;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;
import com.tilestream.world.TileInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TerrainClassifierTest {

    /** Two classes split by the sign of the noise, so both show up over a modest area. */
    private static GenConfig signSplitConfig() {
        GenConfig c = GenConfig.defaultConfig();
        c.chunkSize = 8;
        c.classes = new ArrayList<>(List.of(TerrainClass.WATER, TerrainClass.GRASS));
        c.ranges = GenRangeTable.of(-100, -1, 0, 0, 100, 1);
        return c;
    }

    @Test
    void sameInputsGiveSameTiles() {
        TerrainClassifier a = TerrainClassifier.create(GenConfig.defaultConfig());
        TerrainClassifier b = TerrainClassifier.create(GenConfig.defaultConfig());
        for (int y = -60; y < 60; y += 7) {
            for (int x = -60; x < 60; x += 7) {
                assertEquals(a.classify(x, y), b.classify(x, y));
            }
        }
    }

    @Test
    void classFollowsScaledNoiseThroughRangeTable() {
        TerrainClassifier classifier = TerrainClassifier.create(GenConfig.defaultConfig());
        GenRangeTable ranges = GenConfig.defaultConfig().ranges;
        for (int x = -300; x < 300; x += 13) {
            int scaled = classifier.rangeIndexAt(x, -x);
            assertTrue(scaled >= -3 && scaled <= 3, "scaled value " + scaled);
            assertEquals(ranges.classFor(scaled), classifier.classify(x, -x).classIndex());
        }
    }

    @Test
    void variantsStayInsideTheClassPalette() {
        TerrainClassifier classifier = TerrainClassifier.create(GenConfig.defaultConfig());
        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 40; x++) {
                TileInfo tile = classifier.classify(x, y);
                int count = classifier.getTerrainClass(tile.classIndex()).variantCount();
                assertTrue(tile.variantIndex() >= 0 && tile.variantIndex() < count);
            }
        }
    }

    @Test
    void bothSidesOfTheSplitAppear() {
        TerrainClassifier classifier = TerrainClassifier.create(signSplitConfig());
        Set<Integer> seen = new HashSet<>();
        for (int y = -500; y < 500; y += 10) {
            for (int x = -500; x < 500; x += 10) {
                seen.add(classifier.classIndexAt(x, y));
            }
        }
        assertEquals(Set.of(0, 1), seen);
    }

    @Test
    void seedChangesTheField() {
        GenConfig other = signSplitConfig();
        other.seed = 987654321L;
        TerrainClassifier a = TerrainClassifier.create(signSplitConfig());
        TerrainClassifier b = TerrainClassifier.create(other);

        int differing = 0;
        for (int x = -500; x < 500; x += 5) {
            if (a.rangeIndexAt(x, 17) != b.rangeIndexAt(x, 17)) differing++;
        }
        assertTrue(differing > 0);
    }

    @Test
    void generatedChunkCoversItsTiles() {
        TerrainClassifier classifier = TerrainClassifier.create(signSplitConfig());
        ChunkData data = classifier.generateChunk(new ChunkCoordinate(-1, 2));

        assertEquals(-8, data.getStartX());
        assertEquals(16, data.getStartY());
        assertEquals(8, data.getWidth());
        assertEquals(8, data.getHeight());
        for (int ly = 0; ly < 8; ly++) {
            for (int lx = 0; lx < 8; lx++) {
                assertEquals(classifier.classify(-8 + lx, 16 + ly), data.getTile(lx, ly));
            }
        }
    }

    @Test
    void configIsCapturedAtCreation() {
        GenConfig config = signSplitConfig();
        TerrainClassifier classifier = TerrainClassifier.create(config);
        TileInfo before = classifier.classify(123, 456);

        config.seed = 1L;
        config.classes.clear();
        classifier.getConfig().terrainNoise = new NoiseSettings(1.0, 1, 1.0, 1.0);

        assertEquals(before, classifier.classify(123, 456));
        assertEquals(2, classifier.getClassCount());
    }

    @Test
    void invalidConfigurationsAreRejected() {
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(null));

        GenConfig zeroFrequency = GenConfig.defaultConfig();
        zeroFrequency.terrainNoise = zeroFrequency.terrainNoise.withFrequency(0.0);
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(zeroFrequency));

        GenConfig noOctaves = GenConfig.defaultConfig();
        noOctaves.variantNoise.put(TerrainClass.SAND, GenConfig.DEFAULT_VARIANT_NOISE.withOctaves(0));
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(noOctaves));

        GenConfig missingClass = GenConfig.defaultConfig();
        missingClass.classes.remove(TerrainClass.ROCK);
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(missingClass));

        GenConfig negativeBuffer = GenConfig.defaultConfig();
        negativeBuffer.chunkBuffer = -1;
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(negativeBuffer));

        GenConfig zeroTile = GenConfig.defaultConfig();
        zeroTile.tilePixelSize = 0;
        assertThrows(TerrainConfigException.class, () -> TerrainClassifier.create(zeroTile));
    }

    @Test
    void variantNoiseIsConfiguredPerClass() {
        GenConfig edited = GenConfig.defaultConfig();
        edited.variantNoise.put(TerrainClass.WATER, new NoiseSettings(0.05, 1, 2.0, 0.5));
        TerrainClassifier before = TerrainClassifier.create(GenConfig.defaultConfig());
        TerrainClassifier after = TerrainClassifier.create(edited);

        int waterChanged = 0;
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 30; x++) {
                for (int classIndex = 1; classIndex < 4; classIndex++) {
                    assertEquals(before.variantAt(classIndex, x, y), after.variantAt(classIndex, x, y));
                }
                if (before.variantAt(0, x, y) != after.variantAt(0, x, y)) waterChanged++;
            }
        }
        assertTrue(waterChanged > 0);
    }

    @Test
    void classWithoutVariantEntryUsesDefault() {
        GenConfig config = GenConfig.defaultConfig();
        config.variantNoise.remove(TerrainClass.ROCK);

        assertEquals(GenConfig.DEFAULT_VARIANT_NOISE, config.variantNoiseFor(TerrainClass.ROCK));
        assertEquals(TerrainClassifier.create(GenConfig.defaultConfig()).variantAt(3, 5, 9),
            TerrainClassifier.create(config).variantAt(3, 5, 9));
    }

    @Test
    void gapInRangesFailsOnlyWhenHit() {
        GenConfig config = signSplitConfig();
        config.ranges = GenRangeTable.of(-100, -50, 0, 50, 100, 1);
        TerrainClassifier classifier = TerrainClassifier.create(config);

        int unclassified = 0;
        for (int x = 0; x < 200; x += 3) {
            if (!classifier.isClassified(x, 11)) {
                unclassified++;
                int tx = x;
                assertThrows(IllegalStateException.class, () -> classifier.classify(tx, 11));
            }
        }
        assertTrue(unclassified > 0);
    }

    @Test
    void terrainClassPalettes() {
        assertTrue(TerrainClass.WATER.collides());
        assertFalse(TerrainClass.GRASS.collides());
        assertEquals(4, TerrainClass.SAND.variantCount());
        assertEquals(TerrainClass.ROCK.color(3), TerrainClass.ROCK.color(99));
        assertEquals(TerrainClass.SAND, TerrainClass.fromString(" sand "));
        assertThrows(TerrainConfigException.class, () -> TerrainClass.fromString("LAVA"));
    }
}
