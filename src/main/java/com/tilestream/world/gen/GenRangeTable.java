package com.tilestream.world.gen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered mapping from scaled noise values to terrain class indices.
 *
 * Invariants checked at construction:
 * <ul>
 *   <li>at least one range;</li>
 *   <li>ranges sorted by {@code first} are strictly increasing and do not overlap;</li>
 *   <li>min == -max, matching a [-1, 1] noise sample scaled by {@link #extremum()};</li>
 *   <li>max - min + 1 is at most {@link #MAX_SPAN}.</li>
 * </ul>
 * Class indices are checked against a class table separately, see
 * {@link #validateClassIndices(int)}.
 *
 * Gaps between ranges are allowed. Values in a gap have no class, and
 * {@link #classFor(int)} throws for them.
 *
 * Every value of every range is flattened into one array for O(1) lookup.
 * Immutable and safe to share across generation threads.
 */
public final class GenRangeTable {

    /** Largest number of values (max - min + 1) a table may cover. */
    public static final int MAX_SPAN = 1 << 16;

    private static final int UNMAPPED = -1;

    /** One range and the class index it maps to. */
    public record Entry(GenRange range, int classIndex) {}

    private final List<Entry> entries;
    private final int min;
    private final int max;
    private final int[] classByValue;
    private final boolean hasGaps;

    public GenRangeTable(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new TerrainConfigException("GenRanges must not be null or empty");
        }
        List<Entry> sorted = new ArrayList<>(entries);
        for (Entry e : sorted) {
            if (e == null || e.range() == null) {
                throw new TerrainConfigException("GenRanges contents must not be null");
            }
        }
        sorted.sort(Comparator.comparingInt(e -> e.range().first()));

        boolean gaps = false;
        Entry previous = null;
        for (Entry e : sorted) {
            if (previous != null) {
                if (previous.range().last() >= e.range().first()) {
                    throw new TerrainConfigException("GenRanges must not overlap: "
                        + previous.range() + " and " + e.range());
                }
                if ((long) previous.range().last() + 1 != e.range().first()) {
                    gaps = true;
                }
            }
            previous = e;
        }

        this.entries = Collections.unmodifiableList(sorted);
        this.min = sorted.get(0).range().first();
        this.max = sorted.get(sorted.size() - 1).range().last();
        if (min != -max) {
            throw new TerrainConfigException("GenRanges must be symmetric around zero: min=" + min + ", max=" + max);
        }

        long span = (long) max - min + 1;
        if (span > MAX_SPAN) {
            throw new TerrainConfigException("GenRanges span " + span + " values, at most " + MAX_SPAN + " allowed");
        }
        this.hasGaps = gaps;
        this.classByValue = new int[(int) span];
        Arrays.fill(classByValue, UNMAPPED);
        for (Entry e : sorted) {
            for (int v = e.range().first(); v <= e.range().last(); v++) {
                classByValue[v - min] = e.classIndex();
            }
        }
    }

    /** Convenience factory: {@code of(-1, 1, 0, 2, 3, 1)} reads as [-1,1]→0, [2,3]→1. */
    public static GenRangeTable of(int... firstLastClass) {
        if (firstLastClass.length == 0 || firstLastClass.length % 3 != 0) {
            throw new IllegalArgumentException("Expected (first, last, class) triples");
        }
        List<Entry> list = new ArrayList<>();
        for (int i = 0; i < firstLastClass.length; i += 3) {
            list.add(new Entry(new GenRange(firstLastClass[i], firstLastClass[i + 1]), firstLastClass[i + 2]));
        }
        return new GenRangeTable(list);
    }

    /**
     * Check every class index against a class table of the given size.
     *
     * @throws TerrainConfigException if the table is empty or an index is out of bounds
     */
    public void validateClassIndices(int classCount) {
        if (classCount <= 0) {
            throw new TerrainConfigException("Terrain class table must not be empty");
        }
        for (Entry e : entries) {
            if (e.classIndex() < 0 || e.classIndex() >= classCount) {
                throw new TerrainConfigException("GenRange " + e.range() + " maps to class index "
                    + e.classIndex() + ", but only " + classCount + " classes are configured");
            }
        }
    }

    /** Largest value in the table; noise in [-1, 1] is multiplied by this. */
    public int extremum() {
        return max;
    }

    /**
     * Class index for a scaled noise value. Values outside [-max, max] are clamped.
     *
     * @throws IllegalStateException if the value falls in a gap between ranges
     */
    public int classFor(int value) {
        int v = clamp(value);
        int classIndex = classByValue[v - min];
        if (classIndex == UNMAPPED) {
            throw new IllegalStateException("No GenRange covers scaled value " + v + " in " + this);
        }
        return classIndex;
    }

    /** True if {@link #classFor(int)} has a class for the value. */
    public boolean isMapped(int value) {
        return classByValue[clamp(value) - min] != UNMAPPED;
    }

    public boolean hasGaps() {
        return hasGaps;
    }

    private int clamp(int value) {
        return Math.max(min, Math.min(max, value));
    }

    public List<Entry> entries() {
        return entries;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry e : entries) {
            if (sb.length() > 0) sb.append(',');
            sb.append(e.range()).append(':').append(e.classIndex());
        }
        return sb.toString();
    }
}
