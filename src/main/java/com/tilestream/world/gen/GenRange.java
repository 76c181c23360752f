package com.tilestream.world.gen;

/** Closed integer interval [first, last] of scaled noise values. */
public record GenRange(int first, int last) {

    public GenRange {
        if (first > last) {
            throw new TerrainConfigException("GenRange first must be <= last, got [" + first + ", " + last + "]");
        }
    }

    public boolean contains(int value) {
        return value >= first && value <= last;
    }

    @Override
    public String toString() {
        return first + ".." + last;
    }
}
