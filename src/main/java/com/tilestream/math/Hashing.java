package com.tilestream.math;

/** Deterministic hash functions for seed derivation. */
public final class Hashing {

    private Hashing() {}

    /**
     * Derive an independent sub-seed from a world seed and a salt, e.g. one
     * variant-noise seed per terrain class.
     */
    public static long deriveSeed(long seed, int salt) {
        long h = seed + 0x9E3779B97F4A7C15L * (salt + 1L);
        h = (h ^ (h >>> 30)) * 0xBF58476D1CE4E5B9L;
        h = (h ^ (h >>> 27)) * 0x94D049BB133111EBL;
        return h ^ (h >>> 31);
    }
}
