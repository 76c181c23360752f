package com.tilestream.math;

import java.util.Random;

/**
 * Fractal Brownian motion over {@link PerlinNoise} octaves.
 *
 * Each octave multiplies the frequency by {@code lacunarity} and the amplitude
 * by {@code gain}. The octave sum is divided by the total amplitude so the
 * result is normalized to [-1, 1] regardless of octave count, then clamped.
 *
 * Thread-safe: all state is final and read-only after construction.
 */
public class FractalNoise {

    private final PerlinNoise[] octaves;
    private final double frequency;
    private final double lacunarity;
    private final double gain;
    private final double bounding;

    /**
     * @param seed       noise seed; equal seeds yield identical fields
     * @param frequency  base frequency applied to input coordinates
     * @param octaveCount number of octaves, at least 1
     * @param lacunarity per-octave frequency multiplier
     * @param gain       per-octave amplitude multiplier
     */
    public FractalNoise(long seed, double frequency, int octaveCount, double lacunarity, double gain) {
        if (octaveCount < 1) {
            throw new IllegalArgumentException("octaveCount must be >= 1, got " + octaveCount);
        }
        this.frequency = frequency;
        this.lacunarity = lacunarity;
        this.gain = gain;
        this.octaves = new PerlinNoise[octaveCount];

        Random random = new Random(seed);
        for (int i = 0; i < octaveCount; i++) {
            this.octaves[i] = new PerlinNoise(random);
        }

        double amp = 1.0;
        double ampSum = 0.0;
        for (int i = 0; i < octaveCount; i++) {
            ampSum += Math.abs(amp);
            amp *= gain;
        }
        this.bounding = ampSum > 0.0 ? 1.0 / ampSum : 1.0;
    }

    /** Sample the field at (x, y). Always returns a value in [-1, 1]. */
    public double sample(double x, double y) {
        double fx = x * frequency;
        double fy = y * frequency;
        double amp = 1.0;
        double total = 0.0;

        for (PerlinNoise octave : octaves) {
            total += octave.sample(fx, fy) * amp;
            fx *= lacunarity;
            fy *= lacunarity;
            amp *= gain;
        }

        return Math.max(-1.0, Math.min(1.0, total * bounding));
    }

    public int getOctaveCount() {
        return octaves.length;
    }
}
