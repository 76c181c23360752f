package com.tilestream.math;

import java.util.Random;

/**
 * Single-octave 2D gradient noise with a seeded permutation table and a random
 * origin offset. The offset keeps integer tile coordinates off the lattice,
 * where gradient noise is always zero.
 *
 * Immutable after construction, so one instance can be sampled from any number
 * of generation threads at once.
 */
public class PerlinNoise {

    private final int[] perm = new int[512];
    private final double xo, yo;

    public PerlinNoise(Random random) {
        this.xo = random.nextDouble() * 256.0;
        this.yo = random.nextDouble() * 256.0;

        int[] p = new int[256];
        for (int i = 0; i < 256; i++) {
            p[i] = i;
        }

        // Fisher-Yates shuffle driven by the caller's Random
        for (int i = 0; i < 256; i++) {
            int j = random.nextInt(256 - i) + i;
            int tmp = p[i];
            p[i] = p[j];
            p[j] = tmp;
        }

        for (int i = 0; i < 256; i++) {
            perm[i] = p[i];
            perm[i + 256] = p[i];
        }
    }

    /** Fade curve: 6t^5 - 15t^4 + 10t^3 */
    private static double fade(double t) {
        return t * t * t * (t * (t * 6.0 - 15.0) + 10.0);
    }

    private static double lerp(double t, double a, double b) {
        return a + t * (b - a);
    }

    /** Gradient function from the classic 3D table, evaluated on the z = 0 plane. */
    private static double grad(int hash, double x, double y) {
        int h = hash & 15;
        double u = h < 8 ? x : 0.0;
        double v = h < 4 ? 0.0 : (h == 12 || h == 14 ? x : y);
        return ((h & 1) == 0 ? u : -u) + ((h & 2) == 0 ? v : -v);
    }

    /**
     * Sample noise at (x, y). Output lies roughly in [-1, 1]; callers that need
     * a hard bound clamp the result.
     */
    public double sample(double x, double y) {
        double px = x + xo;
        double py = y + yo;

        int xi = (int) Math.floor(px);
        int yi = (int) Math.floor(py);

        double xf = px - xi;
        double yf = py - yi;

        double u = fade(xf);
        double v = fade(yf);

        xi &= 255;
        yi &= 255;

        int a = perm[xi] + yi;
        int b = perm[xi + 1] + yi;

        return lerp(v,
            lerp(u, grad(perm[a], xf, yf), grad(perm[b], xf - 1, yf)),
            lerp(u, grad(perm[a + 1], xf, yf - 1), grad(perm[b + 1], xf - 1, yf - 1))
        );
    }
}
