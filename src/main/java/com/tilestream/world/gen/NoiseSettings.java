package com.tilestream.world.gen;

import com.tilestream.math.FractalNoise;

/**
 * Fractal noise parameters.
 *
 * @param frequency  base frequency, larger values give smaller features
 * @param octaves    number of octaves, more gives more detail
 * @param lacunarity frequency multiplier per octave
 * @param gain       amplitude multiplier per octave, higher gives rougher noise
 */
public record NoiseSettings(double frequency, int octaves, double lacunarity, double gain) {

    public NoiseSettings withFrequency(double value) { return new NoiseSettings(value, octaves, lacunarity, gain); }
    public NoiseSettings withOctaves(int value) { return new NoiseSettings(frequency, value, lacunarity, gain); }
    public NoiseSettings withLacunarity(double value) { return new NoiseSettings(frequency, octaves, value, gain); }
    public NoiseSettings withGain(double value) { return new NoiseSettings(frequency, octaves, lacunarity, value); }

    /** @throws TerrainConfigException if any parameter is out of range */
    public void validate(String label) {
        if (!(frequency > 0.0) || Double.isInfinite(frequency)) {
            throw new TerrainConfigException(label + " frequency must be a positive number, got " + frequency);
        }
        if (octaves < 1) {
            throw new TerrainConfigException(label + " octaves must be >= 1, got " + octaves);
        }
        if (!(lacunarity > 0.0) || Double.isInfinite(lacunarity)) {
            throw new TerrainConfigException(label + " lacunarity must be a positive number, got " + lacunarity);
        }
        if (Double.isNaN(gain) || Double.isInfinite(gain)) {
            throw new TerrainConfigException(label + " gain must be finite, got " + gain);
        }
    }

    public FractalNoise createNoise(long seed) {
        return new FractalNoise(seed, frequency, octaves, lacunarity, gain);
    }
}
