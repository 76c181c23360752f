package com.tilestream.world.gen;

/**
 * Slider-editable noise parameters with their allowed range and step.
 * {@link #apply} snaps a raw value to the step grid, clamps it into range and
 * returns the updated settings.
 */
public enum NoiseParameter {

    FREQUENCY("Frequency",   0.001, 2.0, 0.001),
    OCTAVES("Octaves",       1.0,   8.0, 1.0),
    LACUNARITY("Lacunarity", 0.1,   4.0, 0.1),
    GAIN("Gain",             0.0,   1.0, 0.01);

    private final String displayName;
    private final double min;
    private final double max;
    private final double step;

    NoiseParameter(String displayName, double min, double max, double step) {
        this.displayName = displayName;
        this.min = min;
        this.max = max;
        this.step = step;
    }

    public String getDisplayName() { return displayName; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getStep() { return step; }

    /** Snap to the step grid anchored at min, then clamp to [min, max]. */
    public double snap(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException(displayName + " value must not be NaN");
        }
        double snapped = min + Math.round((value - min) / step) * step;
        return Math.max(min, Math.min(max, snapped));
    }

    public double read(NoiseSettings settings) {
        return switch (this) {
            case FREQUENCY -> settings.frequency();
            case OCTAVES -> settings.octaves();
            case LACUNARITY -> settings.lacunarity();
            case GAIN -> settings.gain();
        };
    }

    public NoiseSettings apply(NoiseSettings settings, double value) {
        double v = snap(value);
        return switch (this) {
            case FREQUENCY -> settings.withFrequency(v);
            case OCTAVES -> settings.withOctaves((int) Math.round(v));
            case LACUNARITY -> settings.withLacunarity(v);
            case GAIN -> settings.withGain(v);
        };
    }

    /** Label text as shown next to a slider, e.g. "Gain: 0.5". */
    public String format(double value) {
        return displayName + ": " + value;
    }
}
