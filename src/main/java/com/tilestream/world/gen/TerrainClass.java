package com.tilestream.world.gen;

/**
 * Terrain categories a tile can be classified as. Each class has a fixed list
 * of RGB colour variants and a collision flag. Static data; never mutated.
 */
public enum TerrainClass {

    WATER("Water", true,  0x0068D8, 0x0064D1, 0x0060C9, 0x005CC1),
    GRASS("Grass", false, 0x00B756, 0x00AF53, 0x00A850, 0x00A04B),
    SAND ("Sand",  false, 0xFFCC4A, 0xF7C546, 0xEFBD42, 0xE8B941),
    ROCK ("Rock",  true,  0x916800, 0x896200, 0x825D00, 0x7A5700);

    private final String displayName;
    private final boolean collides;
    private final int[] colors;

    TerrainClass(String displayName, boolean collides, int... colors) {
        this.displayName = displayName;
        this.collides = collides;
        this.colors = colors;
    }

    public String getDisplayName() { return displayName; }

    /** Whether tiles of this class register collision with the renderer. */
    public boolean collides() { return collides; }

    public int variantCount() { return colors.length; }

    /** RGB colour of the given variant; out of range variants are clamped. */
    public int color(int variant) {
        int v = Math.max(0, Math.min(colors.length - 1, variant));
        return colors[v];
    }

    /** Case-insensitive lookup by enum name. */
    public static TerrainClass fromString(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new TerrainConfigException("Unknown terrain class: " + name, e);
        }
    }
}
