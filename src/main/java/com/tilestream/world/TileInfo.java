package com.tilestream.world;

/**
 * Generated state of a single tile: index into the configured terrain class
 * table plus the colour variant within that class.
 */
public record TileInfo(int classIndex, int variantIndex) {}
