package com.tilestream.world;

/** Immutable world tile coordinate. */
public record TileCoordinate(int x, int y) {}
