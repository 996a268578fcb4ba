package com.voxelmap.map;

/** Position in the diagonal tile grid. {@code col + row} is always even. */
public record TileCoord(int col, int row) {}
