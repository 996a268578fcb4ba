package com.voxelmap.map;

import com.voxelmap.world.ChunkPos;

/**
 * Maps chunk coordinates onto the 45-degree rotated tile grid the map is drawn in.
 * Columns are the sum of the chunk coordinates, rows the difference, so each
 * chunk becomes an isometric tile with north up.
 *
 * {@link #convert} and {@link #unconvert} must change together.
 */
public final class CoordinateTransform {

    private CoordinateTransform() {}

    public static TileCoord convert(int chunkX, int chunkY) {
        return new TileCoord(chunkX + chunkY, chunkY - chunkX);
    }

    /**
     * Inverse of {@link #convert}.
     *
     * @throws IllegalArgumentException if {@code col + row} is odd (no chunk maps there)
     */
    public static ChunkPos unconvert(int col, int row) {
        if (((col - row) & 1) != 0) {
            throw new IllegalArgumentException("Not a chunk tile: col=" + col + ", row=" + row);
        }
        // exact division; floorDiv keeps the sign convention explicit
        return new ChunkPos(Math.floorDiv(col - row, 2), Math.floorDiv(col + row, 2));
    }

    public static ChunkPos unconvert(TileCoord tile) {
        return unconvert(tile.col(), tile.row());
    }
}
