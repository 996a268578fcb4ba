package com.voxelmap.map;

/**
 * Extent of the explored world in tile coordinates, inclusive on both ends.
 */
public record TileBounds(int minCol, int maxCol, int minRow, int maxRow) {

    public TileBounds {
        if (minCol > maxCol || minRow > maxRow) {
            throw new IllegalArgumentException("Inverted bounds: cols " + minCol + ".." + maxCol
                + ", rows " + minRow + ".." + maxRow);
        }
    }

    public boolean contains(int col, int row) {
        return col >= minCol && col <= maxCol && row >= minRow && row <= maxRow;
    }

    /** Accumulates tile coordinates into a bounding box. */
    static final class Builder {
        private int minCol = Integer.MAX_VALUE, maxCol = Integer.MIN_VALUE;
        private int minRow = Integer.MAX_VALUE, maxRow = Integer.MIN_VALUE;
        private boolean empty = true;

        Builder include(TileCoord tile) {
            minCol = Math.min(minCol, tile.col());
            maxCol = Math.max(maxCol, tile.col());
            minRow = Math.min(minRow, tile.row());
            maxRow = Math.max(maxRow, tile.row());
            empty = false;
            return this;
        }

        TileBounds build() {
            if (empty) throw new IllegalStateException("No tiles included");
            return new TileBounds(minCol, maxCol, minRow, maxRow);
        }
    }
}
