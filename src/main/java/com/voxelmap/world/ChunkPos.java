package com.voxelmap.world;

/**
 * Immutable 2D chunk coordinate (x, y). The second axis is the world's Z axis;
 * the map pipeline calls it y.
 */
public record ChunkPos(int x, int y) {

    public static ChunkPos fromBlockPos(int bx, int bz) {
        return new ChunkPos(
            Math.floorDiv(bx, WorldConstants.CHUNK_SIZE),
            Math.floorDiv(bz, WorldConstants.CHUNK_SIZE)
        );
    }

    public int blockX() { return x * WorldConstants.CHUNK_SIZE; }
    public int blockZ() { return y * WorldConstants.CHUNK_SIZE; }
}
