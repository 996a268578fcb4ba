package com.voxelmap.world;

/** Global world dimension constants for the McRegion chunk layout. */
public final class WorldConstants {

    public static final int CHUNK_SIZE = 16;
    public static final int WORLD_HEIGHT = 128;
    public static final int CHUNK_VOLUME = CHUNK_SIZE * CHUNK_SIZE * WORLD_HEIGHT;

    // Region containers hold a 32x32 grid of chunks
    public static final int REGION_SIZE = 32;
    public static final int CHUNKS_PER_REGION = REGION_SIZE * REGION_SIZE; // 1024

    private WorldConstants() {}
}
