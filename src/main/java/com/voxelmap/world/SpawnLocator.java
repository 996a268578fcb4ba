package com.voxelmap.world;

import com.voxelmap.chunk.ChunkDecoder;
import com.voxelmap.chunk.DecodedChunk;
import com.voxelmap.save.LevelMeta;
import com.voxelmap.save.RegionCache;
import com.voxelmap.save.RegionIndex;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Finds the true spawn: the first air block at or above the spawn point declared
 * in level metadata. The declared Y is almost always the default of 64, which
 * can be inside terrain.
 */
public final class SpawnLocator {

    private static final Logger LOG = Logger.getLogger(SpawnLocator.class.getName());

    public static final String SPAWN_KIND = "spawn";

    private SpawnLocator() {}

    /**
     * Locate the true spawn and describe it as a point of interest.
     *
     * @throws WorldIndexException if the spawn chunk's region was never discovered,
     *         or its slot in that region is empty
     * @throws IOException if the chunk cannot be read or decoded
     */
    public static PointOfInterest locate(LevelMeta meta, RegionIndex regions, RegionCache cache,
                                         ChunkDecoder decoder) throws IOException, WorldIndexException {
        int spawnX = meta.getSpawnX();
        int spawnY = meta.getSpawnY();
        int spawnZ = meta.getSpawnZ();

        ChunkPos chunk = ChunkPos.fromBlockPos(spawnX, spawnZ);

        Optional<Path> regionPath = regions.getRegionPath(chunk.x(), chunk.y());
        if (regionPath.isEmpty()) {
            throw new WorldIndexException(WorldIndexException.Reason.SPAWN_REGION_MISSING,
                "Spawn chunk " + chunk.x() + "," + chunk.y() + " is outside every discovered region");
        }

        Optional<InputStream> payload = cache.loadChunk(regionPath.get(), chunk.x(), chunk.y());
        if (payload.isEmpty()) {
            throw new WorldIndexException(WorldIndexException.Reason.SPAWN_CHUNK_MISSING,
                "Spawn chunk " + chunk.x() + "," + chunk.y() + " has no data in " + regionPath.get());
        }

        DecodedChunk decoded;
        try (InputStream in = payload.get()) {
            decoded = decoder.decode(in);
        }

        int inChunkX = spawnX - chunk.blockX();
        int inChunkZ = spawnZ - chunk.blockZ();
        int trueY = findAirAbove(decoded.getBlocks(), inChunkX, inChunkZ, spawnY);

        LOG.info("True spawn at " + spawnX + "," + trueY + "," + spawnZ + " (declared Y " + spawnY + ")");

        // longs so the marker compares equal after a side-car reload
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("chunkLocalX", (long) inChunkX);
        extra.put("chunkLocalZ", (long) inChunkZ);
        return new PointOfInterest(spawnX, trueY, spawnZ, "Spawn", SPAWN_KIND, extra);
    }

    /**
     * Scan up the column from {@code startY} for the first air block (id 0).
     * Stops at the world ceiling without reading past it, so a column that is
     * solid to the top yields {@link WorldConstants#WORLD_HEIGHT}. A start below
     * the floor begins at 0.
     */
    static int findAirAbove(byte[] blocks, int localX, int localZ, int startY) {
        if (blocks.length != WorldConstants.CHUNK_VOLUME) {
            throw new IllegalStateException("Expected " + WorldConstants.CHUNK_VOLUME
                + " block ids, got " + blocks.length);
        }
        int column = (localX * WorldConstants.CHUNK_SIZE + localZ) * WorldConstants.WORLD_HEIGHT;

        int y = Math.max(startY, 0);
        while (y < WorldConstants.WORLD_HEIGHT && blocks[column + y] != 0) {
            y++;
        }
        return Math.min(y, WorldConstants.WORLD_HEIGHT);
    }
}
