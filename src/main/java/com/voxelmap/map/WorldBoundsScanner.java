package com.voxelmap.map;

import com.voxelmap.save.RegionIndex;
import com.voxelmap.world.WorldConstants;
import com.voxelmap.world.WorldIndexException;
import it.unimi.dsi.fastutil.longs.LongCollection;
import it.unimi.dsi.fastutil.longs.LongIterator;

import java.util.logging.Logger;

/**
 * Computes the tile-space extent of the explored world from the set of
 * discovered regions.
 */
public final class WorldBoundsScanner {

    private static final Logger LOG = Logger.getLogger(WorldBoundsScanner.class.getName());

    private WorldBoundsScanner() {}

    /**
     * Bounding box of the chunk rectangle covered by the given regions.
     *
     * The rectangle runs from the first chunk of the lowest region to one past the
     * last chunk of the highest. All four corners are projected: the rotation does
     * not preserve per-axis extremes, so two corners under-estimate the box.
     *
     * @param regionKeys packed region keys ({@link RegionIndex#regionKey})
     * @throws WorldIndexException with {@code NO_REGIONS} if the collection is empty
     */
    public static TileBounds computeBounds(LongCollection regionKeys) throws WorldIndexException {
        if (regionKeys.isEmpty()) {
            throw new WorldIndexException(WorldIndexException.Reason.NO_REGIONS, "No chunks found!");
        }

        int minX = Integer.MAX_VALUE, maxX = Integer.MIN_VALUE;
        int minY = Integer.MAX_VALUE, maxY = Integer.MIN_VALUE;
        for (LongIterator it = regionKeys.iterator(); it.hasNext(); ) {
            long key = it.nextLong();
            int rx = RegionIndex.unpackX(key);
            int ry = RegionIndex.unpackY(key);
            minX = Math.min(minX, rx);
            maxX = Math.max(maxX, rx);
            minY = Math.min(minY, ry);
            maxY = Math.max(maxY, ry);
        }

        // region -> chunk extent
        minX *= WorldConstants.REGION_SIZE;
        minY *= WorldConstants.REGION_SIZE;
        maxX = maxX * WorldConstants.REGION_SIZE + WorldConstants.REGION_SIZE;
        maxY = maxY * WorldConstants.REGION_SIZE + WorldConstants.REGION_SIZE;

        TileBounds bounds = new TileBounds.Builder()
            .include(CoordinateTransform.convert(minX, minY))
            .include(CoordinateTransform.convert(minX, maxY))
            .include(CoordinateTransform.convert(maxX, minY))
            .include(CoordinateTransform.convert(maxX, maxY))
            .build();

        LOG.fine("Chunk extent (" + minX + "," + minY + ") to (" + maxX + "," + maxY + "), tiles " + bounds);
        return bounds;
    }
}
