package com.voxelmap.world;

import com.voxelmap.chunk.BiomeDataPreparer;
import com.voxelmap.chunk.ChunkDecoder;
import com.voxelmap.chunk.DecodedChunk;
import com.voxelmap.config.IndexConfig;
import com.voxelmap.map.CoordinateTransform;
import com.voxelmap.map.TileBounds;
import com.voxelmap.map.TileCoord;
import com.voxelmap.map.WorldBoundsScanner;
import com.voxelmap.save.LevelMeta;
import com.voxelmap.save.LevelMetaReader;
import com.voxelmap.save.PersistentMetadataStore;
import com.voxelmap.save.PersistentState;
import com.voxelmap.save.RegionCache;
import com.voxelmap.save.RegionFileRecord;
import com.voxelmap.save.RegionIndex;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Index of one world's region containers, shared by the tile renderers.
 *
 * {@link #open} does all the work up front: version check, region discovery,
 * tile bounds, opening every region, loading the side-car file and locating the
 * true spawn. Afterwards the index is read-only apart from the POI list, and
 * chunk lookups may run from any number of threads.
 *
 * Changes to the POI list are only written by an explicit {@link #save()}.
 */
public class WorldIndex implements Closeable {

    private static final Logger LOG = Logger.getLogger(WorldIndex.class.getName());

    /** External decoders the index delegates to. Any of the optional ones may be null. */
    public record Collaborators(LevelMetaReader levelMetaReader, ChunkDecoder chunkDecoder,
                                BiomeDataPreparer biomeDataPreparer) {

        /** Properties-backed level metadata, no chunk decoder, no biome preparation. */
        public static Collaborators defaults() {
            return new Collaborators(LevelMeta::load, null, null);
        }
    }

    private final Path worldDir;
    private final LevelMeta levelMeta;
    private final RegionIndex regions;
    private final RegionCache regionCache;
    private final TileBounds bounds;
    private final PersistentMetadataStore store;
    private final Path sidecarFile;
    private final PersistentState state;
    private final ChunkDecoder chunkDecoder;

    private WorldIndex(Path worldDir, LevelMeta levelMeta, RegionIndex regions, RegionCache regionCache,
                       TileBounds bounds, PersistentMetadataStore store, Path sidecarFile,
                       PersistentState state, ChunkDecoder chunkDecoder) {
        this.worldDir = worldDir;
        this.levelMeta = levelMeta;
        this.regions = regions;
        this.regionCache = regionCache;
        this.bounds = bounds;
        this.store = store;
        this.sidecarFile = sidecarFile;
        this.state = state;
        this.chunkDecoder = chunkDecoder;
    }

    /**
     * Index a world.
     *
     * @param worldDir   world root containing the level metadata and {@code region/}
     * @param regionList region list lines to use instead of walking the region
     *                   directory, or null
     * @throws WorldIndexException for an unsupported format, a world without regions,
     *         or a spawn point that cannot be resolved
     */
    public static WorldIndex open(Path worldDir, List<String> regionList, IndexConfig config,
                                  Collaborators collaborators) throws IOException, WorldIndexException {
        LevelMeta meta = collaborators.levelMetaReader().read(worldDir);
        if (meta.getVersion() != config.requiredVersion) {
            throw new WorldIndexException(WorldIndexException.Reason.UNSUPPORTED_VERSION,
                "World '" + meta.getLevelName() + "' uses chunk format " + meta.getVersion()
                    + ", only " + config.requiredVersion + " (McRegion) is supported");
        }

        RegionIndex regions = RegionIndex.discover(worldDir, regionList,
            config.regionExtension, config.excludedDimensionMarker);

        LOG.info("Scanning chunks");
        TileBounds bounds = WorldBoundsScanner.computeBounds(regions.keys());
        LOG.info("Map size: cols " + bounds.minCol() + ".." + bounds.maxCol()
            + ", rows " + bounds.minRow() + ".." + bounds.maxRow());

        if (config.useBiomeData) {
            if (collaborators.biomeDataPreparer() != null) {
                collaborators.biomeDataPreparer().prepare(worldDir);
            } else {
                LOG.warning("Biome data requested but no biome preparer is available");
            }
        }

        RegionCache cache = new RegionCache();
        try {
            warmUp(regions, cache);

            PersistentMetadataStore store = new PersistentMetadataStore();
            Path sidecarFile = worldDir.resolve(config.sidecarFileName);
            PersistentState state = store.load(sidecarFile);

            ChunkDecoder decoder = collaborators.chunkDecoder();
            if (config.locateSpawn && decoder != null) {
                state.replacePointsOfInterest(SpawnLocator.locate(meta, regions, cache, decoder));
            } else if (config.locateSpawn) {
                LOG.info("No chunk decoder available, skipping spawn search");
            }

            return new WorldIndex(worldDir, meta, regions, cache, bounds, store, sidecarFile, state, decoder);
        } catch (IOException | WorldIndexException | RuntimeException e) {
            try {
                cache.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /** Open every discovered region that exists on disk, parsing its header once. */
    private static void warmUp(RegionIndex regions, RegionCache cache) throws IOException {
        int missing = 0;
        for (RegionFileRecord record : regions.records()) {
            if (Files.exists(record.path())) {
                cache.get(record.path());
            } else {
                missing++;
            }
        }
        if (missing > 0) {
            LOG.warning(missing + " listed region files do not exist yet; they will be opened on first use");
        }
        LOG.fine("Opened " + cache.size() + " region files");
    }

    // ---- Chunk lookup ----

    /** Path of the region holding chunk (chunkX, chunkY), empty if not discovered. */
    public Optional<Path> getRegionPath(int chunkX, int chunkY) {
        return regions.getRegionPath(chunkX, chunkY);
    }

    /** Decompressed chunk payload, empty if the region has no data for that chunk. */
    public Optional<InputStream> loadRawChunk(Path regionPath, int chunkX, int chunkY) throws IOException {
        return regionCache.loadChunk(regionPath, chunkX, chunkY);
    }

    /**
     * Decoded chunk, empty if the region has no data for that chunk.
     *
     * @throws IllegalStateException if the index was opened without a chunk decoder
     */
    public Optional<DecodedChunk> loadChunk(Path regionPath, int chunkX, int chunkY) throws IOException {
        if (chunkDecoder == null) {
            throw new IllegalStateException("No chunk decoder configured");
        }
        Optional<InputStream> payload = loadRawChunk(regionPath, chunkX, chunkY);
        if (payload.isEmpty()) return Optional.empty();
        try (InputStream in = payload.get()) {
            return Optional.of(chunkDecoder.decode(in));
        }
    }

    // ---- Tile coordinates ----

    public TileCoord convert(int chunkX, int chunkY) {
        return CoordinateTransform.convert(chunkX, chunkY);
    }

    public ChunkPos unconvert(int col, int row) {
        return CoordinateTransform.unconvert(col, row);
    }

    public TileBounds getBounds() { return bounds; }
    public int getMinCol() { return bounds.minCol(); }
    public int getMaxCol() { return bounds.maxCol(); }
    public int getMinRow() { return bounds.minRow(); }
    public int getMaxRow() { return bounds.maxRow(); }

    // ---- Points of interest ----

    public void addPointOfInterest(PointOfInterest poi) {
        state.addPointOfInterest(poi);
    }

    public List<PointOfInterest> getPointsOfInterest() {
        return state.getPointsOfInterest();
    }

    public PersistentState getPersistentState() { return state; }

    /** Write the current side-car state to disk. */
    public void save() throws IOException {
        store.save(sidecarFile, state);
    }

    // ---- Accessors ----

    public Path getWorldDir() { return worldDir; }
    public LevelMeta getLevelMeta() { return levelMeta; }
    public RegionIndex getRegions() { return regions; }
    public RegionCache getRegionCache() { return regionCache; }
    public Path getSidecarFile() { return sidecarFile; }

    /** Close every open region file. */
    @Override
    public void close() throws IOException {
        regionCache.close();
    }
}
