package com.voxelmap.save;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Keeps one open {@link RegionFile} per container path for the lifetime of the
 * owning index. Headers are parsed once, on first access.
 *
 * There is no eviction: every region that was ever requested stays open until
 * {@link #close()}. Large worlds therefore hold one file handle per region.
 */
public class RegionCache implements Closeable {

    private static final Logger LOG = Logger.getLogger(RegionCache.class.getName());

    /** Opens a container and parses its header. */
    @FunctionalInterface
    public interface Opener {
        RegionFile open(Path path) throws IOException;
    }

    private final Map<Path, RegionFile> readers = new ConcurrentHashMap<>();
    private final Opener opener;

    public RegionCache() {
        this(RegionFile::open);
    }

    public RegionCache(Opener opener) {
        this.opener = opener;
    }

    /**
     * Cached reader for {@code path}, opening it on first use. Concurrent first
     * calls for the same path open it once.
     */
    public RegionFile get(Path path) throws IOException {
        RegionFile cached = readers.get(path);
        if (cached != null) return cached;

        try {
            return readers.computeIfAbsent(path, p -> {
                try {
                    RegionFile region = opener.open(p);
                    LOG.fine("Opened region " + p);
                    return region;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Raw chunk payload from the cached reader, empty if the slot is not populated.
     * Decoding the bytes is up to the caller.
     */
    public Optional<InputStream> loadChunk(Path path, int chunkX, int chunkY) throws IOException {
        return get(path).loadChunk(chunkX, chunkY);
    }

    public boolean isOpen(Path path) {
        return readers.containsKey(path);
    }

    public int size() {
        return readers.size();
    }

    /** Close every reader. The first failure is rethrown after all have been attempted. */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (RegionFile region : readers.values()) {
            try {
                region.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        readers.clear();
        if (failure != null) throw failure;
    }
}
