package com.voxelmap.save;

import com.voxelmap.world.WorldConstants;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Read-only view of one McRegion container (r.{rx}.{ry}.mcr).
 *
 * Layout:
 *   [0, 4096)     1024 location entries: 3-byte sector offset, 1-byte sector count
 *   [4096, 8192)  1024 last-modified timestamps (seconds)
 *   sectors       per chunk: int length, byte compression, compressed payload
 *
 * The header is parsed once by {@link #loadHeader()}. Chunk reads use positioned
 * reads on a shared channel, so any number of threads may call
 * {@link #loadChunk(int, int)} on the same instance.
 */
public class RegionFile implements Closeable {

    public static final int SECTOR_BYTES = 4096;
    public static final int HEADER_BYTES = SECTOR_BYTES * 2;

    public static final byte COMPRESSION_GZIP = 1;
    public static final byte COMPRESSION_ZLIB = 2;

    private final Path path;
    private final FileChannel channel;

    private final int[] locations = new int[WorldConstants.CHUNKS_PER_REGION];
    private final int[] timestamps = new int[WorldConstants.CHUNKS_PER_REGION];
    private volatile boolean headerLoaded = false;

    public RegionFile(Path path) throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    /** Open the container and parse its header. */
    public static RegionFile open(Path path) throws IOException {
        RegionFile region = new RegionFile(path);
        try {
            region.loadHeader();
        } catch (IOException e) {
            region.close();
            throw e;
        }
        return region;
    }

    /** Region coordinate for a chunk coordinate (floors for negatives). */
    public static int toRegion(int chunkCoord) {
        return Math.floorDiv(chunkCoord, WorldConstants.REGION_SIZE);
    }

    private static int slot(int chunkX, int chunkY) {
        return (chunkX & (WorldConstants.REGION_SIZE - 1))
            + (chunkY & (WorldConstants.REGION_SIZE - 1)) * WorldConstants.REGION_SIZE;
    }

    public Path getPath() { return path; }

    public boolean isHeaderLoaded() { return headerLoaded; }

    /**
     * Read the location and timestamp tables.
     * @throws EOFException if the file is shorter than the header
     */
    public void loadHeader() throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES);
        readFully(buf, 0);
        buf.flip();
        IntBuffer ints = buf.asIntBuffer();
        ints.get(locations);
        ints.get(timestamps);
        headerLoaded = true;
    }

    /** True if the header has a populated slot for this chunk. */
    public boolean hasChunk(int chunkX, int chunkY) {
        return locations[slot(chunkX, chunkY)] != 0;
    }

    /** Last-modified time of the chunk in epoch seconds, 0 if never written. */
    public int getTimestamp(int chunkX, int chunkY) {
        return timestamps[slot(chunkX, chunkY)];
    }

    /** Number of populated chunk slots. */
    public int countChunks() {
        int n = 0;
        for (int location : locations) {
            if (location != 0) n++;
        }
        return n;
    }

    /**
     * Open a decompressing stream over a chunk's payload.
     * Returns empty if the slot is not populated.
     *
     * @throws IOException if the slot points outside the file or uses an unknown compression
     */
    public Optional<InputStream> loadChunk(int chunkX, int chunkY) throws IOException {
        int location = locations[slot(chunkX, chunkY)];
        if (location == 0) return Optional.empty();

        int sectorOffset = location >>> 8;
        int sectorCount = location & 0xFF;
        if (sectorOffset < HEADER_BYTES / SECTOR_BYTES) {
            throw new IOException("Chunk " + chunkX + "," + chunkY + " in " + path
                + " points into the header (sector " + sectorOffset + ")");
        }
        long start = (long) sectorOffset * SECTOR_BYTES;

        ByteBuffer head = ByteBuffer.allocate(5);
        readFully(head, start);
        head.flip();
        int length = head.getInt();
        byte compression = head.get();

        // length counts the compression byte but not itself
        if (length <= 1 || (long) length + 4 > (long) sectorCount * SECTOR_BYTES) {
            throw new IOException("Bad chunk length " + length + " for " + chunkX + "," + chunkY
                + " in " + path);
        }

        byte[] payload = new byte[length - 1];
        readFully(ByteBuffer.wrap(payload), start + 5);
        InputStream raw = new ByteArrayInputStream(payload);

        return switch (compression) {
            case COMPRESSION_GZIP -> Optional.of(new GZIPInputStream(raw));
            case COMPRESSION_ZLIB -> Optional.of(new InflaterInputStream(raw));
            default -> throw new IOException("Unknown compression type " + compression
                + " for chunk " + chunkX + "," + chunkY + " in " + path);
        };
    }

    private void readFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) {
                throw new EOFException("Unexpected end of " + path + " at byte " + pos);
            }
            pos += n;
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "RegionFile[" + path + "]";
    }
}
