package com.voxelmap.save;

import com.voxelmap.world.ChunkPos;
import com.voxelmap.world.WorldConstants;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Writes small McRegion files and chunk payloads for tests.
 */
public final class RegionFixtures {

    private RegionFixtures() {}

    /** Write a region file holding the given decompressed payloads, zlib-compressed. */
    public static void writeRegion(Path file, Map<ChunkPos, byte[]> chunks) throws IOException {
        writeRegion(file, chunks, RegionFile.COMPRESSION_ZLIB);
    }

    public static void writeRegion(Path file, Map<ChunkPos, byte[]> chunks, byte compression) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(RegionFile.HEADER_BYTES);
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        int nextSector = RegionFile.HEADER_BYTES / RegionFile.SECTOR_BYTES;

        for (Map.Entry<ChunkPos, byte[]> entry : chunks.entrySet()) {
            ChunkPos pos = entry.getKey();
            byte[] compressed = compress(entry.getValue(), compression);

            ByteBuffer record = ByteBuffer.allocate(5 + compressed.length);
            record.putInt(compressed.length + 1);
            record.put(compression);
            record.put(compressed);

            int sectors = (record.capacity() + RegionFile.SECTOR_BYTES - 1) / RegionFile.SECTOR_BYTES;
            byte[] padded = Arrays.copyOf(record.array(), sectors * RegionFile.SECTOR_BYTES);

            int slot = slot(pos);
            header.putInt(slot * 4, (nextSector << 8) | sectors);
            header.putInt(RegionFile.SECTOR_BYTES + slot * 4, timestampFor(pos));
            body.write(padded);
            nextSector += sectors;
        }

        Files.createDirectories(file.toAbsolutePath().getParent());
        try (OutputStream os = Files.newOutputStream(file)) {
            os.write(header.array());
            body.writeTo(os);
        }
    }

    /** Timestamp the fixture writes for a chunk. */
    public static int timestampFor(ChunkPos pos) {
        return 1_300_000_000 + slot(pos);
    }

    private static int slot(ChunkPos pos) {
        return Math.floorMod(pos.x(), WorldConstants.REGION_SIZE)
            + Math.floorMod(pos.y(), WorldConstants.REGION_SIZE) * WorldConstants.REGION_SIZE;
    }

    private static byte[] compress(byte[] data, byte compression) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (OutputStream os = compression == RegionFile.COMPRESSION_GZIP
                ? new GZIPOutputStream(out) : new DeflaterOutputStream(out)) {
            os.write(data);
        }
        return out.toByteArray();
    }

    /** A chunk's block array with every column solid from 0 up to (but excluding) {@code surface}. */
    public static byte[] solidBelow(int surface) {
        byte[] blocks = new byte[WorldConstants.CHUNK_VOLUME];
        for (int x = 0; x < WorldConstants.CHUNK_SIZE; x++) {
            for (int z = 0; z < WorldConstants.CHUNK_SIZE; z++) {
                for (int y = 0; y < Math.min(surface, WorldConstants.WORLD_HEIGHT); y++) {
                    blocks[blockIndex(x, z, y)] = 1;
                }
            }
        }
        return blocks;
    }

    public static int blockIndex(int x, int z, int y) {
        return (x * WorldConstants.CHUNK_SIZE + z) * WorldConstants.WORLD_HEIGHT + y;
    }
}
