package com.voxelmap.save;

import com.voxelmap.world.ChunkPos;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RegionFileTest {

    @TempDir
    Path dir;

    private static byte[] payload(int cx, int cy) {
        return ("chunk " + cx + "," + cy).repeat(50).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] read(Optional<InputStream> stream) throws IOException {
        try (InputStream in = stream.orElseThrow()) {
            return in.readAllBytes();
        }
    }

    @Test
    void readsPopulatedSlotsAndReportsEmptyOnes() throws IOException {
        Path file = dir.resolve("r.0.0.mcr");
        Map<ChunkPos, byte[]> chunks = new LinkedHashMap<>();
        chunks.put(new ChunkPos(0, 0), payload(0, 0));
        chunks.put(new ChunkPos(31, 2), payload(31, 2));
        RegionFixtures.writeRegion(file, chunks);

        try (RegionFile region = RegionFile.open(file)) {
            assertTrue(region.isHeaderLoaded());
            assertEquals(2, region.countChunks());
            assertTrue(region.hasChunk(31, 2));
            assertFalse(region.hasChunk(1, 1));

            assertArrayEquals(payload(0, 0), read(region.loadChunk(0, 0)));
            assertArrayEquals(payload(31, 2), read(region.loadChunk(31, 2)));
            assertTrue(region.loadChunk(1, 1).isEmpty());
        }
    }

    @Test
    void slotsWrapForNegativeRegions() throws IOException {
        Path file = dir.resolve("r.-1.-1.mcr");
        RegionFixtures.writeRegion(file, Map.of(new ChunkPos(-1, -32), payload(-1, -32)));

        try (RegionFile region = RegionFile.open(file)) {
            assertArrayEquals(payload(-1, -32), read(region.loadChunk(-1, -32)));
            assertEquals(RegionFixtures.timestampFor(new ChunkPos(-1, -32)), region.getTimestamp(-1, -32));
            assertEquals(0, region.getTimestamp(-2, -32));
        }
    }

    @Test
    void readsGzipChunks() throws IOException {
        Path file = dir.resolve("r.0.0.mcr");
        RegionFixtures.writeRegion(file, Map.of(new ChunkPos(5, 6), payload(5, 6)), RegionFile.COMPRESSION_GZIP);

        try (RegionFile region = RegionFile.open(file)) {
            assertArrayEquals(payload(5, 6), read(region.loadChunk(5, 6)));
        }
    }

    @Test
    void truncatedHeaderFailsToOpen() throws IOException {
        Path file = dir.resolve("r.0.0.mcr");
        Files.write(file, new byte[100]);

        assertThrows(EOFException.class, () -> RegionFile.open(file));
    }

    @Test
    void unknownCompressionIsAnError() throws IOException {
        Path file = dir.resolve("r.0.0.mcr");
        RegionFixtures.writeRegion(file, Map.of(new ChunkPos(0, 0), payload(0, 0)));
        // compression byte follows the 4-byte length at the start of sector 2
        try (var channel = java.nio.channels.FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.write(ByteBuffer.wrap(new byte[] {9}), RegionFile.HEADER_BYTES + 4);
        }

        try (RegionFile region = RegionFile.open(file)) {
            assertThrows(IOException.class, () -> region.loadChunk(0, 0));
        }
    }

    @Test
    void slotPastEndOfFileIsAnError() throws IOException {
        Path file = dir.resolve("r.0.0.mcr");
        ByteBuffer header = ByteBuffer.allocate(RegionFile.HEADER_BYTES);
        header.putInt(0, (10 << 8) | 1);
        Files.write(file, header.array());

        try (RegionFile region = RegionFile.open(file)) {
            assertTrue(region.hasChunk(0, 0));
            assertThrows(EOFException.class, () -> region.loadChunk(0, 0));
        }
    }

    @Test
    void concurrentReadsSeeTheirOwnChunks() throws Exception {
        Path file = dir.resolve("r.0.0.mcr");
        Map<ChunkPos, byte[]> chunks = new LinkedHashMap<>();
        for (int x = 0; x < 8; x++) {
            for (int y = 0; y < 8; y++) {
                chunks.put(new ChunkPos(x, y), payload(x, y));
            }
        }
        RegionFixtures.writeRegion(file, chunks);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try (RegionFile region = RegionFile.open(file)) {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int round = 0; round < 20; round++) {
                for (ChunkPos pos : chunks.keySet()) {
                    results.add(pool.submit(() ->
                        java.util.Arrays.equals(payload(pos.x(), pos.y()), read(region.loadChunk(pos.x(), pos.y())))));
                }
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
