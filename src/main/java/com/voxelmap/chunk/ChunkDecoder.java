package com.voxelmap.chunk;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes a chunk's decompressed payload (as returned by a region reader).
 * Corrupt data is reported as an {@link IOException}.
 */
@FunctionalInterface
public interface ChunkDecoder {
    DecodedChunk decode(InputStream payload) throws IOException;
}
