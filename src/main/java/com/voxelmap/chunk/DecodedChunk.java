package com.voxelmap.chunk;

/**
 * A chunk after the external tag-tree decode, reduced to what indexing reads.
 */
public interface DecodedChunk {

    /**
     * Dense block ids for the 16x16x128 column, one byte each, laid out with
     * height varying fastest: index {@code (x * 16 + z) * 128 + y}.
     */
    byte[] getBlocks();
}
