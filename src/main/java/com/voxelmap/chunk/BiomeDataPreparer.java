package com.voxelmap.chunk;

import java.io.IOException;
import java.nio.file.Path;

/** Prepares biome color data for a world before rendering starts. */
@FunctionalInterface
public interface BiomeDataPreparer {
    void prepare(Path worldDir) throws IOException;
}
