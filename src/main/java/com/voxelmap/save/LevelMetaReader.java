package com.voxelmap.save;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a world's level metadata. Implementations backed by the binary level.dat
 * decoder plug in here; {@link LevelMeta#load(Path)} reads the properties export.
 */
@FunctionalInterface
public interface LevelMetaReader {
    LevelMeta read(Path worldDir) throws IOException;
}
