package com.voxelmap.save;

import java.nio.file.Path;

/** A discovered region container and the region coordinate parsed from its name. */
public record RegionFileRecord(int regionX, int regionY, Path path) {}
