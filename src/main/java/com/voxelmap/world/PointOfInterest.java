package com.voxelmap.world;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A labeled world location shown as a map marker (spawn, signs, etc).
 * Stored in the side-car file across runs.
 *
 * @param x       block X
 * @param y       block Y (height)
 * @param z       block Z
 * @param message display text
 * @param kind    marker kind, e.g. {@code "spawn"}
 * @param extra   free-form attributes; never null
 */
public record PointOfInterest(int x, int y, int z, String message, String kind, Map<String, Object> extra) {

    public PointOfInterest {
        Objects.requireNonNull(kind, "kind");
        message = message != null ? message : "";
        extra = extra != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extra)) : Map.of();
    }

    public PointOfInterest(int x, int y, int z, String message, String kind) {
        this(x, y, z, message, kind, Map.of());
    }
}
