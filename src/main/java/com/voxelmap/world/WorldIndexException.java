package com.voxelmap.world;

/**
 * A world that cannot be indexed. Raised during {@link WorldIndex#open} and left
 * for the caller to decide whether the process should stop.
 */
public class WorldIndexException extends Exception {

    public enum Reason {
        /** level metadata declares a chunk format other than McRegion */
        UNSUPPORTED_VERSION,
        /** discovery found zero region containers */
        NO_REGIONS,
        /** the spawn chunk lies outside every discovered region */
        SPAWN_REGION_MISSING,
        /** the spawn region exists but its spawn chunk slot is empty */
        SPAWN_CHUNK_MISSING
    }

    private final Reason reason;

    public WorldIndexException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
