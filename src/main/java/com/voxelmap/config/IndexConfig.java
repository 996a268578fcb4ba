package com.voxelmap.config;

import java.util.logging.Logger;

/**
 * Settings for building a world index. All fields are public with defaults
 * matching a stock McRegion save; the command line overrides them through
 * {@link #parse(String)}.
 */
public class IndexConfig {

    private static final Logger LOG = Logger.getLogger(IndexConfig.class.getName());

    /** Chunk format version the index understands (McRegion). */
    public static final int MCREGION_VERSION = 19132;

    /** File extension of region containers picked up by discovery. */
    public String regionExtension = "mcr";

    /** Directories whose path contains this segment are skipped (the Nether). */
    public String excludedDimensionMarker = "DIM-1";

    /** Level metadata must declare exactly this version. */
    public int requiredVersion = MCREGION_VERSION;

    /** Side-car file in the world directory holding points of interest. */
    public String sidecarFileName = "voxelmap.dat";

    /** Run the biome preparation collaborator during initialization. */
    public boolean useBiomeData = false;

    /** Locate the true spawn during initialization when a chunk decoder is available. */
    public boolean locateSpawn = true;

    /**
     * Apply a KEY=value override. Unknown keys and malformed values are logged
     * and ignored.
     */
    public void parse(String arg) {
        String[] parts = arg.split("=", 2);
        if (parts.length != 2) {
            LOG.warning("Ignoring config override without '=': " + arg);
            return;
        }

        String key = parts[0].trim();
        String value = parts[1].trim();

        switch (key) {
            case "regionExtension" -> regionExtension = value;
            case "excludedDimensionMarker" -> excludedDimensionMarker = value;
            case "sidecarFileName" -> sidecarFileName = value;
            case "useBiomeData" -> useBiomeData = Boolean.parseBoolean(value);
            case "locateSpawn" -> locateSpawn = Boolean.parseBoolean(value);
            case "requiredVersion" -> {
                try {
                    requiredVersion = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    LOG.warning("Ignoring non-numeric requiredVersion: " + value);
                }
            }
            default -> LOG.warning("Unknown config key: " + key);
        }
    }
}
