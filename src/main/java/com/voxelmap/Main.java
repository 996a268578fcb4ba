package com.voxelmap;

import com.voxelmap.config.IndexConfig;
import com.voxelmap.world.PointOfInterest;
import com.voxelmap.world.WorldIndex;
import com.voxelmap.world.WorldIndexException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: indexes a world and reports what was found.
 * <p>
 * Usage:
 *   java -jar voxelmap.jar &lt;worldDir&gt;                       # walk worldDir/region
 *   java -jar voxelmap.jar &lt;worldDir&gt; --regionlist list.txt  # only the listed regions
 *   java -jar voxelmap.jar &lt;worldDir&gt; --set useBiomeData=true
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the tool and returns the process exit status. */
    static int run(String[] args) {
        IndexConfig config = new IndexConfig();
        Path worldDir = null;
        Path regionListFile = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--regionlist" -> {
                    if (i + 1 >= args.length) {
                        return usage("Missing value for --regionlist");
                    }
                    regionListFile = Path.of(args[++i]);
                }
                case "--set" -> {
                    if (i + 1 >= args.length) {
                        return usage("Missing value for --set");
                    }
                    config.parse(args[++i]);
                }
                default -> {
                    if (worldDir == null && !args[i].startsWith("--")) {
                        worldDir = Path.of(args[i]);
                    } else {
                        LOG.warning("Ignoring argument: " + args[i]);
                    }
                }
            }
        }

        if (worldDir == null) {
            return usage(null);
        }

        try {
            List<String> regionList = regionListFile != null ? Files.readAllLines(regionListFile) : null;
            try (WorldIndex index = WorldIndex.open(worldDir, regionList, config, WorldIndex.Collaborators.defaults())) {
                System.out.println("World: " + index.getLevelMeta().getLevelName());
                System.out.println("Regions: " + index.getRegions().size());
                System.out.println("Tiles: cols " + index.getMinCol() + ".." + index.getMaxCol()
                    + ", rows " + index.getMinRow() + ".." + index.getMaxRow());
                for (PointOfInterest poi : index.getPointsOfInterest()) {
                    System.out.println("POI " + poi.kind() + " at " + poi.x() + "," + poi.y() + "," + poi.z()
                        + ": " + poi.message());
                }
            }
            return 0;
        } catch (WorldIndexException e) {
            LOG.severe(e.getReason() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to index " + worldDir, e);
            return 1;
        }
    }

    private static int usage(String error) {
        if (error != null) {
            System.err.println(error);
        }
        System.err.println("Usage: voxelmap <worldDir> [--regionlist <file>] [--set KEY=value]...");
        return 2;
    }
}
