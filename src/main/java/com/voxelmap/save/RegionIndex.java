package com.voxelmap.save;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.longs.LongSets;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Maps region coordinates to region container paths.
 *
 * Discovery is split in two: collecting candidate paths (from a region list or
 * a directory walk) and {@link #build(Collection, String) building} the index
 * from those paths. Building never touches the filesystem.
 *
 * Keys are packed (rx, ry) longs. The map is filled once and only read afterwards.
 */
public class RegionIndex {

    private static final Logger LOG = Logger.getLogger(RegionIndex.class.getName());

    /** r.{x}.{y}.{ext} with signed decimal coordinates. */
    private static final Pattern REGION_NAME = Pattern.compile("r\\.(-?\\d+)\\.(-?\\d+)\\.([A-Za-z0-9]+)");

    /**
     * Accepted region coordinate range. Keeps every chunk coordinate, including
     * the one-past-the-end edge of the highest region, within +-2^29 so tile
     * columns and rows (sums and differences of two chunk coordinates) fit in an int.
     */
    public static final int MIN_REGION_COORD = -(1 << 24);
    public static final int MAX_REGION_COORD = (1 << 24) - 1;

    private final Long2ObjectOpenHashMap<RegionFileRecord> records;

    private RegionIndex(Long2ObjectOpenHashMap<RegionFileRecord> records) {
        this.records = records;
    }

    /**
     * Discover the region containers of a world.
     *
     * @param worldDir     world root; containers live under {@code worldDir/region}
     * @param explicitList region list lines, or null to walk the region directory
     * @param extension    accepted container extension, e.g. {@code "mcr"}
     * @param dimensionMarker directory segment to skip during the walk
     */
    public static RegionIndex discover(Path worldDir, List<String> explicitList,
                                       String extension, String dimensionMarker) throws IOException {
        Path regionDir = worldDir.resolve("region");
        List<Path> candidates = explicitList != null
            ? fromRegionList(regionDir, explicitList)
            : scanLeafDirectories(regionDir, dimensionMarker);
        RegionIndex index = build(candidates, extension);
        LOG.info("Discovered " + index.size() + " region files under " + regionDir);
        return index;
    }

    // ---- Candidate enumeration ----

    /**
     * Candidate paths from a region list. Trailing line terminators are stripped
     * and each entry is resolved by file name under the region directory; the
     * files need not exist yet.
     */
    public static List<Path> fromRegionList(Path regionDir, List<String> lines) {
        List<Path> result = new ArrayList<>();
        for (String line : lines) {
            String entry = stripLineTerminators(line);
            if (entry.isBlank()) continue;
            Path name;
            try {
                name = Path.of(entry).getFileName();
            } catch (InvalidPathException e) {
                LOG.warning("Ignoring unusable region list entry: " + e.getMessage());
                continue;
            }
            if (name != null) {
                result.add(regionDir.resolve(name.toString()));
            }
        }
        return result;
    }

    static String stripLineTerminators(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    /** Lists the entries of one directory. */
    @FunctionalInterface
    interface DirectoryListing {
        List<Path> children(Path dir) throws IOException;
    }

    private static List<Path> listChildren(Path dir) throws IOException {
        try (Stream<Path> list = Files.list(dir)) {
            return list.toList();
        }
    }

    /**
     * Walk the region directory and return the files of every leaf directory
     * (one with files and no subdirectories) outside the excluded dimension.
     * A missing region directory yields no candidates. Directories that cannot
     * be read are logged and skipped.
     */
    public static List<Path> scanLeafDirectories(Path regionDir, String dimensionMarker) throws IOException {
        return scanLeafDirectories(regionDir, dimensionMarker, RegionIndex::listChildren);
    }

    static List<Path> scanLeafDirectories(Path regionDir, String dimensionMarker,
                                          DirectoryListing listing) throws IOException {
        if (!Files.isDirectory(regionDir)) {
            LOG.warning("Region directory not found: " + regionDir);
            return Collections.emptyList();
        }

        List<Path> dirs = new ArrayList<>();
        Files.walkFileTree(regionDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                dirs.add(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warning("Skipping unreadable path " + file + ": " + exc);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    LOG.warning("Could not finish walking " + dir + ": " + exc);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        List<Path> result = new ArrayList<>();
        for (Path dir : dirs) {
            List<Path> children;
            try {
                children = listing.children(dir);
            } catch (IOException e) {
                LOG.warning("Skipping unreadable directory " + dir + ": " + e);
                continue;
            }
            boolean hasSubdirectories = children.stream().anyMatch(Files::isDirectory);
            List<Path> files = children.stream().filter(Files::isRegularFile).toList();

            if (isCandidateDirectory(regionDir.relativize(dir), hasSubdirectories, !files.isEmpty(), dimensionMarker)) {
                result.addAll(files);
            } else {
                LOG.fine("Skipping directory " + dir);
            }
        }
        return result;
    }

    /**
     * Whether a directory's files are region candidates.
     *
     * @param relativeDir directory relative to the region root
     */
    static boolean isCandidateDirectory(Path relativeDir, boolean hasSubdirectories, boolean hasFiles,
                                        String dimensionMarker) {
        if (hasSubdirectories || !hasFiles) return false;
        if (dimensionMarker == null || dimensionMarker.isEmpty()) return true;
        for (Path segment : relativeDir) {
            if (segment.toString().contains(dimensionMarker)) return false;
        }
        return true;
    }

    // ---- Index building ----

    /**
     * Build an index from candidate paths. Names that do not match
     * {@code r.<x>.<y>.<extension>} are ignored; for duplicate coordinates the
     * later path wins.
     */
    public static RegionIndex build(Collection<Path> candidates, String extension) {
        Long2ObjectOpenHashMap<RegionFileRecord> records = new Long2ObjectOpenHashMap<>();
        for (Path candidate : candidates) {
            Optional<RegionFileRecord> parsed = parse(candidate, extension);
            if (parsed.isEmpty()) continue;

            RegionFileRecord record = parsed.get();
            RegionFileRecord previous = records.put(regionKey(record.regionX(), record.regionY()), record);
            if (previous != null) {
                LOG.fine("Region " + record.regionX() + "," + record.regionY() + " found twice, using "
                    + record.path() + " over " + previous.path());
            }
        }
        return new RegionIndex(records);
    }

    /** Parse a region record from a path's file name. */
    public static Optional<RegionFileRecord> parse(Path path, String extension) {
        Path name = path.getFileName();
        if (name == null) return Optional.empty();

        Matcher m = REGION_NAME.matcher(name.toString());
        if (!m.matches() || (extension != null && !m.group(3).equals(extension))) {
            return Optional.empty();
        }
        try {
            int rx = Integer.parseInt(m.group(1));
            int ry = Integer.parseInt(m.group(2));
            if (!inRange(rx) || !inRange(ry)) {
                LOG.warning("Ignoring region outside the mappable range: " + name);
                return Optional.empty();
            }
            return Optional.of(new RegionFileRecord(rx, ry, path));
        } catch (NumberFormatException e) {
            LOG.log(Level.FINE, "Region coordinate out of range: " + name, e);
            return Optional.empty();
        }
    }

    private static boolean inRange(int regionCoord) {
        return regionCoord >= MIN_REGION_COORD && regionCoord <= MAX_REGION_COORD;
    }

    // ---- Lookup ----

    /** Path of the region holding chunk (chunkX, chunkY), if that region was discovered. */
    public Optional<Path> getRegionPath(int chunkX, int chunkY) {
        return get(RegionFile.toRegion(chunkX), RegionFile.toRegion(chunkY)).map(RegionFileRecord::path);
    }

    public Optional<RegionFileRecord> get(int regionX, int regionY) {
        return Optional.ofNullable(records.get(regionKey(regionX, regionY)));
    }

    /** Packed region keys, see {@link #regionKey(int, int)}. */
    public LongSet keys() {
        return LongSets.unmodifiable(records.keySet());
    }

    public Collection<RegionFileRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public int size() { return records.size(); }

    public boolean isEmpty() { return records.isEmpty(); }

    public static long regionKey(int rx, int ry) {
        return ((long) rx << 32) | (ry & 0xFFFFFFFFL);
    }

    public static int unpackX(long key) {
        return (int) (key >> 32);
    }

    public static int unpackY(long key) {
        return (int) key;
    }
}
