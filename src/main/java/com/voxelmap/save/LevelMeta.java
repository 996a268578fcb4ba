package com.voxelmap.save;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * World-level metadata needed for indexing: chunk format version, spawn point
 * and display name.
 *
 * {@link #load(Path)} reads {@code level.properties}, a key=value export of
 * level.dat using the same key names (version, SpawnX, SpawnY, SpawnZ, LevelName).
 */
public class LevelMeta {

    public static final String FILE_NAME = "level.properties";

    private final int version;
    private final int spawnX, spawnY, spawnZ;
    private final String levelName;

    public LevelMeta(int version, int spawnX, int spawnY, int spawnZ, String levelName) {
        this.version = version;
        this.spawnX = spawnX;
        this.spawnY = spawnY;
        this.spawnZ = spawnZ;
        this.levelName = levelName != null ? levelName : "World";
    }

    public int getVersion() { return version; }
    public int getSpawnX() { return spawnX; }
    public int getSpawnY() { return spawnY; }
    public int getSpawnZ() { return spawnZ; }
    public String getLevelName() { return levelName; }

    // --- Serialization ---

    /**
     * Load metadata from the level.properties file in the given world directory.
     * @throws NoSuchFileException if the file doesn't exist
     */
    public static LevelMeta load(Path worldDir) throws IOException {
        Path file = worldDir.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "level metadata not found");
        }

        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        }

        try {
            return new LevelMeta(
                Integer.parseInt(props.getProperty("version", "0").trim()),
                Integer.parseInt(props.getProperty("SpawnX", "0").trim()),
                Integer.parseInt(props.getProperty("SpawnY", "64").trim()),
                Integer.parseInt(props.getProperty("SpawnZ", "0").trim()),
                props.getProperty("LevelName", "World"));
        } catch (NumberFormatException e) {
            throw new IOException("Malformed level metadata in " + file, e);
        }
    }

    /** Write this metadata as level.properties in the given directory. */
    public void save(Path worldDir) throws IOException {
        Files.createDirectories(worldDir);

        Properties props = new Properties();
        props.setProperty("version", Integer.toString(version));
        props.setProperty("SpawnX", Integer.toString(spawnX));
        props.setProperty("SpawnY", Integer.toString(spawnY));
        props.setProperty("SpawnZ", Integer.toString(spawnZ));
        props.setProperty("LevelName", levelName);

        try (OutputStream os = Files.newOutputStream(worldDir.resolve(FILE_NAME))) {
            props.store(os, "Level metadata");
        }
    }

    @Override
    public String toString() {
        return "LevelMeta[" + levelName + ", version=" + version
            + ", spawn=" + spawnX + "," + spawnY + "," + spawnZ + "]";
    }
}
