package com.voxelmap.save;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;

/**
 * Loads and saves the {@link PersistentState} side-car file as JSON.
 *
 * Whole numbers in free-form maps come back as {@code Long}, fractions as
 * {@code Double}.
 */
public class PersistentMetadataStore {

    private static final Logger LOG = Logger.getLogger(PersistentMetadataStore.class.getName());

    private final Gson gson;

    public PersistentMetadataStore() {
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();
    }

    /**
     * Load the state from {@code file}. A missing or empty file yields an empty state.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public PersistentState load(Path file) throws IOException {
        if (!Files.exists(file)) {
            LOG.fine("No side-car file at " + file + ", starting empty");
            return new PersistentState();
        }

        String json = Files.readString(file);
        PersistentState state;
        try {
            state = gson.fromJson(json, PersistentState.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed side-car file " + file, e);
        } catch (RuntimeException e) {
            // entries the model rejects, e.g. a point of interest without a kind
            throw new IOException("Invalid side-car entry in " + file, e);
        }
        if (state == null) {
            return new PersistentState();
        }
        state.fillDefaults();
        LOG.fine("Loaded " + state + " from " + file);
        return state;
    }

    /**
     * Overwrite {@code file} with the given state. Written to a temporary sibling
     * first and moved into place.
     */
    public void save(Path file, PersistentState state) throws IOException {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        String json;
        synchronized (state) {
            json = gson.toJson(state);
        }

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");

        Files.writeString(tempFile, json, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
