package com.voxelmap.save;

import com.voxelmap.world.PointOfInterest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Data kept between runs in the side-car file: the point-of-interest list in
 * display order, plus free-form extension values.
 *
 * All accessors synchronize on this instance, so rendering threads may add
 * markers concurrently. Nothing is written to disk until
 * {@link PersistentMetadataStore#save} is called.
 */
public class PersistentState {

    private List<PointOfInterest> pointsOfInterest = new ArrayList<>();
    private Map<String, Object> extensions = new LinkedHashMap<>();

    public PersistentState() {}

    public PersistentState(List<PointOfInterest> pointsOfInterest, Map<String, Object> extensions) {
        this.pointsOfInterest = new ArrayList<>(pointsOfInterest);
        this.extensions = new LinkedHashMap<>(extensions);
    }

    public synchronized void addPointOfInterest(PointOfInterest poi) {
        pointsOfInterest.add(Objects.requireNonNull(poi, "poi"));
    }

    /** Snapshot of the POI list in insertion order. */
    public synchronized List<PointOfInterest> getPointsOfInterest() {
        return List.copyOf(pointsOfInterest);
    }

    /**
     * Drop every POI of {@code poi}'s kind and append {@code poi}. Used for
     * markers that exist once per world, such as spawn.
     */
    public synchronized void replacePointsOfInterest(PointOfInterest poi) {
        Objects.requireNonNull(poi, "poi");
        pointsOfInterest.removeIf(existing -> existing.kind().equals(poi.kind()));
        pointsOfInterest.add(poi);
    }

    public synchronized void putExtension(String key, Object value) {
        extensions.put(key, value);
    }

    /** Snapshot of the extension values. */
    public synchronized Map<String, Object> getExtensions() {
        return new LinkedHashMap<>(extensions);
    }

    /** Replace fields a partial document left null. */
    synchronized void fillDefaults() {
        if (pointsOfInterest == null) pointsOfInterest = new ArrayList<>();
        else pointsOfInterest.removeIf(Objects::isNull);
        if (extensions == null) extensions = new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentState other)) return false;
        return getPointsOfInterest().equals(other.getPointsOfInterest())
            && getExtensions().equals(other.getExtensions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPointsOfInterest(), getExtensions());
    }

    @Override
    public synchronized String toString() {
        return "PersistentState[" + pointsOfInterest.size() + " POIs, extensions=" + extensions.keySet() + "]";
    }
}
