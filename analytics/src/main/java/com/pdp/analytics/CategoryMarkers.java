package com.pdp.analytics;

import java.util.List;
import java.util.Objects;

/**
 * A named site category defined by substring markers. A site belongs to the
 * category when it contains at least one marker; categories may overlap.
 */
public final class CategoryMarkers {
    private final String name;
    private final List<String> markers;

    public CategoryMarkers(String name, List<String> markers) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(markers, "markers cannot be null");
        for (String m : markers) {
            if (m == null || m.isEmpty()) {
                throw new IllegalArgumentException("Empty marker in category " + name);
            }
        }
        this.markers = List.copyOf(markers);
    }

    public static CategoryMarkers of(String name, String... markers) {
        return new CategoryMarkers(name, List.of(markers));
    }

    public String getName() {
        return name;
    }

    public List<String> getMarkers() {
        return markers;
    }

    public boolean matches(String site) {
        if (site == null) return false;
        for (String m : markers) {
            if (site.contains(m)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "CategoryMarkers{" + name + ", " + markers.size() + " markers}";
    }
}
