package de.bsommerfeld.landcover.core.domain;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of land-cover classes. The position of an entry is its class ID:
 * it fixes the order of probability bands during arg-max aggregation and the
 * axes of confusion matrices.
 */
public final class Legend {

    private static final Legend DYNAMIC_WORLD = new Legend(List.of(
            new LegendEntry("water", "water", "#419BDF"),
            new LegendEntry("trees", "trees", "#397D49"),
            new LegendEntry("grass", "grass", "#88B053"),
            new LegendEntry("flooded", "flooded_vegetation", "#7A87C6"),
            new LegendEntry("crops", "crops", "#E49635"),
            new LegendEntry("shrubs", "shrub_and_scrub", "#DFC35A"),
            new LegendEntry("built", "built", "#C4281B"),
            new LegendEntry("bare", "bare", "#A59B8F"),
            new LegendEntry("snow", "snow_and_ice", "#B39FE1")));

    private final ImmutableList<LegendEntry> entries;

    /**
     * @throws IllegalArgumentException if the list is empty or names repeat
     */
    public Legend(List<LegendEntry> entries) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Legend needs at least one class");
        }
        Set<String> seen = new HashSet<>();
        for (LegendEntry entry : entries) {
            if (!seen.add(entry.name())) {
                throw new IllegalArgumentException("Duplicate legend class '" + entry.name() + "'");
            }
        }
        this.entries = ImmutableList.copyOf(entries);
    }

    /** The nine-class Dynamic World legend. */
    public static Legend dynamicWorld() {
        return DYNAMIC_WORLD;
    }

    public int size() {
        return entries.size();
    }

    public ImmutableList<LegendEntry> entries() {
        return entries;
    }

    public LegendEntry entry(int classId) {
        return entries.get(classId);
    }

    public List<String> names() {
        return entries.stream().map(LegendEntry::name).collect(ImmutableList.toImmutableList());
    }

    public List<String> probabilityBands() {
        return entries.stream().map(LegendEntry::probabilityBand).collect(ImmutableList.toImmutableList());
    }

    /** Class ID of {@code name}, or -1. */
    public int indexOf(String name) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Legend other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Legend" + names();
    }
}
