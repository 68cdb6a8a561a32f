package ENFA.Registry;

import java.util.Arrays;

import ENFA.Model.StateSet;
import it.unimi.dsi.fastutil.objects.Object2IntRBTreeMap;
import it.unimi.dsi.fastutil.objects.Object2IntSortedMap;

/**
 * Registry keyed by the ascending sequence of state ids in the anchor set, ordered lexicographically.
 * Lookups are logarithmic and independent of hash quality.
 */
public class SortedRegistry implements Registry {
    private final Object2IntSortedMap<int[]> ids2Index;

    public SortedRegistry() {
        this.ids2Index = new Object2IntRBTreeMap<int[]>(Arrays::compare);
        this.ids2Index.defaultReturnValue(MISSING_ELEMENT);
    }

    @Override
    public int get(StateSet anchors) {
        return ids2Index.getInt(anchors.toArray());
    }

    @Override
    public void put(StateSet anchors, int compositeIndex) {
        final int[] key = anchors.toArray(); // already sorted
        if (ids2Index.containsKey(key)) {
            throw new IllegalStateException("Anchor set already registered: " + anchors);
        }
        ids2Index.put(key, compositeIndex);
    }

    @Override
    public int size() {
        return ids2Index.size();
    }

    @Override
    public String toString() {
        return "sorted";
    }
}
