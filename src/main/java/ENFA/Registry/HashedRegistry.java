package ENFA.Registry;

import ENFA.Model.StateSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Registry keyed by the hash of the anchor set's bit vector.
 */
public class HashedRegistry implements Registry {
    private final Object2IntMap<StateSet> anchors2Index;

    public HashedRegistry() {
        this.anchors2Index = new Object2IntOpenHashMap<>();
        this.anchors2Index.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(StateSet anchors) {
        return anchors2Index.getInt(anchors);
    }

    @Override
    public void put(StateSet anchors, int compositeIndex) {
        if (anchors2Index.containsKey(anchors)) {
            throw new IllegalStateException("Anchor set already registered: " + anchors);
        }
        anchors2Index.put(StateSet.readOnly(anchors), compositeIndex);
    }

    @Override
    public int size() {
        return anchors2Index.size();
    }

    @Override
    public String toString() {
        return "hashed";
    }
}
