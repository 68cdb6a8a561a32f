package ENFA.Registry;

import ENFA.Model.StateSet;

/**
 * Index of discovered composite states, keyed by their anchor sets.
 * Two anchor sets are the same key iff they hold the same states.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the composite index registered for an anchor set.
     * @param anchors anchor set
     * @return composite index or MISSING_ELEMENT if the set was never registered.
     */
    int get(StateSet anchors);

    /**
     * Register a new anchor set. Re-registering a known set is an error, the first index always wins.
     * @param anchors anchor set, must not be modified afterwards
     * @param compositeIndex index in the composite list
     */
    void put(StateSet anchors, int compositeIndex);

    /**
     * @return number of registered anchor sets
     */
    int size();
}
