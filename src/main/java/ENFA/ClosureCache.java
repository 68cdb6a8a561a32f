package ENFA;

import java.util.HashMap;
import java.util.Map;

import ENFA.Model.StateGraph;
import ENFA.Model.StateSet;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Memoizes epsilon-closures of one graph.
 * Subset construction asks for the closure of the same symbol-closure result many times (every composite
 * state reaching a known successor does), so the answers are kept, keyed by the set they were computed from.
 * Returned sets are read-only and shared between callers.
 */
public final class ClosureCache<I> {
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000L;
    private static final int INITIAL_CAPACITY = 1_000;

    private final StateGraph<I> graph;
    private final Map<StateSet, StateSet> closures; // null when caching is disabled

    /**
     * @param graph - graph whose closures are cached; must not change while the cache is in use
     * @param maximumSize - upper bound on cached entries; 0 disables caching, negative means unbounded
     */
    public ClosureCache(StateGraph<I> graph, long maximumSize) {
        this.graph = graph;
        if (maximumSize == 0) {
            this.closures = null;
        } else if (maximumSize < 0) {
            this.closures = new HashMap<>(INITIAL_CAPACITY);
        } else {
            // Upper bound on cache size, anchor sets can be as large as the NFA
            final Cache<StateSet, StateSet> cache = Caffeine.newBuilder()
                .initialCapacity((int) Math.min(INITIAL_CAPACITY, maximumSize))
                .maximumSize(maximumSize)
                .build();
            this.closures = cache.asMap();
        }
    }

    public StateSet epsilonClosure(StateSet anchors) {
        if (closures == null) {
            return StateSet.readOnly(ClosureOperations.epsilonClosure(graph, anchors));
        }
        final StateSet cached = closures.get(anchors);
        if (cached != null) {
            return cached;
        }
        final StateSet closure = StateSet.readOnly(ClosureOperations.epsilonClosure(graph, anchors));
        closures.put(anchors.copy(), closure); // key copied, callers may keep mutating theirs
        return closure;
    }

    public boolean isEnabled() {
        return closures != null;
    }

    /**
     * Approximate for the bounded cache, since eviction is asynchronous.
     */
    public int size() {
        return closures == null ? 0 : closures.size();
    }
}
