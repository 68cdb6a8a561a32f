package ENFA;

import ENFA.Model.StateGraph;
import ENFA.Model.StateSet;
import ENFA.Model.UnknownSymbolException;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * Closure queries over a {@link StateGraph}. None of these modify the graph or their arguments.
 */
public final class ClosureOperations {
    private ClosureOperations() {
    }

    /**
     * Union of the direct successors of every anchor under {@code symbol}.
     * @param graph - graph to query
     * @param anchors - states to start from
     * @param symbol - any symbol of the graph's alphabet, epsilon included
     * @return new set, empty if no edge carries {@code symbol}
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> StateSet symbolClosure(StateGraph<I> graph, StateSet anchors, I symbol) {
        checkUniverse(graph, anchors);
        final StateSet result = new StateSet(graph.size());
        if (symbol == null || !graph.getInputAlphabet().containsSymbol(symbol)) {
            throw new UnknownSymbolException(symbol);
        }
        for (int s = anchors.nextState(0); s >= 0; s = anchors.nextState(s + 1)) {
            for (IntIterator it = graph.successorIds(s, symbol).iterator(); it.hasNext(); ) {
                result.add(it.nextInt());
            }
        }
        return result;
    }

    /**
     * Smallest superset of {@code anchors} closed under epsilon edges.
     * Uses a FIFO worklist: each state is enqueued at most once, so the cost is bounded by the number of
     * epsilon edges and the call depth stays constant.
     * A graph without epsilon symbol yields a copy of {@code anchors}.
     */
    public static <I> StateSet epsilonClosure(StateGraph<I> graph, StateSet anchors) {
        checkUniverse(graph, anchors);
        final StateSet result = anchors.copy();
        if (!graph.hasEpsilon()) {
            return result;
        }
        final I epsilon = graph.getEpsilon();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int s = anchors.nextState(0); s >= 0; s = anchors.nextState(s + 1)) {
            queue.enqueue(s);
        }
        while (!queue.isEmpty()) {
            for (IntIterator it = graph.successorIds(queue.dequeueInt(), epsilon).iterator(); it.hasNext(); ) {
                final int t = it.nextInt();
                if (result.add(t)) {
                    queue.enqueue(t);
                }
            }
        }
        return result;
    }

    public static <I> StateSet epsilonClosure(StateGraph<I> graph, int state) {
        return epsilonClosure(graph, StateSet.of(graph.size(), state));
    }

    /**
     * Run {@code graph} on {@code word}, following epsilon edges before and after every symbol.
     * @param word - visible symbols only
     * @return true if some state reached after the whole word is final
     */
    public static <I> boolean accepts(StateGraph<I> graph, Iterable<? extends I> word) {
        StateSet current = epsilonClosure(graph, graph.getStart());
        for (I sym : word) {
            if (graph.isEpsilon(sym)) {
                throw new IllegalArgumentException("Epsilon is not a word symbol");
            }
            current = epsilonClosure(graph, symbolClosure(graph, current, sym));
            if (current.isEmpty()) {
                return false;
            }
        }
        return current.intersects(graph.getFinalStates());
    }

    private static void checkUniverse(StateGraph<?> graph, StateSet anchors) {
        if (anchors.universe() != graph.size()) {
            throw new IllegalArgumentException(
                "Anchor set over " + anchors.universe() + " states, graph has " + graph.size());
        }
    }
}
