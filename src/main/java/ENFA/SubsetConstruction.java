package ENFA;

import java.util.Collections;
import java.util.List;

import ENFA.Model.CompositeState;
import ENFA.Model.StateGraph;
import ENFA.Model.StateSet;
import ENFA.Registry.HashedRegistry;
import ENFA.Registry.Registry;
import ENFA.Trace.ConversionListener;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import net.automatalib.alphabet.Alphabet;

/**
 * Subset construction of a DFA from an NFA with epsilon transitions.
 * <p>
 * Composite states are numbered in discovery order and processed first-in first-out, symbols in alphabet
 * order, so converting the same NFA always gives the same numbering. Only configurations reachable from the
 * start state are explored. The resulting DFA is partial: a symbol that leads nowhere gets no transition.
 * <p>
 * One instance converts one NFA; it is not thread-safe.
 *
 * @param <I> - Input symbol type, e.g., Character
 */
public class SubsetConstruction<I> {
    public enum Phase { UNSTARTED, DISCOVERING, DONE }

    private final StateGraph<I> nfa;
    private final Alphabet<I> inputs; // visible symbols
    private final ConversionListener<? super I> listener;
    private final Registry registry;
    private final ClosureCache<I> closures;

    private final List<CompositeState> composites = new ObjectArrayList<>();
    private Phase phase = Phase.UNSTARTED;

    public SubsetConstruction(StateGraph<I> nfa) {
        this(nfa, ConversionListener.noop());
    }

    public SubsetConstruction(StateGraph<I> nfa, ConversionListener<? super I> listener) {
        this(nfa, listener, new HashedRegistry(), ClosureCache.DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * @param nfa - NFA to convert, must carry an epsilon symbol
     * @param listener - trace hook
     * @param registry - empty registry used to recognize known anchor sets
     * @param closureCacheSize - bound of the epsilon-closure cache, see {@link ClosureCache}
     */
    public SubsetConstruction(StateGraph<I> nfa, ConversionListener<? super I> listener, Registry registry,
                              long closureCacheSize) {
        if (!nfa.hasEpsilon()) {
            throw new IllegalArgumentException("Conversion input must have an epsilon symbol in its alphabet");
        }
        if (registry.size() != 0) {
            throw new IllegalArgumentException("Registry must be empty");
        }
        this.nfa = nfa;
        this.inputs = nfa.getVisibleAlphabet();
        this.listener = listener;
        this.registry = registry;
        this.closures = new ClosureCache<>(nfa, closureCacheSize);
    }

    public static <I> StateGraph<I> convert(StateGraph<I> nfa) {
        return new SubsetConstruction<>(nfa).toGraph();
    }

    public static <I> StateGraph<I> convert(StateGraph<I> nfa, ConversionListener<? super I> listener) {
        return new SubsetConstruction<>(nfa, listener).toGraph();
    }

    /**
     * Runs the construction (once) and assembles the DFA.
     */
    public StateGraph<I> toGraph() {
        return GraphAssembler.assemble(explore(), nfa.getFinalStates(), inputs);
    }

    /**
     * Runs the construction if it has not run yet.
     * @return composite states in discovery order; index 0 is the DFA start state
     */
    public List<CompositeState> explore() {
        if (phase == Phase.UNSTARTED) {
            phase = Phase.DISCOVERING;
            doExplore();
            phase = Phase.DONE;
        }
        return Collections.unmodifiableList(composites);
    }

    private void doExplore() {
        final IntArrayFIFOQueue unmarked = new IntArrayFIFOQueue();

        // Composite 0: epsilon-closure of the NFA start state
        final StateSet init = StateSet.readOnly(ClosureOperations.epsilonClosure(nfa, nfa.getStart()));
        unmarked.enqueue(discover(init));

        while (!unmarked.isEmpty()) {
            final int curr = unmarked.dequeueInt();
            final StateSet anchors = composites.get(curr).getAnchors();
            listener.stateMarked(curr);

            for (int a = 0; a < inputs.size(); a++) {
                final I sym = inputs.getSymbol(a);
                final StateSet symClosure = ClosureOperations.symbolClosure(nfa, anchors, sym);
                final StateSet succ = closures.epsilonClosure(symClosure);
                if (succ.isEmpty()) {
                    continue; // partial DFA, no transition
                }
                int succIndex = registry.get(succ);
                final boolean discovered = succIndex == Registry.MISSING_ELEMENT;
                if (discovered) {
                    // add new composite state and queue it
                    succIndex = discover(succ);
                    unmarked.enqueue(succIndex);
                }
                composites.get(curr).setSuccessor(a, succIndex);
                listener.transitionRecorded(curr, sym, symClosure, succIndex, succ, discovered);
            }
        }
    }

    private int discover(StateSet anchors) {
        final int index = composites.size();
        composites.add(new CompositeState(anchors, inputs.size()));
        registry.put(anchors, index);
        listener.stateDiscovered(index, anchors);
        return index;
    }

    public Phase getPhase() {
        return phase;
    }

    public Registry getRegistry() {
        return registry;
    }
}
