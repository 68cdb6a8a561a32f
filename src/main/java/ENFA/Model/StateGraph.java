package ENFA.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Labeled state-transition graph with a fixed number of states.
 * <p>
 * Destinations of a (state, symbol) pair are stored sparsely and only once the pair gets its first edge, so a
 * DFA with n states costs O(n * |alphabet|) rather than a bit vector of n bits per pair.
 * An NFA-typed graph carries an epsilon symbol that is part of its alphabet; a DFA-typed graph has none.
 * The state count never changes after construction: graphs are filled with transitions, then only read.
 *
 * @param <I> input symbol type, e.g., Character
 */
public final class StateGraph<I> {
    public static final int NO_STATE = -1;

    private final Alphabet<I> alphabet;
    private final I epsilon; // null for DFA-typed graphs
    private final int stateCount;
    private final int alphabetSize;
    private final IntSet[] transitions; // indexed by state * alphabetSize + symbolIndex, null until used
    private final StateSet finalStates;
    private int start;

    /**
     * DFA-typed graph without an epsilon symbol.
     */
    public StateGraph(Alphabet<I> alphabet, int stateCount) {
        this(alphabet, null, stateCount);
    }

    /**
     * NFA-typed graph if {@code epsilon} is non-null; it must then be a member of {@code alphabet}.
     */
    public StateGraph(Alphabet<I> alphabet, I epsilon, int stateCount) {
        Objects.requireNonNull(alphabet, "alphabet");
        if (stateCount <= 0) {
            throw new IllegalArgumentException("State count must be positive: " + stateCount);
        }
        if (epsilon != null && !alphabet.containsSymbol(epsilon)) {
            throw new IllegalArgumentException("Epsilon symbol " + epsilon + " is not part of the alphabet");
        }
        this.alphabet = alphabet;
        this.epsilon = epsilon;
        this.stateCount = stateCount;
        this.alphabetSize = alphabet.size();
        this.transitions = new IntSet[Math.multiplyExact(stateCount, alphabetSize)];
        this.finalStates = new StateSet(stateCount);
        this.start = 0;
    }

    public StateGraph(Alphabet<I> alphabet, I epsilon, int stateCount, int start, Iterable<Integer> finalStates) {
        this(alphabet, epsilon, stateCount);
        setStart(start);
        for (int f : finalStates) {
            setFinal(f, true);
        }
    }

    public void addTransition(int from, int to, I symbol) {
        checkState(to);
        final int idx = pairIndex(from, symbol);
        if (transitions[idx] == null) {
            transitions[idx] = new IntOpenHashSet(1);
        }
        transitions[idx].add(to);
    }

    public void removeTransition(int from, int to, I symbol) {
        checkState(to);
        final int idx = pairIndex(from, symbol);
        if (transitions[idx] != null) {
            transitions[idx].remove(to);
        }
    }

    public void setStart(int state) {
        checkState(state);
        this.start = state;
    }

    public void setFinal(int state, boolean isFinal) {
        checkState(state);
        if (isFinal) {
            finalStates.add(state);
        } else {
            finalStates.remove(state);
        }
    }

    public int getStart() {
        return start;
    }

    /**
     * Full alphabet, including epsilon for NFA-typed graphs.
     */
    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    /**
     * Alphabet without the epsilon symbol, in the same order.
     */
    public Alphabet<I> getVisibleAlphabet() {
        if (epsilon == null) {
            return alphabet;
        }
        final List<I> visible = new ArrayList<>(alphabetSize - 1);
        for (I sym : alphabet) {
            if (!epsilon.equals(sym)) {
                visible.add(sym);
            }
        }
        return Alphabets.fromList(visible);
    }

    public I getEpsilon() {
        return epsilon;
    }

    public boolean hasEpsilon() {
        return epsilon != null;
    }

    public boolean isEpsilon(I symbol) {
        return epsilon != null && epsilon.equals(symbol);
    }

    /**
     * @return number of states
     */
    public int size() {
        return stateCount;
    }

    public StateSet getFinalStates() {
        return StateSet.readOnly(finalStates);
    }

    public boolean isFinal(int state) {
        checkState(state);
        return finalStates.contains(state);
    }

    /**
     * Read-only snapshot of the destinations of {@code state} under {@code symbol}.
     */
    public StateSet successors(int state, I symbol) {
        final StateSet result = new StateSet(stateCount);
        for (IntIterator it = successorIds(state, symbol).iterator(); it.hasNext(); ) {
            result.add(it.nextInt());
        }
        return StateSet.readOnly(result);
    }

    /**
     * Unmodifiable, unordered view of the destinations of {@code state} under {@code symbol}.
     */
    public IntSet successorIds(int state, I symbol) {
        final IntSet dest = transitions[pairIndex(state, symbol)];
        return dest == null ? IntSets.EMPTY_SET : IntSets.unmodifiable(dest);
    }

    /**
     * Single destination of {@code state} under {@code symbol}.
     * @return the lowest destination id, or {@link #NO_STATE} if there is none
     */
    public int getSuccessor(int state, I symbol) {
        final IntSet dest = transitions[pairIndex(state, symbol)];
        int lowest = NO_STATE;
        if (dest != null) {
            for (IntIterator it = dest.iterator(); it.hasNext(); ) {
                final int to = it.nextInt();
                if (lowest == NO_STATE || to < lowest) {
                    lowest = to;
                }
            }
        }
        return lowest;
    }

    /**
     * True if there is no epsilon symbol and every (state, symbol) pair has at most one destination.
     */
    public boolean isDeterministic() {
        if (epsilon != null) {
            return false;
        }
        for (IntSet dest : transitions) {
            if (dest != null && dest.size() > 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of edges, counting each (from, to, symbol) triple once.
     */
    public int transitionCount() {
        int count = 0;
        for (IntSet dest : transitions) {
            if (dest != null) {
                count += dest.size();
            }
        }
        return count;
    }

    private int pairIndex(int state, I symbol) {
        checkState(state);
        return state * alphabetSize + symbolIndex(symbol);
    }

    private int symbolIndex(I symbol) {
        if (symbol == null || !alphabet.containsSymbol(symbol)) {
            throw new UnknownSymbolException(symbol);
        }
        return alphabet.getSymbolIndex(symbol);
    }

    private void checkState(int state) {
        if (state < 0 || state >= stateCount) {
            throw new IndexOutOfBoundsException("State " + state + " outside [0, " + stateCount + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateGraph)) {
            return false;
        }
        final StateGraph<?> other = (StateGraph<?>) o;
        return stateCount == other.stateCount
            && start == other.start
            && Objects.equals(epsilon, other.epsilon)
            && symbolsEqual(other)
            && finalStates.equals(other.finalStates)
            && transitionsEqual(other);
    }

    private boolean transitionsEqual(StateGraph<?> other) {
        for (int i = 0; i < transitions.length; i++) {
            if (!orEmpty(transitions[i]).equals(orEmpty(other.transitions[i]))) {
                return false;
            }
        }
        return true;
    }

    private static IntSet orEmpty(IntSet dest) {
        return dest == null ? IntSets.EMPTY_SET : dest;
    }

    private boolean symbolsEqual(StateGraph<?> other) {
        if (alphabetSize != other.alphabetSize) {
            return false;
        }
        for (int i = 0; i < alphabetSize; i++) {
            if (!alphabet.getSymbol(i).equals(other.alphabet.getSymbol(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(stateCount, start, epsilon, finalStates);
        for (int i = 0; i < transitions.length; i++) {
            if (transitions[i] != null && !transitions[i].isEmpty()) {
                result += 31 * i + transitions[i].hashCode(); // empty and absent pairs hash alike
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return (hasEpsilon() ? "NFA" : "DFA") + "[states=" + stateCount
            + ", alphabet=" + alphabet
            + ", start=" + start
            + ", final=" + finalStates
            + ", transitions=" + transitionCount() + "]";
    }
}
