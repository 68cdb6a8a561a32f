package ENFA;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import ENFA.Model.StateGraph;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Factories for {@link StateGraph}s and conversions from/to AutomataLib automata.
 */
public final class StateGraphs {
    private StateGraphs() {
    }

    /**
     * Empty NFA-typed graph; transitions are added afterwards with {@link StateGraph#addTransition}.
     */
    public static <I> StateGraph<I> buildGraph(Alphabet<I> alphabet, I epsilon, int stateCount, int start,
                                               Iterable<Integer> finalStates) {
        if (epsilon == null) {
            throw new IllegalArgumentException("NFA-typed graph needs an epsilon symbol");
        }
        return new StateGraph<>(alphabet, epsilon, stateCount, start, finalStates);
    }

    /**
     * Empty DFA-typed graph, without epsilon symbol.
     */
    public static <I> StateGraph<I> buildGraph(Alphabet<I> alphabet, int stateCount, int start,
                                               Iterable<Integer> finalStates) {
        return new StateGraph<>(alphabet, null, stateCount, start, finalStates);
    }

    /**
     * Export a deterministic graph as a (partial) CompactDFA with the same state ids.
     * @param dfa - graph without epsilon symbol and with at most one destination per state and symbol
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> CompactDFA<I> toCompactDFA(StateGraph<I> dfa) {
        if (!dfa.isDeterministic()) {
            throw new IllegalArgumentException("Graph is not deterministic: " + dfa);
        }
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        for (int i = 0; i < dfa.size(); i++) {
            out.addState(dfa.isFinal(i));
        }
        out.setInitialState(dfa.getStart());

        for (int q = 0; q < dfa.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = dfa.getSuccessor(q, alphabet.getSymbol(a));
                if (succ != StateGraph.NO_STATE) {
                    out.setTransition(q, a, succ);
                }
            }
        }
        return out;
    }

    /**
     * Import a CompactNFA (without epsilon transitions) as an NFA-typed graph.
     * A single initial state becomes the start state. Several initial states get a fresh start state,
     * numbered {@code nfa.size()}, with epsilon edges to each of them.
     * @param nfa - original NFA
     * @param epsilon - symbol to add to the alphabet as epsilon, must not be one of its symbols
     * @param <I> - Input symbol type, e.g., Integer
     */
    public static <I> StateGraph<I> fromCompactNFA(CompactNFA<I> nfa, I epsilon) {
        final Alphabet<I> inputs = nfa.getInputAlphabet();
        if (epsilon == null || inputs.containsSymbol(epsilon)) {
            throw new IllegalArgumentException("Epsilon symbol must be new to the alphabet: " + epsilon);
        }
        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.isEmpty()) {
            throw new IllegalArgumentException("NFA has no initial state");
        }

        final List<I> symbols = new ArrayList<>(inputs.size() + 1);
        for (I sym : inputs) {
            symbols.add(sym);
        }
        symbols.add(epsilon);

        final int states = nfa.size();
        final boolean freshStart = initialStates.size() > 1;
        final StateGraph<I> out = new StateGraph<>(Alphabets.fromList(symbols), epsilon,
            freshStart ? states + 1 : states);

        for (int q = 0; q < states; q++) {
            out.setFinal(q, nfa.isAccepting(q));
            for (I sym : inputs) {
                for (int t : nfa.getTransitions(q, sym)) {
                    out.addTransition(q, t, sym);
                }
            }
        }
        if (freshStart) {
            out.setStart(states);
            for (int init : initialStates) {
                out.addTransition(states, init, epsilon);
            }
        } else {
            out.setStart(initialStates.iterator().next());
        }
        return out;
    }
}
