package ENFA;

import java.util.List;

import ENFA.Model.CompositeState;
import ENFA.Model.StateGraph;
import ENFA.Model.StateSet;
import net.automatalib.alphabet.Alphabet;

/**
 * Turns the composite states of a finished subset construction into a DFA-typed {@link StateGraph}.
 */
public final class GraphAssembler {
    private GraphAssembler() {
    }

    /**
     * Composite {@code i} becomes state {@code i}; state 0 is the start state.
     * A state is final iff its anchors contain at least one NFA final state.
     * @param composites - composite states in discovery order
     * @param nfaFinalStates - final states of the NFA the composites were built from
     * @param inputs - visible alphabet, in the order the successor links are indexed
     * @return new graph without epsilon symbol
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> StateGraph<I> assemble(List<CompositeState> composites, StateSet nfaFinalStates,
                                             Alphabet<I> inputs) {
        if (composites.isEmpty()) {
            throw new IllegalArgumentException("No composite states to assemble");
        }
        final StateGraph<I> out = new StateGraph<>(inputs, composites.size());
        out.setStart(0);

        for (int i = 0; i < composites.size(); i++) {
            final CompositeState composite = composites.get(i);
            if (composite.symbolCount() != inputs.size()) {
                throw new IllegalArgumentException(
                    "Composite " + i + " has " + composite.symbolCount() + " links, alphabet has " + inputs.size());
            }
            for (int a = 0; a < inputs.size(); a++) {
                final int succ = composite.getSuccessor(a);
                if (succ != CompositeState.NO_SUCCESSOR) {
                    out.addTransition(i, succ, inputs.getSymbol(a));
                }
            }
            if (composite.getAnchors().intersects(nfaFinalStates)) {
                out.setFinal(i, true);
            }
        }
        return out;
    }
}
