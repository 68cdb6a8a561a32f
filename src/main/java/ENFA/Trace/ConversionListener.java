package ENFA.Trace;

import ENFA.Model.StateSet;

/**
 * Receives progress events from subset construction. All methods default to doing nothing.
 * Composite indices are 0-based.
 *
 * @param <I> - Input symbol type, e.g., Character
 */
public interface ConversionListener<I> {

    /**
     * A composite state was created; index 0 is the epsilon-closure of the NFA start state.
     */
    default void stateDiscovered(int index, StateSet anchors) {}

    /**
     * A successor link was recorded.
     * @param from - composite being processed
     * @param symbol - visible symbol
     * @param symbolClosure - direct successors of the anchors of {@code from}, before epsilon-closure
     * @param to - index of the successor composite
     * @param anchors - anchors of the successor composite
     * @param discovered - whether {@code to} was created by this step
     */
    default void transitionRecorded(int from, I symbol, StateSet symbolClosure, int to, StateSet anchors,
                                    boolean discovered) {}

    /**
     * The composite state was taken from the worklist; its transitions follow.
     */
    default void stateMarked(int index) {}

    static <I> ConversionListener<I> noop() {
        return new ConversionListener<>() {
            @Override
            public String toString() {
                return "NoOp";
            }
        };
    }
}
