package ENFA.Model;

import java.util.Arrays;

/**
 * DFA state under construction: the NFA states it stands for (its anchors) and one successor index per
 * visible symbol. Anchors are fixed at creation; only successor links are filled in later.
 */
public final class CompositeState {
    public static final int NO_SUCCESSOR = -1;

    private final StateSet anchors;
    private final int[] successors;

    public CompositeState(StateSet anchors, int symbolCount) {
        this.anchors = StateSet.readOnly(anchors);
        this.successors = new int[symbolCount];
        Arrays.fill(this.successors, NO_SUCCESSOR);
    }

    public StateSet getAnchors() {
        return anchors;
    }

    public int getSuccessor(int symbolIndex) {
        return successors[symbolIndex];
    }

    public void setSuccessor(int symbolIndex, int composite) {
        successors[symbolIndex] = composite;
    }

    public int symbolCount() {
        return successors.length;
    }

    @Override
    public String toString() {
        return anchors + " -> " + Arrays.toString(successors);
    }
}
