package ENFA.Trace;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import ENFA.Model.StateSet;

import static ENFA.TextFormat.oneBased;

/**
 * Prints the closures computed during conversion, numbering states from 1:
 * <pre>
 * E-closure(I0) = {1,2} = 1
 *
 * Mark 1
 * {1,2} --a--> {2}
 * E-closure{2} = {2} = 2
 *
 * Mark 2
 * </pre>
 */
public class PrintingListener<I> implements ConversionListener<I> {
    private final PrintStream out;
    private final List<StateSet> anchorsByIndex = new ArrayList<>();

    public PrintingListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void stateDiscovered(int index, StateSet anchors) {
        anchorsByIndex.add(anchors);
        if (index == 0) {
            out.println("E-closure(I0) = " + oneBased(anchors) + " = 1");
        }
    }

    @Override
    public void transitionRecorded(int from, I symbol, StateSet symbolClosure, int to, StateSet anchors,
                                   boolean discovered) {
        out.println(oneBased(anchorsByIndex.get(from)) + " --" + symbol + "--> " + oneBased(symbolClosure));
        out.println("E-closure" + oneBased(symbolClosure) + " = " + oneBased(anchors) + " = " + (to + 1));
    }

    @Override
    public void stateMarked(int index) {
        out.println();
        out.println("Mark " + (index + 1));
    }

    @Override
    public String toString() {
        return "Printing";
    }
}
