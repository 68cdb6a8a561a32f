package ENFA;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ENFA.Model.StateGraph;
import ENFA.Model.StateSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.exception.FormatException;

/**
 * Tabular text format for automata over single-character symbols:
 * <pre>
 * Initial State: {1}
 * Final States:  {2,3}
 * Total States:  3
 * State    a     b     E
 * 1      {2}   {}    {3}
 * 2      {}    {1,3} {}
 * 3      {}    {}    {}
 * </pre>
 * State numbers are 1-based in the text and 0-based in the graph. The column {@code E} holds epsilon
 * transitions; a table without it describes a DFA-typed graph.
 */
public final class TextFormat {
    public static final char EPSILON = 'E';

    private static final Pattern INITIAL = Pattern.compile("\\s*Initial\\s+State\\s*:\\s*\\{\\s*(\\d+)\\s*}\\s*");
    private static final Pattern FINAL = Pattern.compile("\\s*Final\\s+States\\s*:\\s*\\{([^}]*)}\\s*");
    private static final Pattern TOTAL = Pattern.compile("\\s*Total\\s+States\\s*:\\s*(\\d+)\\s*");
    private static final Pattern HEADER = Pattern.compile("\\s*States?\\b(.*)");
    private static final Pattern ROW_LABEL = Pattern.compile("\\s*(\\d+)\\s*:?");
    private static final Pattern CELL = Pattern.compile("\\{([^{}]*)}");

    private TextFormat() {
    }

    public static StateGraph<Character> read(InputStream is) throws IOException, FormatException {
        return read(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public static StateGraph<Character> read(Reader reader) throws IOException, FormatException {
        final LineSource lines = new LineSource(new BufferedReader(reader));

        final Matcher initial = lines.expect(INITIAL, "Initial State: {n}");
        final int start = parseId(initial.group(1), lines.number);

        final Matcher finals = lines.expect(FINAL, "Final States: {n,...}");
        final List<Integer> finalStates = parseIdList(finals.group(1), lines.number);
        final int finalLine = lines.number;

        final Matcher total = lines.expect(TOTAL, "Total States: n");
        final int stateCount = parseCount(total.group(1), lines.number);

        final Matcher header = lines.expect(HEADER, "State <symbols>");
        final Alphabet<Character> alphabet = parseAlphabet(header.group(1), lines.number);
        final Character epsilon = alphabet.containsSymbol(EPSILON) ? EPSILON : null;

        final StateGraph<Character> graph = new StateGraph<>(alphabet, epsilon, stateCount);
        if (start >= stateCount) {
            throw new FormatException("Initial state " + (start + 1) + " exceeds total states " + stateCount);
        }
        graph.setStart(start);
        for (int f : finalStates) {
            if (f >= stateCount) {
                throw new FormatException("Line " + finalLine + ": final state " + (f + 1)
                    + " exceeds total states " + stateCount);
            }
            graph.setFinal(f, true);
        }

        final StateSet seenRows = new StateSet(stateCount);
        int nextRow = 0;
        String line;
        while ((line = lines.nextNonBlank()) != null) {
            final int row = parseRow(graph, line, nextRow, lines.number);
            if (!seenRows.add(row)) {
                throw new FormatException("Line " + lines.number + ": state " + (row + 1) + " listed twice");
            }
            nextRow = row + 1;
        }
        return graph;
    }

    /**
     * Print {@code graph} in the format accepted by {@link #read(Reader)}.
     */
    public static <I> void write(StateGraph<I> graph, Appendable out) throws IOException {
        final Alphabet<I> alphabet = graph.getInputAlphabet();
        out.append("Initial State: {").append(String.valueOf(graph.getStart() + 1)).append("}\n");
        out.append("Final States: ").append(oneBased(graph.getFinalStates())).append('\n');
        out.append("Total States: ").append(String.valueOf(graph.size())).append('\n');
        out.append("State");
        for (I sym : alphabet) {
            out.append('\t').append(String.valueOf(sym));
        }
        out.append('\n');
        for (int q = 0; q < graph.size(); q++) {
            out.append(String.valueOf(q + 1));
            for (I sym : alphabet) {
                final int[] dest = graph.successorIds(q, sym).toIntArray();
                Arrays.sort(dest);
                out.append('\t').append(oneBased(dest));
            }
            out.append('\n');
        }
    }

    public static <I> String format(StateGraph<I> graph) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(graph, sb);
        } catch (IOException e) {
            throw new IllegalStateException(e); // StringBuilder does not throw
        }
        return sb.toString();
    }

    private static int parseRow(StateGraph<Character> graph, String line, int defaultRow, int lineNo)
        throws FormatException {
        int pos = 0;
        int row = defaultRow;
        final Matcher label = ROW_LABEL.matcher(line);
        if (label.lookingAt()) {
            row = parseId(label.group(1), lineNo);
            pos = label.end();
        }
        if (row >= graph.size()) {
            throw new FormatException("Line " + lineNo + ": state " + (row + 1)
                + " exceeds total states " + graph.size());
        }

        final Alphabet<Character> alphabet = graph.getInputAlphabet();
        final Matcher cell = CELL.matcher(line);
        int column = 0;
        while (cell.find(pos)) {
            if (!line.substring(pos, cell.start()).isBlank()) {
                throw new FormatException("Line " + lineNo + ": unexpected text '"
                    + line.substring(pos, cell.start()).trim() + "'");
            }
            if (column >= alphabet.size()) {
                throw new FormatException("Line " + lineNo + ": more than " + alphabet.size() + " columns");
            }
            final Character sym = alphabet.getSymbol(column++);
            for (int to : parseIdList(cell.group(1), lineNo)) {
                if (to >= graph.size()) {
                    throw new FormatException("Line " + lineNo + ": destination " + (to + 1)
                        + " exceeds total states " + graph.size());
                }
                graph.addTransition(row, to, sym);
            }
            pos = cell.end();
        }
        if (!line.substring(pos).isBlank()) {
            throw new FormatException("Line " + lineNo + ": unexpected text '" + line.substring(pos).trim() + "'");
        }
        if (column != alphabet.size()) {
            throw new FormatException("Line " + lineNo + ": expected " + alphabet.size()
                + " columns, found " + column);
        }
        return row;
    }

    private static Alphabet<Character> parseAlphabet(String symbols, int lineNo) throws FormatException {
        final List<Character> result = new ArrayList<>();
        for (String token : symbols.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.length() != 1) {
                throw new FormatException("Line " + lineNo + ": symbol '" + token + "' is not a single character");
            }
            final char c = token.charAt(0);
            if (c == '{' || c == '}' || c == ',') {
                throw new FormatException("Line " + lineNo + ": '" + c + "' cannot be a symbol");
            }
            if (result.contains(c)) {
                throw new FormatException("Line " + lineNo + ": duplicate symbol '" + c + "'");
            }
            result.add(c);
        }
        return Alphabets.fromList(result);
    }

    private static List<Integer> parseIdList(String list, int lineNo) throws FormatException {
        final List<Integer> result = new ArrayList<>();
        if (list.isBlank()) {
            return result;
        }
        for (String token : list.split(",")) {
            result.add(parseId(token.trim(), lineNo));
        }
        return result;
    }

    /**
     * @return 0-based id of the 1-based {@code token}
     */
    private static int parseId(String token, int lineNo) throws FormatException {
        final int id;
        try {
            id = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new FormatException("Line " + lineNo + ": '" + token + "' is not a state number");
        }
        if (id < 1) {
            throw new FormatException("Line " + lineNo + ": state numbers start at 1, found " + id);
        }
        return id - 1;
    }

    private static int parseCount(String token, int lineNo) throws FormatException {
        final int count;
        try {
            count = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new FormatException("Line " + lineNo + ": '" + token + "' is not a state count");
        }
        if (count <= 0) {
            throw new FormatException("Line " + lineNo + ": total states must be positive, found " + count);
        }
        return count;
    }

    /**
     * Renders a set with 1-based ids, e.g. {@code {1,3}}.
     */
    public static String oneBased(StateSet set) {
        return oneBased(set.toArray());
    }

    private static String oneBased(int[] sortedIds) {
        final StringBuilder sb = new StringBuilder("{");
        for (int s : sortedIds) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(s + 1);
        }
        return sb.append('}').toString();
    }

    private static final class LineSource {
        private final BufferedReader reader;
        int number;

        LineSource(BufferedReader reader) {
            this.reader = reader;
        }

        String nextNonBlank() throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                number++;
                if (!line.isBlank()) {
                    return line;
                }
            }
            return null;
        }

        Matcher expect(Pattern pattern, String expected) throws IOException, FormatException {
            final String line = nextNonBlank();
            if (line == null) {
                throw new FormatException("Unexpected end of input, expected '" + expected + "'");
            }
            final Matcher m = pattern.matcher(line);
            if (!m.matches()) {
                throw new FormatException("Line " + number + ": expected '" + expected + "', found '" + line + "'");
            }
            return m;
        }
    }
}
