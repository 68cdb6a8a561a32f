package ENFA;

import ENFA.Model.StateGraph;
import ENFA.Registry.HashedRegistry;
import ENFA.Trace.ConversionListener;
import ENFA.Trace.PrintingListener;
import net.automatalib.exception.FormatException;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class ENFACommandLine {
  public static void main(String[] args) {
    String filename = null;
    boolean debug = false;
    long cacheSize = ClosureCache.DEFAULT_MAXIMUM_SIZE;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--help".equalsIgnoreCase(arg) || "-h".equals(arg)) {
        printUsageAndExit();
      } else if ("--debug".equalsIgnoreCase(arg)) {
        debug = true;
      } else if ("--writeDFA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeDFA");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if ("--cache".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          System.err.println("Missing value for --cache");
          printUsageAndExit();
        }
        cacheSize = parseCacheSize(args[++i]);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() > 1) {
      printUsageAndExit();
    }

    final StateGraph<Character> nfa = positional.isEmpty() ? readNFA(System.in) : getNFAFile(positional.get(0));
    System.out.println("Original NFA size: " + nfa.size());
    System.out.println("Alphabet size:" + nfa.getVisibleAlphabet().size());
    System.out.println();

    long before = System.currentTimeMillis();
    StateGraph<Character> dfa = convert(nfa, debug ? new PrintingListener<>(System.out) : ConversionListener.noop(),
        cacheSize);
    long after = System.currentTimeMillis();

    if (debug) {
      System.out.println();
    }
    System.out.print(TextFormat.format(dfa));
    System.out.println();
    System.out.println("DFA size: " + dfa.size());
    System.out.println("Conversion duration: " + ((after - before) / 1000f) + "s");

    if (filename != null) {
      writeDFAFile(filename, dfa);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "ENFA [--help] [--debug] [--cache <size>] [--writeDFA <DFA output file>] [<NFA input file>]");
    System.out.println("[--debug] : Print every closure computed during conversion");
    System.out.println("[--cache <size>] : Bound of the epsilon-closure cache, 0 disables it (default "
        + ClosureCache.DEFAULT_MAXIMUM_SIZE + ")");
    System.out.println("[--writeDFA <DFA output file>] : Write DFA to specified output file");
    System.out.println();
    System.out.println("<NFA input file> : NFA with epsilon transitions, read from stdin if omitted.");
    System.out.println("Input Format:");
    System.out.println();
    System.out.println("Initial State: {3}");
    System.out.println("Final States:  {12,...}");
    System.out.println("Total States:  15");
    System.out.println("State    a     b     E");
    System.out.println("1      {...} {...} {...}");
    System.out.println("...    ...");
    System.out.println();
    System.out.println("States are numbered from 1. Column E holds the epsilon transitions.");
    System.exit(0);
  }

  private static long parseCacheSize(String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      System.err.println("Invalid value for --cache: " + value);
      printUsageAndExit();
      return ClosureCache.DEFAULT_MAXIMUM_SIZE; // unreachable
    }
  }

  /**
   * Convert with the given trace listener and closure cache bound.
   * @param nfa - parsed NFA, must have an epsilon column
   * @param listener - trace hook
   * @param cacheSize - closure cache bound
   * @return - DFA, states numbered in discovery order
   */
  static StateGraph<Character> convert(StateGraph<Character> nfa, ConversionListener<? super Character> listener,
                                       long cacheSize) {
    if (!nfa.hasEpsilon()) {
      throw new IllegalArgumentException("Input has no '" + TextFormat.EPSILON + "' column");
    }
    return new SubsetConstruction<>(nfa, listener, new HashedRegistry(), cacheSize).toGraph();
  }

  static StateGraph<Character> readNFA(InputStream is) {
    try {
      return TextFormat.read(is);
    } catch (IOException | FormatException ex) {
      throw new RuntimeException(ex);
    }
  }

  static StateGraph<Character> getNFAFile(String filePath) {
    try (InputStream is = new FileInputStream(filePath)) {
      return TextFormat.read(is);
    } catch (IOException | FormatException ex) {
      throw new RuntimeException(ex);
    }
  }

  static void writeDFAFile(String filename, StateGraph<Character> dfa) {
    System.out.println("Writing to file: " + filename);
    try (Writer w = new OutputStreamWriter(new FileOutputStream(filename), StandardCharsets.UTF_8)) {
      TextFormat.write(dfa, w);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Parse, convert and print, for callers that already hold the streams.
   */
  static StateGraph<Character> run(InputStream in, PrintStream out, boolean debug) {
    final StateGraph<Character> nfa = readNFA(in);
    final StateGraph<Character> dfa = convert(nfa,
        debug ? new PrintingListener<>(out) : ConversionListener.noop(), ClosureCache.DEFAULT_MAXIMUM_SIZE);
    if (debug) {
      out.println();
    }
    out.print(TextFormat.format(dfa));
    return dfa;
  }
}
