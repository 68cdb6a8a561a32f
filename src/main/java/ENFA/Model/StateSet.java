package ENFA.Model;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Set of state ids over a fixed universe {@code [0, universe)}.
 * Backed by a bit vector that never resizes. Equality is set equality, so a StateSet can be used
 * directly as a hash key for the set of states it holds.
 */
public final class StateSet {
  private final long[] bits; // Array of longs holding the bits
  private final int universe;
  private final long lastWordMask; // mask off bits beyond universe in the last word
  private final boolean readOnly;

  /**
   * Creates a new, empty StateSet. The internally allocated long array will be exactly the size needed
   * to accommodate the universe specified.
   *
   * @param universe the number of states, ids are {@code 0 .. universe-1}
   */
  public StateSet(final int universe) {
    if (universe < 0) {
      throw new IllegalArgumentException("universe < 0: " + universe);
    }
    this.universe = universe;
    this.bits = new long[Math.max(1, ((universe - 1) >> 6) + 1)];
    final int r = universe & 63;
    this.lastWordMask = (universe == 0) ? 0L : (r == 0) ? -1L : (-1L >>> (64 - r));
    this.readOnly = false;
  }

  private StateSet(StateSet backing, boolean readOnly) {
    this.bits = backing.bits;
    this.universe = backing.universe;
    this.lastWordMask = backing.lastWordMask;
    this.readOnly = readOnly;
  }

  public static StateSet of(int universe, int... states) {
    final StateSet result = new StateSet(universe);
    for (int s : states) {
      result.add(s);
    }
    return result;
  }

  /**
   * View of {@code set} that rejects modification. Changes to {@code set} stay visible through the view.
   */
  public static StateSet readOnly(StateSet set) {
    return set.readOnly ? set : new StateSet(set, true);
  }

  public StateSet copy() {
    final StateSet result = new StateSet(universe);
    System.arraycopy(bits, 0, result.bits, 0, bits.length);
    return result;
  }

  public int universe() {
    return universe;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public boolean contains(final int state) {
    checkState(state);
    final int wordNum = state >> 6; // div 64
    final long bitmask = 1L << (state & 63);
    return (bits[wordNum] & bitmask) != 0;
  }

  /**
   * @return true if the state was not present before
   */
  public boolean add(final int state) {
    checkWritable();
    checkState(state);
    final int wordNum = state >> 6;
    final long bitmask = 1L << (state & 63);
    final boolean absent = (bits[wordNum] & bitmask) == 0;
    bits[wordNum] |= bitmask;
    return absent;
  }

  /**
   * @return true if the state was present before
   */
  public boolean remove(final int state) {
    checkWritable();
    checkState(state);
    final int wordNum = state >> 6;
    final long bitmask = 1L << (state & 63);
    final boolean present = (bits[wordNum] & bitmask) != 0;
    bits[wordNum] &= ~bitmask;
    return present;
  }

  /**
   * Union: adds every state of {@code other} to this set.
   * @return true if this set changed
   */
  public boolean addAll(final StateSet other) {
    checkWritable();
    checkUniverse(other);
    boolean changed = false;
    for (int i = 0; i < bits.length; i++) {
      final long merged = bits[i] | other.bits[i];
      changed |= merged != bits[i];
      bits[i] = merged;
    }
    return changed;
  }

  public boolean intersects(final StateSet other) {
    checkUniverse(other);
    for (int i = 0; i < bits.length; i++) {
      if ((bits[i] & other.bits[i]) != 0) {
        return true;
      }
    }
    return false;
  }

  public boolean containsAll(final StateSet other) {
    checkUniverse(other);
    for (int i = 0; i < bits.length; i++) {
      if ((other.bits[i] & ~bits[i]) != 0) {
        return false;
      }
    }
    return true;
  }

  public boolean isEmpty() {
    for (long word : bits) {
      if (word != 0) {
        return false;
      }
    }
    return true;
  }

  public int cardinality() {
    int count = 0;
    for (long word : bits) {
      count += Long.bitCount(word);
    }
    return count;
  }

  /**
   * Returns the first state at or after {@code from}, or -1 if there is none.
   * Iterate with {@code for (int s = set.nextState(0); s >= 0; s = set.nextState(s + 1))}.
   */
  public int nextState(final int from) {
    if (from < 0) {
      throw new IndexOutOfBoundsException("from < 0: " + from);
    }
    if (from >= universe) {
      return -1;
    }
    int i = from >> 6;
    final int numWords = bits.length;

    // discard bits below 'from' in the first word
    long word = bits[i] & (-1L << from);
    if (i == numWords - 1) word &= lastWordMask;

    while (true) {
      if (word != 0) {
        return (i << 6) + Long.numberOfTrailingZeros(word);
      }
      if (++i >= numWords) {
        return -1;
      }
      word = bits[i];
      if (i == numWords - 1) word &= lastWordMask;
    }
  }

  public IntStream stream() {
    return IntStream.iterate(nextState(0), s -> s >= 0, s -> nextState(s + 1));
  }

  public int[] toArray() {
    return stream().toArray();
  }

  private void checkState(int state) {
    if (state < 0 || state >= universe) {
      throw new IndexOutOfBoundsException("State " + state + " outside [0, " + universe + ")");
    }
  }

  private void checkUniverse(StateSet other) {
    if (other.universe != universe) {
      throw new IllegalArgumentException("Universe mismatch: " + universe + " vs " + other.universe);
    }
  }

  private void checkWritable() {
    if (readOnly) {
      throw new UnsupportedOperationException("read-only StateSet");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StateSet)) {
      return false;
    }
    final StateSet other = (StateSet) o;
    return universe == other.universe && Arrays.equals(bits, other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * universe + Arrays.hashCode(bits);
  }

  /**
   * 0-based ids, e.g. {@code {0,2,5}}.
   */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("{");
    for (int s = nextState(0); s >= 0; s = nextState(s + 1)) {
      if (sb.length() > 1) {
        sb.append(',');
      }
      sb.append(s);
    }
    return sb.append('}').toString();
  }
}
