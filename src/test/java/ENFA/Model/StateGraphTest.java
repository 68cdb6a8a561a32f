package ENFA.Model;

import java.util.List;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class StateGraphTest {
  private static final Alphabet<Character> AB_EPS = Alphabets.fromList(List.of('a', 'b', 'E'));

  @Test
  void testCreate() {
    StateGraph<Character> g = new StateGraph<>(AB_EPS, 'E', 3, 1, List.of(0, 2));
    Assertions.assertEquals(3, g.size());
    Assertions.assertEquals(1, g.getStart());
    Assertions.assertTrue(g.hasEpsilon());
    Assertions.assertEquals(Character.valueOf('E'), g.getEpsilon());
    Assertions.assertEquals(StateSet.of(3, 0, 2), g.getFinalStates());
    Assertions.assertTrue(g.isFinal(2));
    Assertions.assertFalse(g.isFinal(1));
    Assertions.assertEquals(0, g.transitionCount());
    Assertions.assertEquals(3, g.getInputAlphabet().size());

    Alphabet<Character> visible = g.getVisibleAlphabet();
    Assertions.assertEquals(2, visible.size());
    Assertions.assertEquals(Character.valueOf('a'), visible.getSymbol(0));
    Assertions.assertEquals(Character.valueOf('b'), visible.getSymbol(1));
  }

  @Test
  void testInvalidCreate() {
    assertThrows(IllegalArgumentException.class, () -> new StateGraph<>(AB_EPS, 0));
    assertThrows(IllegalArgumentException.class, () -> new StateGraph<>(AB_EPS, -3));
    // epsilon must belong to the alphabet
    assertThrows(IllegalArgumentException.class, () -> new StateGraph<>(AB_EPS, 'x', 2));
    assertThrows(IndexOutOfBoundsException.class, () -> new StateGraph<>(AB_EPS, 'E', 2, 2, List.of()));
    assertThrows(IndexOutOfBoundsException.class, () -> new StateGraph<>(AB_EPS, 'E', 2, 0, List.of(5)));
  }

  @Test
  void testAddRemoveTransition() {
    StateGraph<Character> g = new StateGraph<>(AB_EPS, 'E', 3);
    g.addTransition(0, 1, 'a');
    g.addTransition(0, 2, 'a');
    g.addTransition(0, 1, 'a'); // idempotent
    Assertions.assertEquals(StateSet.of(3, 1, 2), g.successors(0, 'a'));
    Assertions.assertEquals(2, g.transitionCount());
    Assertions.assertTrue(g.successors(0, 'b').isEmpty());

    g.removeTransition(0, 1, 'a');
    g.removeTransition(0, 1, 'a'); // absent edge, no-op
    g.removeTransition(2, 0, 'E'); // never added
    Assertions.assertEquals(StateSet.of(3, 2), g.successors(0, 'a'));
    Assertions.assertEquals(1, g.transitionCount());
  }

  @Test
  void testTransitionErrors() {
    StateGraph<Character> g = new StateGraph<>(AB_EPS, 'E', 3);
    assertThrows(IndexOutOfBoundsException.class, () -> g.addTransition(3, 0, 'a'));
    assertThrows(IndexOutOfBoundsException.class, () -> g.addTransition(0, 3, 'a'));
    assertThrows(IndexOutOfBoundsException.class, () -> g.addTransition(-1, 0, 'a'));
    assertThrows(IndexOutOfBoundsException.class, () -> g.removeTransition(0, 7, 'a'));
    UnknownSymbolException e = assertThrows(UnknownSymbolException.class, () -> g.addTransition(0, 1, 'z'));
    Assertions.assertEquals(Character.valueOf('z'), e.getSymbol());
    assertThrows(UnknownSymbolException.class, () -> g.successors(0, 'z'));
    assertThrows(UnknownSymbolException.class, () -> g.addTransition(0, 1, null));
    // UnknownSymbol is an invalid argument
    assertThrows(IllegalArgumentException.class, () -> g.removeTransition(0, 1, 'q'));

    StateGraph<Character> dfa = new StateGraph<>(Alphabets.fromList(List.of('a', 'b')), 2);
    assertThrows(UnknownSymbolException.class, () -> dfa.addTransition(0, 1, 'E'));
  }

  @Test
  void testSuccessorsAreReadOnly() {
    StateGraph<Character> g = new StateGraph<>(AB_EPS, 'E', 2);
    g.addTransition(0, 1, 'b');
    StateSet succ = g.successors(0, 'b');
    assertThrows(UnsupportedOperationException.class, () -> succ.add(0));
    assertThrows(UnsupportedOperationException.class, () -> g.getFinalStates().add(0));
    Assertions.assertEquals(1, g.getSuccessor(0, 'b'));
    Assertions.assertEquals(StateGraph.NO_STATE, g.getSuccessor(1, 'b'));
  }

  @Test
  void testDeterminism() {
    Alphabet<Character> ab = Alphabets.fromList(List.of('a', 'b'));
    StateGraph<Character> dfa = new StateGraph<>(ab, 2);
    Assertions.assertFalse(dfa.hasEpsilon());
    Assertions.assertSame(ab, dfa.getVisibleAlphabet());
    dfa.addTransition(0, 1, 'a');
    dfa.addTransition(1, 1, 'b');
    Assertions.assertTrue(dfa.isDeterministic());
    dfa.addTransition(0, 0, 'a');
    Assertions.assertFalse(dfa.isDeterministic());

    // an NFA-typed graph is never considered deterministic
    Assertions.assertFalse(new StateGraph<>(AB_EPS, 'E', 1).isDeterministic());
  }

  @Test
  void testEquality() {
    StateGraph<Character> g1 = new StateGraph<>(AB_EPS, 'E', 2, 0, List.of(1));
    StateGraph<Character> g2 = new StateGraph<>(Alphabets.fromList(List.of('a', 'b', 'E')), 'E', 2, 0, List.of(1));
    g1.addTransition(0, 1, 'E');
    Assertions.assertNotEquals(g1, g2);
    g2.addTransition(0, 1, 'E');
    Assertions.assertEquals(g1, g2);
    Assertions.assertEquals(g1.hashCode(), g2.hashCode());

    g2.setFinal(0, true);
    Assertions.assertNotEquals(g1, g2);
    g2.setFinal(0, false);
    g2.setStart(1);
    Assertions.assertNotEquals(g1, g2);

    // symbol order matters
    StateGraph<Character> g3 = new StateGraph<>(Alphabets.fromList(List.of('b', 'a', 'E')), 'E', 2, 0, List.of(1));
    g3.addTransition(0, 1, 'E');
    Assertions.assertNotEquals(g1, g3);
  }

  @Test
  void testLargeSparseGraph() {
    // destination storage is allocated per used pair, not per state and symbol
    final int n = 200_000;
    StateGraph<Character> dfa = new StateGraph<>(Alphabets.fromList(List.of('a', 'b')), n);
    for (int q = 0; q < n; q++) {
      dfa.addTransition(q, (q + 1) % n, 'a');
    }
    Assertions.assertEquals(n, dfa.transitionCount());
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(0, dfa.getSuccessor(n - 1, 'a'));
    Assertions.assertEquals(StateGraph.NO_STATE, dfa.getSuccessor(n - 1, 'b'));
    Assertions.assertTrue(dfa.successorIds(5, 'b').isEmpty());
  }

  @Test
  void testSuccessorIds() {
    StateGraph<Character> g = new StateGraph<>(AB_EPS, 'E', 4);
    g.addTransition(1, 3, 'a');
    g.addTransition(1, 0, 'a');
    Assertions.assertEquals(2, g.successorIds(1, 'a').size());
    Assertions.assertTrue(g.successorIds(1, 'a').contains(3));
    Assertions.assertEquals(0, g.getSuccessor(1, 'a')); // lowest id
    Assertions.assertEquals(StateSet.of(4, 0, 3), g.successors(1, 'a'));
    assertThrows(UnsupportedOperationException.class, () -> g.successorIds(1, 'a').add(2));
    assertThrows(UnsupportedOperationException.class, () -> g.successorIds(2, 'a').add(2));
    assertThrows(UnknownSymbolException.class, () -> g.successorIds(1, 'z'));
  }

  @Test
  void testRemovedEdgeEqualsUntouchedPair() {
    StateGraph<Character> g1 = new StateGraph<>(AB_EPS, 'E', 3, 0, List.of(2));
    StateGraph<Character> g2 = new StateGraph<>(AB_EPS, 'E', 3, 0, List.of(2));
    g1.addTransition(0, 1, 'b');
    g1.addTransition(2, 2, 'a');
    g1.removeTransition(2, 2, 'a');
    g2.addTransition(0, 1, 'b');
    Assertions.assertEquals(g1, g2);
    Assertions.assertEquals(g1.hashCode(), g2.hashCode());
  }
}
