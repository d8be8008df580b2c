package io.lacuna.epsilon;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import org.junit.Test;

import static io.lacuna.epsilon.Examples.assertStates;
import static io.lacuna.epsilon.Utils.characters;
import static org.junit.Assert.*;

public class RecognizerTest {

  @Test
  public void testReachableWithoutEpsilon() {
    Automaton<String, Integer> a = Examples.endsInOneThenAny();
    assertStates(a.reachable(LinearList.of(0, 0, 1, 0, 1), "q0"), "q0", "q2");
    assertStates(a.reachable(LinearList.of(0, 0, 1, 0), "q0"), "q0", "q1");
    assertTrue(a.accepts(LinearList.of(0, 0, 1, 0, 1)));
    assertFalse(a.accepts(LinearList.of(1, 1, 0)));
  }

  @Test
  public void testReachableWithEpsilon() {
    Automaton<String, Character> a = Examples.withEpsilon();
    assertStates(a.reachable(characters("aba"), a.start()), "q2", "q1");
    assertStates(a.reachable(characters("aabb"), "q1"), "q0", "q1", "q2");
    assertTrue(a.accepts(characters("aba")));
  }

  @Test
  public void testEmptyWord() {
    Automaton<String, Character> a = Examples.withEpsilon();
    assertStates(a.reachable(characters(""), "q0"), "q0", "q1");
    assertStates(a.reachable(characters(""), "q2"), "q2");

    // q1 is accepting and reachable from q0 without consuming anything
    assertTrue(a.accepts(characters("")));
    assertFalse(Examples.endsInOneThenAny().accepts(LinearList.of()));
  }

  @Test
  public void testStep() {
    Automaton<String, Character> a = Examples.withEpsilon();

    // directly to q2, or to q1 after the epsilon move
    assertStates(a.step('a', "q0"), "q1", "q2");
    assertStates(a.step('b', "q0"), "q0", "q2");
    assertStates(a.step('b', "q2"));
    assertStates(Recognizer.step(a, 'a', "q1"), "q1");
  }

  @Test
  public void testStepDeduplicates() {
    Automaton<Integer, Character> a = new AutomatonBuilder<Integer, Character>()
            .states(0, 1, 2)
            .alphabet('a')
            .epsilon(0, 1)
            .transition(0, 'a', 2)
            .transition(1, 'a', 2)
            .start(0)
            .accept(2)
            .build();

    assertStates(a.step('a', 0), 2);
  }

  @Test
  public void testTrailingEpsilonMoves() {
    Automaton<Integer, Character> a = new AutomatonBuilder<Integer, Character>()
            .states(0, 1, 2, 3)
            .alphabet('a')
            .transition(0, 'a', 1)
            .epsilon(1, 2)
            .epsilon(2, 3)
            .start(0)
            .accept(3)
            .build();

    assertStates(a.reachable(characters("a"), 0), 1, 2, 3);
    assertTrue(a.accepts(characters("a")));
    assertFalse(a.accepts(characters("aa")));
  }

  @Test
  public void testEpsilonCycleTerminates() {
    Automaton<Integer, Character> a = new AutomatonBuilder<Integer, Character>()
            .states(0, 1, 2)
            .alphabet('a')
            .epsilon(0, 1)
            .epsilon(1, 0)
            .epsilon(2, 2)
            .transition(1, 'a', 2)
            .start(0)
            .accept(2)
            .build();

    assertStates(a.reachable(characters("a"), 0), 2);
    assertStates(a.reachable(characters(""), 0), 0, 1);
    assertTrue(a.accepts(characters("a")));
    assertFalse(a.accepts(characters("")));
  }

  @Test
  public void testSymbolOutsideAlphabet() {
    Automaton<String, Character> a = Examples.withEpsilon();

    assertFalse(a.accepts(characters("z")));
    assertFalse(a.accepts(characters("abz")));
    assertStates(a.reachable(characters("za"), "q0"));
  }

  @Test
  public void testWithoutEpsilon() {
    Automaton<String, Character> a = Examples.withoutEpsilon();

    assertStates(a.reachable(characters("aa"), "q0"), "q0", "q1");
    assertTrue(a.accepts(characters("b")));
    assertTrue(a.accepts(characters("abbb")));
    assertFalse(a.accepts(characters("")));
    assertStates(a.reachable(characters("ba"), "q0"), "q0", "q1");
  }

  @Test
  public void testDeterministic() {
    Automaton<String, Character> a = Examples.withEpsilon();

    ISet<String> first = a.reachable(characters("abab"), "q0");
    for (int i = 0; i < 8; i++) {
      ISet<String> again = a.reachable(characters("abab"), "q0");
      assertEquals(first.size(), again.size());
      assertTrue(first.containsAll(again));
      assertEquals(a.accepts(characters("abab")), a.accepts(characters("abab")));
    }
  }

  @Test
  public void testRowOrderDoesNotMatter() {
    Automaton<String, Character> reordered = new AutomatonBuilder<String, Character>()
            .states("q2", "q1", "q0")
            .alphabet('b', 'a')
            .transition("q1", 'b', "q2", "q0")
            .transition("q1", 'a', "q1")
            .transition("q0", 'a', "q2")
            .epsilon("q0", "q1")
            .start("q0")
            .accept("q1")
            .build();

    Automaton<String, Character> a = Examples.withEpsilon();
    for (String word : new String[] {"", "a", "ab", "aba", "abba", "bbaab"}) {
      ISet<String> expected = a.reachable(characters(word), "q0");
      ISet<String> actual = reordered.reachable(characters(word), "q0");
      assertEquals(word, expected.size(), actual.size());
      assertTrue(word, expected.containsAll(actual));
    }
  }

  @Test
  public void testLongWord() {
    Automaton<String, Integer> a = Examples.endsInOneThenAny();

    LinearList<Integer> word = new LinearList<>();
    for (int i = 0; i < 100_000; i++) {
      word.addLast(i % 2);
    }

    assertStates(a.reachable(word, "q0"), "q0", "q2");
    assertTrue(a.accepts(word));
  }
}
