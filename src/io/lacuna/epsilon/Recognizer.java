package io.lacuna.epsilon;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Simulates an {@link Automaton} over a word, tracking the set of every state it could be in.
 */
public class Recognizer {

  private static final Logger LOG = LoggerFactory.getLogger(Recognizer.class);

  private Recognizer() {
  }

  /**
   * @return the states reachable from {@code state} by consuming a single {@code symbol}, either directly or after
   * following any number of epsilon transitions
   */
  public static <Q, S> ISet<Q> step(Automaton<Q, S> automaton, S symbol, Q state) {
    LinearSet<Q> result = LinearSet.from(automaton.edges(state, Optional.of(symbol)));
    for (Q q : EpsilonClosure.of(automaton, state)) {
      automaton.edges(q, Optional.of(symbol)).forEach(result::add);
    }
    return result;
  }

  /**
   * @return every state the automaton could be in after consuming all of {@code word}, starting at {@code state},
   * including any reachable by trailing epsilon transitions
   */
  public static <Q, S> ISet<Q> reachable(Automaton<Q, S> automaton, Iterable<S> word, Q state) {
    Objects.requireNonNull(word, "word");

    ISet<Q> current = LinearSet.of(state);
    for (S symbol : word) {
      LinearSet<Q> next = new LinearSet<>();
      for (Q q : current) {
        step(automaton, symbol, q).forEach(next::add);
      }
      LOG.trace("{}: {} -> {}", symbol, current, next);

      current = next;
      if (current.size() == 0) {
        break;
      }
    }

    LinearSet<Q> result = LinearSet.from(current);
    EpsilonClosure.of(automaton, current).forEach(result::add);
    return result;
  }

  /**
   * @return true if {@code word} leaves the automaton in at least one accepting state
   */
  public static <Q, S> boolean accepts(Automaton<Q, S> automaton, Iterable<S> word) {
    ISet<Q> states = reachable(automaton, word, automaton.start());
    for (Q q : states) {
      if (automaton.isAccepting(q)) {
        return true;
      }
    }
    return false;
  }
}
