package io.lacuna.epsilon;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * Computes the states reachable over one or more epsilon transitions.  The origin is only part of its own closure
 * when some epsilon cycle leads back to it.
 */
public class EpsilonClosure {

  private EpsilonClosure() {
  }

  public static <Q, S> ISet<Q> of(Automaton<Q, S> automaton, Q state) {
    LinearSet<Q> accumulator = new LinearSet<>();
    expand(automaton, state, accumulator);
    return accumulator;
  }

  /**
   * @return the union of the closures of each of {@code states}
   */
  public static <Q, S> ISet<Q> of(Automaton<Q, S> automaton, ISet<Q> states) {
    LinearSet<Q> accumulator = new LinearSet<>();
    states.forEach(s -> expand(automaton, s, accumulator));
    return accumulator;
  }

  // the accumulator doubles as the visited set, so each state is queued once
  private static <Q, S> void expand(Automaton<Q, S> automaton, Q state, LinearSet<Q> accumulator) {
    LinearList<Q> queue = LinearList.of(state);

    while (queue.size() > 0) {
      Q s = queue.popLast();
      for (Q q : automaton.edges(s, Optional.empty())) {
        if (!accumulator.contains(q)) {
          accumulator.add(q);
          queue.addLast(q);
        }
      }
    }
  }
}
