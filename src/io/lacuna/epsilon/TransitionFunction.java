package io.lacuna.epsilon;

import io.lacuna.bifurcan.ISet;

import java.util.Optional;

/**
 * The transition relation of a non-deterministic automaton.
 *
 * @param <Q> the states of the automaton
 * @param <S> the symbols that trigger transitions between states
 */
@FunctionalInterface
public interface TransitionFunction<Q, S> {

  /**
   * @param state the source state
   * @param symbol the symbol consumed, or empty for an epsilon transition
   * @return every state reachable over a single such edge, which may be empty
   */
  ISet<Q> apply(Q state, Optional<S> symbol);
}
