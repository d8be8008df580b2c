package io.lacuna.epsilon;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * An immutable non-deterministic finite automaton with epsilon transitions, given by its states, alphabet,
 * transition relation, start state and accepting states.
 *
 * @param <Q> the states of the automaton
 * @param <S> the symbols that trigger transitions between states
 */
public class Automaton<Q, S> {

  private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

  private final LinearSet<Q> states;
  private final LinearSet<S> alphabet;
  private final TransitionFunction<Q, S> transition;
  private final Q start;
  private final LinearSet<Q> accept;

  private Automaton(LinearSet<Q> states, LinearSet<S> alphabet, TransitionFunction<Q, S> transition, Q start, LinearSet<Q> accept) {
    this.states = states;
    this.alphabet = alphabet;
    this.transition = transition;
    this.start = start;
    this.accept = accept;
  }

  /**
   * @return an automaton over {@code transition}
   * @throws InvalidStartStateException if {@code start} is not in {@code states}
   * @throws InvalidFinalStatesException if {@code accept} is not a subset of {@code states}
   */
  public static <Q, S> Automaton<Q, S> create(
          ISet<Q> states,
          ISet<S> alphabet,
          TransitionFunction<Q, S> transition,
          Q start,
          ISet<Q> accept) {

    Objects.requireNonNull(states, "states");
    Objects.requireNonNull(alphabet, "alphabet");
    Objects.requireNonNull(transition, "transition");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(accept, "accept");

    if (!states.contains(start)) {
      throw new InvalidStartStateException(start);
    }

    ISet<Q> undeclared = LinearSet.from(accept).difference(states);
    if (undeclared.size() > 0) {
      throw new InvalidFinalStatesException(undeclared);
    }

    Automaton<Q, S> automaton = new Automaton<>(
            LinearSet.from(states),
            LinearSet.from(alphabet),
            transition,
            start,
            LinearSet.from(accept));

    LOG.debug("created {}", automaton);
    return automaton;
  }

  public ISet<Q> states() {
    return states.clone();
  }

  public ISet<S> alphabet() {
    return alphabet.clone();
  }

  public Q start() {
    return start;
  }

  public ISet<Q> accepting() {
    return accept.clone();
  }

  public TransitionFunction<Q, S> transition() {
    return transition;
  }

  public boolean isAccepting(Q state) {
    return accept.contains(state);
  }

  /**
   * @return the states reachable over a single edge labeled {@code symbol}, not following any epsilon transitions
   */
  public ISet<Q> transitions(Q state, S symbol) {
    return LinearSet.from(edges(state, Optional.of(symbol)));
  }

  /**
   * @return the states reachable over a single epsilon edge, which only contains {@code state} if it has a self-loop
   */
  public ISet<Q> epsilonTransitions(Q state) {
    return LinearSet.from(edges(state, Optional.empty()));
  }

  // the set belongs to the transition relation, and must not be modified
  ISet<Q> edges(Q state, Optional<S> symbol) {
    ISet<Q> result = transition.apply(state, symbol);
    return result == null ? new LinearSet<>() : result;
  }

  ///

  public ISet<Q> epsilonClosure(Q state) {
    return EpsilonClosure.of(this, state);
  }

  public ISet<Q> step(S symbol, Q state) {
    return Recognizer.step(this, symbol, state);
  }

  public ISet<Q> reachable(Iterable<S> word, Q state) {
    return Recognizer.reachable(this, word, state);
  }

  public boolean accepts(Iterable<S> word) {
    return Recognizer.accepts(this, word);
  }

  @Override
  public String toString() {
    return "automaton[states=" + states.size()
            + ", alphabet=" + alphabet.size()
            + ", start=" + start
            + ", accept=" + accept + "]";
  }
}
