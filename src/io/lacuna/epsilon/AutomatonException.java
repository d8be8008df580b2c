package io.lacuna.epsilon;

/**
 * Thrown when an automaton cannot be constructed from the states, symbols and transitions it was given.
 */
public class AutomatonException extends IllegalArgumentException {

  public AutomatonException(String message) {
    super(message);
  }
}
