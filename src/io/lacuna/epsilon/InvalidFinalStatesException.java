package io.lacuna.epsilon;

import io.lacuna.bifurcan.ISet;

/**
 * Thrown when one or more accepting states are not declared states.
 */
public class InvalidFinalStatesException extends AutomatonException {

  private final ISet<?> states;

  public InvalidFinalStatesException(ISet<?> states) {
    super("accepting states " + states + " are not declared states");
    this.states = states;
  }

  /**
   * @return the accepting states which are missing from the declared states
   */
  public ISet<?> states() {
    return states;
  }
}
