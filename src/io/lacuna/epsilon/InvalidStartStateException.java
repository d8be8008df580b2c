package io.lacuna.epsilon;

/**
 * Thrown when the start state is not one of the declared states.
 */
public class InvalidStartStateException extends AutomatonException {

  private final Object state;

  public InvalidStartStateException(Object state) {
    super("start state " + state + " is not a declared state");
    this.state = state;
  }

  public Object state() {
    return state;
  }
}
