package io.lacuna.epsilon;

import java.util.Optional;

/**
 * Thrown when a row of a transition table references a state or symbol which was never declared.
 */
public class MalformedTransitionTableException extends AutomatonException {

  private final Object state;
  private final Optional<?> symbol;

  public MalformedTransitionTableException(Object state, Optional<?> symbol, String reason) {
    super("transition (" + state + ", " + symbol.map(String::valueOf).orElse("ε") + "): " + reason);
    this.state = state;
    this.symbol = symbol;
  }

  /**
   * @return the source state of the offending row
   */
  public Object state() {
    return state;
  }

  /**
   * @return the symbol of the offending row, or empty for an epsilon row
   */
  public Optional<?> symbol() {
    return symbol;
  }
}
