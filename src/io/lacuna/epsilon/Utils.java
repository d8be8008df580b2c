package io.lacuna.epsilon;

import io.lacuna.bifurcan.*;

/**
 * Helpers for building words.
 */
public class Utils {

  private Utils() {
  }

  /**
   * @return the characters of {@code s}, as a word over a {@code Character} alphabet
   */
  public static IList<Character> characters(CharSequence s) {
    LinearList<Character> word = new LinearList<>();
    for (int i = 0; i < s.length(); i++) {
      word.addLast(s.charAt(i));
    }
    return word;
  }
}
