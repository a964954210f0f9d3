package xlf;

import com.google.common.base.CharMatcher;

/** Normalizes raw formula text before tokenization. */
public final class FormulaSource {
  private FormulaSource() {}

  /**
   * Trims the text, drops one leading {@code =} and removes every remaining whitespace character.
   * Offsets reported by the parser refer to the returned string.
   */
  public static String clean(String formula) {
    String trimmed = CharMatcher.whitespace().trimFrom(formula);
    if (trimmed.startsWith("=")) {
      trimmed = trimmed.substring(1);
    }
    return CharMatcher.whitespace().removeFrom(trimmed);
  }
}
