package xlf;

import com.google.common.collect.ImmutableList;

/** Guesses what a single raw lexeme is, without any grammatical context. */
public interface TokenClassifier {
  /** Returns at least one guess, best first. */
  ImmutableList<TokenGuess> classify(String lexeme);
}
