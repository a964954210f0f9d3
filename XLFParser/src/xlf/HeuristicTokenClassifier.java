package xlf;

import com.google.common.collect.ImmutableList;

import xlf.TokenGuess.Category;
import xlf.TokenPatterns.LexemeClass;

/**
 * Classifies a lexeme by testing it against the tokenizer's patterns in a fixed order, most
 * specific first. Anything unrecognised is an {@link Category#EXPRESSION}.
 */
public final class HeuristicTokenClassifier implements TokenClassifier {

  @Override
  public ImmutableList<TokenGuess> classify(String lexeme) {
    return ImmutableList.of(guess(lexeme));
  }

  private static TokenGuess guess(String lexeme) {
    if (matches(LexemeClass.LITERAL, lexeme)) {
      return TokenGuess.of(
          Category.LITERAL, lexeme.substring(1, lexeme.length() - 1).replace("\"\"", "\""));
    } else if (matches(LexemeClass.BOOLEAN, lexeme)) {
      return TokenGuess.of(Category.BOOLEAN, Boolean.valueOf(lexeme));
    } else if (matches(LexemeClass.DYNAMIC_ERROR, lexeme)) {
      return TokenGuess.of(Category.DYNAMIC_ERROR, lexeme);
    } else if (matches(LexemeClass.ERROR, lexeme)) {
      return TokenGuess.of(Category.ERROR, lexeme);
    } else if (matches(LexemeClass.ARRAY, lexeme)) {
      return TokenGuess.of(Category.ARRAY, lexeme);
    } else if (matches(LexemeClass.THREE_D_REFERENCE, lexeme)) {
      return TokenGuess.of(Category.THREE_D_REFERENCE, lexeme);
    } else if (matches(LexemeClass.EXTERNAL_REFERENCE, lexeme)) {
      return TokenGuess.of(Category.EXTERNAL_REFERENCE, lexeme);
    } else if (matches(LexemeClass.STRUCTURED_EXT, lexeme)) {
      return TokenGuess.of(Category.STRUCTURED_REFERENCE_EXT, lexeme);
    } else if (matches(LexemeClass.STRUCTURED_REFERENCE, lexeme)
        || matches(LexemeClass.TABLE_COLUMN, lexeme)) {
      return TokenGuess.of(Category.STRUCTURED_REFERENCE, lexeme);
    } else if (matches(LexemeClass.R1C1, lexeme)) {
      return TokenGuess.of(Category.R1C1, lexeme);
    } else if (matches(LexemeClass.CELL_OR_RANGE, lexeme)) {
      return TokenGuess.of(lexeme.contains(":") ? Category.RANGE : Category.CELL, lexeme);
    } else if (matches(LexemeClass.PERCENTAGE, lexeme)) {
      return TokenGuess.of(
          Category.PERCENTAGE,
          Double.parseDouble(lexeme.substring(0, lexeme.length() - 1)) / 100);
    } else if (matches(LexemeClass.PERCENT_OPERATOR, lexeme)) {
      return TokenGuess.of(Category.PERCENT_OPERATOR, lexeme);
    } else if (matches(LexemeClass.NUMBER, lexeme)) {
      return TokenGuess.of(Category.NUMBER, Double.valueOf(lexeme));
    } else if (matches(LexemeClass.FUNCTION, lexeme)) {
      return TokenGuess.of(Category.FUNCTION, lexeme.substring(0, lexeme.length() - 1));
    } else if (matches(LexemeClass.OPERATOR, lexeme)) {
      return TokenGuess.of(Category.OPERATOR, lexeme);
    } else if (matches(LexemeClass.PARENTHESIS, lexeme)) {
      return TokenGuess.of(Category.PARENTHESIS, lexeme);
    } else if (matches(LexemeClass.ARG_SEPARATOR, lexeme)) {
      return TokenGuess.of(Category.ARGUMENT_SEPARATOR, lexeme);
    } else if (matches(LexemeClass.IMPLICIT_INTERSECTION, lexeme)) {
      return TokenGuess.of(Category.IMPLICIT_INTERSECTION, lexeme);
    } else if (matches(LexemeClass.SPILL_OPERATOR, lexeme)) {
      return TokenGuess.of(Category.SPILL_OPERATOR, lexeme);
    } else if (matches(LexemeClass.WILDCARD, lexeme)) {
      return TokenGuess.of(Category.WILDCARD, lexeme);
    } else if (matches(LexemeClass.NAMED_RANGE, lexeme)) {
      return TokenGuess.of(Category.NAMED_RANGE, lexeme);
    }
    return TokenGuess.of(Category.EXPRESSION, lexeme);
  }

  private static boolean matches(LexemeClass lexemeClass, String lexeme) {
    return lexemeClass.pattern().matcher(lexeme).matches();
  }
}
