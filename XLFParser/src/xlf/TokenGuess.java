package xlf;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class TokenGuess {
  public enum Category {
    LITERAL,
    BOOLEAN,
    DYNAMIC_ERROR,
    ERROR,
    ARRAY,
    THREE_D_REFERENCE,
    EXTERNAL_REFERENCE,
    STRUCTURED_REFERENCE_EXT,
    STRUCTURED_REFERENCE,
    R1C1,
    RANGE,
    CELL,
    PERCENTAGE,
    PERCENT_OPERATOR,
    NUMBER,
    FUNCTION,
    OPERATOR,
    PARENTHESIS,
    ARGUMENT_SEPARATOR,
    IMPLICIT_INTERSECTION,
    SPILL_OPERATOR,
    WILDCARD,
    NAMED_RANGE,
    EXPRESSION;
  }

  public abstract Category category();

  /**
   * The decoded value: the unquoted text of a literal, a {@link Boolean}, a {@link Double} for
   * numbers and percentages, the bare name of a function, otherwise the lexeme itself.
   */
  public abstract Object value();

  public static TokenGuess of(Category category, Object value) {
    return new AutoValue_TokenGuess(category, value);
  }
}
