package xlf;

import java.io.PrintStream;
import java.util.List;
import java.util.regex.Matcher;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Splits a cleaned formula into tokens terminated by a single EOF token. Each instance tokenizes
 * its source once.
 */
public class Tokenizer {
  /** A half-open range {@code [start, end)} of character offsets into the cleaned formula. */
  @AutoValue
  public abstract static class Span {
    public abstract int start();

    public abstract int end();

    public static Span of(int start, int end) {
      Preconditions.checkArgument(
          0 <= start && start <= end, "invalid span [%s, %s)", start, end);
      return new AutoValue_Tokenizer_Span(start, end);
    }

    public static Span empty(int at) {
      return of(at, at);
    }

    public int length() {
      return end() - start();
    }

    public boolean isEmpty() {
      return start() == end();
    }

    /** The span from the start of this one to the end of {@code other}. */
    public Span through(Span other) {
      return of(start(), Math.max(start(), other.end()));
    }

    @Override
    public final String toString() {
      return "[" + start() + ", " + end() + ")";
    }
  }

  @AutoValue
  public abstract static class Token {
    public enum Kind {
      NUMBER,
      PERCENTAGE,
      LITERAL,
      BOOLEAN,
      ERROR,
      DYNAMIC_ERROR,
      CELL,
      RANGE,
      ARRAY,
      NAMED_RANGE,
      IDENT,
      LPAREN,
      RPAREN,
      COMMA,
      OPERATOR,
      WILDCARD,
      IMPLICIT_INTERSECTION,
      SPILL_OPERATOR,
      EOF;
    }

    public abstract Kind kind();

    public abstract String text();

    public abstract Span span();

    public static Token create(Kind kind, String text, Span span) {
      return new AutoValue_Tokenizer_Token(kind, text, span);
    }

    public boolean isOperator(String op) {
      return kind() == Kind.OPERATOR && text().equals(op);
    }

    /** The lookup key into a {@link PrecedenceTable}: operator text, otherwise the kind name. */
    public String ruleKey() {
      return kind() == Kind.OPERATOR ? text() : kind().name();
    }

    @Override
    public final String toString() {
      switch (kind()) {
        case OPERATOR:
          return text();
        case EOF:
          return kind().name();
        default:
          return kind() + "(" + text() + ")";
      }
    }
  }

  private final String source;
  private final TokenPatterns patterns;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int cursor = 0;
  private boolean consumed = false;

  public Tokenizer(String source) {
    this(source, TokenPatterns.defaults());
  }

  public Tokenizer(String source, TokenPatterns patterns) {
    this.source = source;
    this.patterns = patterns;
  }

  /** Tokenizes the source and writes the token dump to {@code debugOut}. */
  public ImmutableList<Token> tokenize(PrintStream debugOut) throws LexException {
    ImmutableList<Token> result = tokenize();
    debugOut.println(render(result));
    return result;
  }

  public ImmutableList<Token> tokenize() throws LexException {
    Preconditions.checkState(!consumed, "tokenizer already used");
    consumed = true;
    Matcher sheetRange = TokenPatterns.SHEET_QUALIFIED_RANGE.matcher(source);
    ImmutableList<Matcher> matchers =
        patterns
            .classes()
            .stream()
            .map(c -> c.pattern().matcher(source))
            .collect(ImmutableList.toImmutableList());

    while (cursor < source.length()) {
      sheetRange.region(cursor, source.length());
      if (sheetRange.lookingAt()) {
        emit(Token.Kind.CELL, sheetRange.start(1), sheetRange.end(1));
        emit(Token.Kind.OPERATOR, sheetRange.end(1), sheetRange.start(2));
        emit(Token.Kind.CELL, sheetRange.start(2), sheetRange.end(2));
        cursor = sheetRange.end();
        continue;
      }

      TokenPatterns.LexemeClass best = null;
      int bestEnd = cursor;
      for (int i = 0; i < matchers.size(); i++) {
        Matcher matcher = matchers.get(i);
        matcher.region(cursor, source.length());
        if (matcher.lookingAt() && matcher.end() > bestEnd) {
          best = patterns.classes().get(i);
          bestEnd = matcher.end();
        }
      }

      if (best == null) {
        throw new LexException(source, cursor);
      }
      retag(best, cursor, bestEnd);
      cursor = bestEnd;
    }

    emit(Token.Kind.EOF, source.length(), source.length());
    return tokens.build();
  }

  private void retag(TokenPatterns.LexemeClass lexemeClass, int start, int end) {
    switch (lexemeClass) {
      case FUNCTION:
        emit(Token.Kind.IDENT, start, end - 1);
        emit(Token.Kind.LPAREN, end - 1, end);
        return;
      case PARENTHESIS:
        emit(source.charAt(start) == '(' ? Token.Kind.LPAREN : Token.Kind.RPAREN, start, end);
        return;
      default:
        break;
    }

    int colon = source.indexOf(':', start);
    if (lexemeClass.isRangeable() && colon >= 0 && colon < end) {
      emit(Token.Kind.CELL, start, colon);
      emit(Token.Kind.OPERATOR, colon, colon + 1);
      emit(Token.Kind.CELL, colon + 1, end);
    } else {
      emit(lexemeClass.tokenKind(), start, end);
    }
  }

  private void emit(Token.Kind kind, int start, int end) {
    tokens.add(Token.create(kind, source.substring(start, end), Span.of(start, end)));
  }

  /** Renders tokens as space-separated {@code index:token} entries. */
  public static String render(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < tokens.size(); i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(i).append(':').append(tokens.get(i));
    }
    return sb.toString();
  }
}
