package xlf;

import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The ordered table of lexeme classes the {@link Tokenizer} matches against. Earlier classes win
 * ties between equally long matches. Instances are immutable and may be shared across threads.
 */
public final class TokenPatterns {

  private static final String SHEET = "(?:'[^']+'|[A-Za-z_][A-Za-z0-9_]*)";
  private static final String QUALIFIER = "(?:'[^']+'|\\[[^\\]]+\\]|[A-Za-z_][A-Za-z0-9_]*)";
  private static final String CELL_PART = "\\$?[A-Za-z]{1,3}\\$?\\d+";

  /** {@code Sheet!A1:B2}; group 1 is the qualified left cell, group 2 the right cell. */
  static final Pattern SHEET_QUALIFIED_RANGE =
      Pattern.compile("(" + QUALIFIER + "!" + CELL_PART + "):(" + CELL_PART + ")");

  public enum LexemeClass {
    // Scalars
    LITERAL(Tokenizer.Token.Kind.LITERAL, "\"(?:[^\"]|\"\")*\""),
    BOOLEAN(Tokenizer.Token.Kind.BOOLEAN, Pattern.compile("(?:TRUE|FALSE)", Pattern.CASE_INSENSITIVE)),
    NUMBER(Tokenizer.Token.Kind.NUMBER, "\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?"),
    PERCENTAGE(Tokenizer.Token.Kind.PERCENTAGE, "\\d+(?:\\.\\d+)?%"),

    // Errors
    DYNAMIC_ERROR(Tokenizer.Token.Kind.DYNAMIC_ERROR, "#(?:SPILL|CALC|BLOCKED|FIELD)!"),
    ERROR(Tokenizer.Token.Kind.ERROR, "#(?:NULL|DIV/0|VALUE|REF|NAME\\?|NUM|N/A|GETTING_DATA)[!?]?"),

    // References
    THREE_D_REFERENCE(
        Tokenizer.Token.Kind.CELL, SHEET + "\\s*:\\s*" + SHEET + "!" + CELL_PART, true),
    EXTERNAL_REFERENCE(Tokenizer.Token.Kind.CELL, "\\[[^\\]]+\\]" + SHEET + "!" + CELL_PART, true),
    RANGE(Tokenizer.Token.Kind.RANGE, QUALIFIER + "!" + CELL_PART + ":" + CELL_PART),
    CELL(Tokenizer.Token.Kind.CELL, QUALIFIER + "!" + CELL_PART, true),
    CELL_OR_RANGE(
        Tokenizer.Token.Kind.CELL,
        "(?:[A-Za-z_][A-Za-z0-9_]*!)?" + CELL_PART + "(?::" + CELL_PART + ")?",
        true),
    R1C1(Tokenizer.Token.Kind.CELL, "R\\d+C\\d+(?::R\\d+C\\d+)?"),
    STRUCTURED_EXT(Tokenizer.Token.Kind.CELL, "[A-Za-z_][A-Za-z0-9_]*\\[\\[[^\\]]+\\]\\]"),
    STRUCTURED_REFERENCE(Tokenizer.Token.Kind.CELL, "[A-Za-z_][A-Za-z0-9_]*\\[[^\\]]+\\]"),
    TABLE_COLUMN(Tokenizer.Token.Kind.CELL, "\\[@[A-Za-z0-9_]+\\]"),

    // Arrays are passed through opaquely.
    ARRAY(Tokenizer.Token.Kind.ARRAY, "\\{[^}]*\\}"),

    // Operators and punctuation. OPERATOR must stay above WILDCARD.
    OPERATOR(Tokenizer.Token.Kind.OPERATOR, "<=|>=|<>|[-+*/^&=<>]"),
    PERCENT_OPERATOR(Tokenizer.Token.Kind.OPERATOR, "%"),
    WILDCARD(Tokenizer.Token.Kind.WILDCARD, "[*?]"),
    PARENTHESIS(Tokenizer.Token.Kind.LPAREN, "[()]"),
    ARG_SEPARATOR(Tokenizer.Token.Kind.COMMA, "[,;]"),
    IMPLICIT_INTERSECTION(Tokenizer.Token.Kind.IMPLICIT_INTERSECTION, "@"),
    SPILL_OPERATOR(Tokenizer.Token.Kind.SPILL_OPERATOR, "#"),

    // Identifiers
    FUNCTION(Tokenizer.Token.Kind.IDENT, "[A-Za-z_][A-Za-z0-9_]*\\("),
    NAMED_RANGE(Tokenizer.Token.Kind.NAMED_RANGE, "[A-Za-z_][A-Za-z0-9_.]*");

    private final Tokenizer.Token.Kind tokenKind;
    private final Pattern pattern;
    private final boolean rangeable;

    LexemeClass(Tokenizer.Token.Kind tokenKind, String regex) {
      this(tokenKind, Pattern.compile(regex), false);
    }

    LexemeClass(Tokenizer.Token.Kind tokenKind, String regex, boolean rangeable) {
      this(tokenKind, Pattern.compile(regex), rangeable);
    }

    LexemeClass(Tokenizer.Token.Kind tokenKind, Pattern pattern) {
      this(tokenKind, pattern, false);
    }

    LexemeClass(Tokenizer.Token.Kind tokenKind, Pattern pattern, boolean rangeable) {
      this.tokenKind = tokenKind;
      this.pattern = pattern;
      this.rangeable = rangeable;
    }

    /** The kind emitted for an unsplit match of this class. */
    public Tokenizer.Token.Kind tokenKind() {
      return tokenKind;
    }

    public Pattern pattern() {
      return pattern;
    }

    /** Whether a match containing ':' is split into CELL ':' CELL. */
    public boolean isRangeable() {
      return rangeable;
    }

    /** Whether every reference syntax of this class canonicalizes to CELL. */
    public boolean isCellLike() {
      return tokenKind == Tokenizer.Token.Kind.CELL;
    }
  }

  private static final TokenPatterns DEFAULTS =
      new TokenPatterns(ImmutableList.copyOf(LexemeClass.values()));

  private final ImmutableList<LexemeClass> classes;

  private TokenPatterns(ImmutableList<LexemeClass> classes) {
    this.classes = classes;
  }

  public static TokenPatterns defaults() {
    return DEFAULTS;
  }

  /** A table matching only {@code classes}, with ties resolved in the given order. */
  public static TokenPatterns of(Iterable<LexemeClass> classes) {
    ImmutableList<LexemeClass> list = ImmutableList.copyOf(classes);
    Preconditions.checkArgument(!list.isEmpty(), "at least one lexeme class is required");
    Preconditions.checkArgument(
        list.stream().distinct().count() == list.size(), "duplicate lexeme class in %s", list);
    return new TokenPatterns(list);
  }

  public ImmutableList<LexemeClass> classes() {
    return classes;
  }
}
