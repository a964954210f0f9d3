package xlf;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Converts formula text into a normalized syntax tree.
 *
 * <p>The pipeline is: {@link FormulaSource#clean}, tokenize, parse, {@link ComparisonCollapser},
 * {@link FilterNormalizer}, {@link ChildrenPruner}. A {@code FormulaParser} only holds immutable
 * tables and options, and every call builds its own {@link Tokenizer} and {@link Parser}, so one
 * instance can be shared between threads.
 */
public final class FormulaParser {
  private final TokenPatterns patterns;
  private final PrecedenceTable precedence;
  private final ParseOptions options;

  public FormulaParser() {
    this(ParseOptions.defaults());
  }

  public FormulaParser(ParseOptions options) {
    this(TokenPatterns.defaults(), PrecedenceTable.defaults(), options);
  }

  public FormulaParser(TokenPatterns patterns, PrecedenceTable precedence, ParseOptions options) {
    this.patterns = patterns;
    this.precedence = precedence;
    this.options = options;
  }

  public ParseOptions options() {
    return options;
  }

  public SyntaxNode parse(String formula) throws FormulaException {
    String cleaned = FormulaSource.clean(formula);
    return normalize(parseTokens(tokenize(cleaned)));
  }

  /**
   * Like {@link #parse} but reports bad input as a {@link ParseResult.ParseFailure} instead of
   * throwing.
   */
  public ParseResult tryParse(String formula) {
    String cleaned = FormulaSource.clean(formula);
    try {
      return ParseResult.success(normalize(parseTokens(tokenize(cleaned))));
    } catch (LexException ex) {
      return ParseResult.failure(ParseResult.ParseFailure.of(ex));
    } catch (ParseException ex) {
      return ParseResult.failure(
          ParseResult.ParseFailure.of(ex, LexException.contextAround(cleaned, ex.offset())));
    }
  }

  /** Tokenizes already-cleaned formula text. */
  public ImmutableList<Tokenizer.Token> tokenize(String cleaned) throws LexException {
    Tokenizer tokenizer = new Tokenizer(cleaned, patterns);
    return options.debugTokens() ? tokenizer.tokenize(options.debugOut()) : tokenizer.tokenize();
  }

  /** Parses a token stream into a raw tree, without the rewriting passes. */
  public SyntaxNode parseTokens(List<Tokenizer.Token> tokens) throws ParseException {
    return new Parser(tokens, precedence, options.maxNestingDepth()).parse();
  }

  private static SyntaxNode normalize(SyntaxNode root) {
    ComparisonCollapser.collapse(root);
    FilterNormalizer.normalize(root);
    ChildrenPruner.prune(root);
    return root;
  }
}
