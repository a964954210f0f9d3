package xlf;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Top-down operator precedence parser over a token stream. A parser instance holds the cursor for
 * one parse and must not be reused.
 */
public class Parser {
  private final ImmutableList<Tokenizer.Token> tokens;
  private final PrecedenceTable table;
  private final int maxNestingDepth;
  private final Tokenizer.Token eof;

  private int index = 0;
  private int depth = 0;

  public Parser(List<Tokenizer.Token> tokens, PrecedenceTable table, int maxNestingDepth) {
    this.tokens = ImmutableList.copyOf(tokens);
    this.table = table;
    this.maxNestingDepth = maxNestingDepth;

    int end = this.tokens.isEmpty() ? 0 : this.tokens.get(this.tokens.size() - 1).span().end();
    this.eof = Tokenizer.Token.create(Tokenizer.Token.Kind.EOF, "", Tokenizer.Span.empty(end));
  }

  /** Parses one complete expression which must be followed by end of input. */
  public SyntaxNode parse() throws ParseException {
    SyntaxNode root = expression(0);
    if (peek().kind() != Tokenizer.Token.Kind.EOF) {
      throw error(
          ParseException.Kind.UNEXPECTED_TRAILING_TOKEN,
          peek(),
          "unexpected trailing token " + describe(peek()));
    }
    return root;
  }

  private SyntaxNode expression(int rbp) throws ParseException {
    Tokenizer.Token token = advance();
    if (++depth > maxNestingDepth) {
      throw error(
          ParseException.Kind.NESTING_TOO_DEEP,
          token,
          String.format("formula nesting exceeds %d levels", maxNestingDepth));
    }

    try {
      PrecedenceTable.Rule rule = rule(token);
      if (!rule.prefix().isPresent()) {
        throw error(
            ParseException.Kind.UNEXPECTED_TOKEN, token, "unexpected token " + describe(token));
      }
      SyntaxNode left = prefix(rule.prefix().get(), token);

      while (rbp < rule(peek()).bindingPower()) {
        token = advance();
        rule = rule(token);
        if (!rule.infix().isPresent()) {
          throw error(
              ParseException.Kind.TOKEN_CANNOT_APPEAR_HERE,
              token,
              "token " + describe(token) + " cannot appear here");
        }
        left = infix(rule.infix().get(), rule.bindingPower(), left, token);
      }
      return left;
    } finally {
      depth--;
    }
  }

  private SyntaxNode prefix(PrecedenceTable.Prefix prefix, Tokenizer.Token token)
      throws ParseException {
    switch (prefix) {
      case ATOM:
        return SyntaxNode.Atom.fromToken(token);
      case SIGN:
        return SyntaxNode.Unary.prefix(
            token, expression(PrecedenceTable.PREFIX_OPERAND_POWER));
      case GROUP:
        {
          SyntaxNode inner = expression(0);
          expect(Tokenizer.Token.Kind.RPAREN);
          return inner;
        }
      case IDENTIFIER:
        return identifier(token);
    }
    throw new AssertionError(prefix);
  }

  private SyntaxNode infix(
      PrecedenceTable.Infix infix, int bindingPower, SyntaxNode left, Tokenizer.Token token)
      throws ParseException {
    switch (infix) {
      case LEFT:
        return SyntaxNode.Binary.create(token.text(), left, expression(bindingPower));
      case RIGHT:
        return SyntaxNode.Binary.create(token.text(), left, expression(bindingPower - 1));
      case RANGE:
        return SyntaxNode.Range.create(left, expression(bindingPower));
      case POSTFIX:
        return SyntaxNode.Unary.postfix(left, token);
    }
    throw new AssertionError(infix);
  }

  // NAME ( [arg] {, [arg]} ) or a bare name.
  private SyntaxNode identifier(Tokenizer.Token name) throws ParseException {
    if (!accept(Tokenizer.Token.Kind.LPAREN)) {
      return SyntaxNode.Atom.namedRange(name);
    }

    List<SyntaxNode> arguments = new ArrayList<>();
    if (peek().kind() != Tokenizer.Token.Kind.RPAREN) {
      while (true) {
        if (peek().kind() == Tokenizer.Token.Kind.COMMA) {
          arguments.add(SyntaxNode.Missing.at(peek().span().start()));
        } else {
          arguments.add(expression(0));
        }

        if (!accept(Tokenizer.Token.Kind.COMMA)) {
          break;
        }
        if (peek().kind() == Tokenizer.Token.Kind.RPAREN) {
          arguments.add(SyntaxNode.Missing.at(peek().span().start()));
          break;
        }
      }
    }

    Tokenizer.Token close = expect(Tokenizer.Token.Kind.RPAREN);
    return SyntaxNode.Call.create(name.text(), arguments, name.span().through(close.span()));
  }

  private PrecedenceTable.Rule rule(Tokenizer.Token token) throws ParseException {
    return table
        .lookup(token)
        .orElseThrow(
            () ->
                error(
                    ParseException.Kind.NO_GRAMMAR_RULE,
                    token,
                    "no grammar rule for token " + describe(token)));
  }

  private Tokenizer.Token peek() {
    return index < tokens.size() ? tokens.get(index) : eof;
  }

  private Tokenizer.Token advance() {
    Tokenizer.Token token = peek();
    if (index < tokens.size()) {
      index++;
    }
    return token;
  }

  private boolean accept(Tokenizer.Token.Kind kind) {
    if (peek().kind() == kind) {
      advance();
      return true;
    }
    return false;
  }

  private Tokenizer.Token expect(Tokenizer.Token.Kind kind) throws ParseException {
    if (peek().kind() != kind) {
      throw error(
          ParseException.Kind.EXPECTED_TOKEN_NOT_FOUND,
          peek(),
          String.format("expected %s but found %s", kind, describe(peek())));
    }
    return advance();
  }

  private static String describe(Tokenizer.Token token) {
    return token.kind() == Tokenizer.Token.Kind.EOF ? "end of input" : "'" + token.text() + "'";
  }

  private static ParseException error(
      ParseException.Kind kind, Tokenizer.Token token, String errorMsg) {
    return new ParseException(kind, token, errorMsg);
  }
}
