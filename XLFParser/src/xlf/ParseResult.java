package xlf;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** The outcome of {@link FormulaParser#tryParse}: a tree or a structured failure. */
public final class ParseResult {
  /** Why a formula could not be parsed. */
  @AutoValue
  public abstract static class ParseFailure {
    public enum Stage {
      LEX,
      PARSE;
    }

    public abstract Stage stage();

    /** The parse error sub-kind; absent for lexing failures. */
    public abstract Optional<ParseException.Kind> parseKind();

    public abstract int offset();

    public abstract String message();

    /** The cleaned source around {@link #offset()}. */
    public abstract String context();

    static ParseFailure of(LexException ex) {
      return new AutoValue_ParseResult_ParseFailure(
          Stage.LEX, Optional.empty(), ex.offset(), ex.errorMsg(), ex.context());
    }

    static ParseFailure of(ParseException ex, String context) {
      return new AutoValue_ParseResult_ParseFailure(
          Stage.PARSE, Optional.of(ex.kind()), ex.offset(), ex.errorMsg(), context);
    }
  }

  private final Optional<SyntaxNode> tree;
  private final Optional<ParseFailure> failure;

  private ParseResult(Optional<SyntaxNode> tree, Optional<ParseFailure> failure) {
    Preconditions.checkArgument(tree.isPresent() != failure.isPresent());
    this.tree = tree;
    this.failure = failure;
  }

  static ParseResult success(SyntaxNode tree) {
    return new ParseResult(Optional.of(tree), Optional.empty());
  }

  static ParseResult failure(ParseFailure failure) {
    return new ParseResult(Optional.empty(), Optional.of(failure));
  }

  public boolean isSuccess() {
    return tree.isPresent();
  }

  public SyntaxNode tree() {
    return tree.get();
  }

  public ParseFailure failure() {
    return failure.get();
  }

  @Override
  public String toString() {
    return isSuccess() ? "[tree: " + tree() + "]" : "[failure: " + failure() + "]";
  }
}
