package xlf;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import xlf.processor.Visitable;

/**
 * A node of the formula syntax tree.
 *
 * <p>Nodes carry a {@link #kind()} tag, an optional decoded literal, an ordered child list and the
 * span of cleaned formula text they were derived from. The tree transforms replace child lists
 * wholesale; a child list may also be pruned entirely, in which case {@link #hasChildList()} is
 * false and {@link #children()} is empty.
 */
public abstract class SyntaxNode implements SyntaxNodeInterface {
  public static final ImmutableSet<String> RELATIONAL_OPERATORS =
      ImmutableSet.of("=", "<", ">", ">=", "<=", "<>");

  private final String kind;
  private final Tokenizer.Span span;
  private Optional<ImmutableList<SyntaxNode>> children;

  private SyntaxNode(String kind, Tokenizer.Span span, List<? extends SyntaxNode> children) {
    this.kind = Preconditions.checkNotNull(kind);
    this.span = Preconditions.checkNotNull(span);
    this.children = Optional.of(ImmutableList.copyOf(children));
  }

  public final String kind() {
    return kind;
  }

  public final Tokenizer.Span span() {
    return span;
  }

  public Optional<Object> literalValue() {
    return Optional.empty();
  }

  public Optional<String> label() {
    return Optional.empty();
  }

  public final ImmutableList<SyntaxNode> children() {
    return children.orElse(ImmutableList.of());
  }

  public final SyntaxNode child(int index) {
    return children().get(index);
  }

  /** False once {@link ChildrenPruner} has removed an empty child list. */
  public final boolean hasChildList() {
    return children.isPresent();
  }

  final void replaceChildren(List<? extends SyntaxNode> newChildren) {
    children = Optional.of(ImmutableList.copyOf(newChildren));
  }

  final void pruneChildren() {
    Preconditions.checkState(children().isEmpty(), "cannot prune a non-empty child list: %s", this);
    children = Optional.empty();
  }

  /** A new node of the same variant and fields, sharing this node's current child list. */
  abstract SyntaxNode shallowCopy();

  final <T extends SyntaxNode> T withChildListOf(T copy) {
    ((SyntaxNode) copy).children = children;
    return copy;
  }

  @Override
  public final <V> V visitChildren(SyntaxVisitor<V> visitor, V value) {
    return SyntaxNodeUtils.accept(children(), visitor, value);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind);
    literalValue().ifPresent(v -> sb.append('=').append(v));
    if (!children().isEmpty()) {
      sb.append('[');
      for (int i = 0; i < children().size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(child(i));
      }
      sb.append(']');
    }
    return sb.toString();
  }

  /** A scalar, reference or named-range leaf. */
  @Visitable
  public static final class Atom extends SyntaxNode implements SyntaxNode_Atom_Visitable {
    private final String text;
    private final Object value;

    private Atom(String kind, String text, Object value, Tokenizer.Span span) {
      super(kind, span, ImmutableList.of());
      this.text = text;
      this.value = Preconditions.checkNotNull(value);
    }

    public static Atom create(String kind, String text, Object value, Tokenizer.Span span) {
      return new Atom(kind, text, value, span);
    }

    /** An atom for {@code token}, decoding its literal value by token kind. */
    public static Atom fromToken(Tokenizer.Token token) {
      return new Atom(token.kind().name(), token.text(), decode(token), token.span());
    }

    public static Atom namedRange(Tokenizer.Token token) {
      return new Atom("NamedRange", token.text(), token.text(), token.span());
    }

    private static Object decode(Tokenizer.Token token) {
      String text = token.text();
      switch (token.kind()) {
        case NUMBER:
          return Double.valueOf(text);
        case PERCENTAGE:
          return Double.parseDouble(text.substring(0, text.length() - 1)) / 100;
        case LITERAL:
          return text.substring(1, text.length() - 1).replace("\"\"", "\"");
        case BOOLEAN:
          return Boolean.valueOf(text);
        default:
          return text;
      }
    }

    /** The source text the atom was parsed from. */
    public String text() {
      return text;
    }

    public Object value() {
      return value;
    }

    @Override
    public Optional<Object> literalValue() {
      return Optional.of(value);
    }

    @Override
    Atom shallowCopy() {
      return withChildListOf(new Atom(kind(), text, value, span()));
    }
  }

  /** Placeholder for an omitted call argument. */
  @Visitable
  public static final class Missing extends SyntaxNode implements SyntaxNode_Missing_Visitable {
    public static final String KIND = "Missing";

    private Missing(Tokenizer.Span span) {
      super(KIND, span, ImmutableList.of());
    }

    public static Missing at(int offset) {
      return new Missing(Tokenizer.Span.empty(offset));
    }

    @Override
    Missing shallowCopy() {
      return withChildListOf(new Missing(span()));
    }
  }

  /**
   * A bare operator with no operands. The parser never produces these; they appear in flattened
   * sibling sequences built by tooling, which {@link ComparisonCollapser} canonicalizes.
   */
  @Visitable
  public static final class Operator extends SyntaxNode implements SyntaxNode_Operator_Visitable {
    private Operator(String operator, Tokenizer.Span span) {
      super(operator, span, ImmutableList.of());
    }

    public static Operator create(String operator, Tokenizer.Span span) {
      return new Operator(operator, span);
    }

    @Override
    Operator shallowCopy() {
      return withChildListOf(new Operator(kind(), span()));
    }
  }

  /** Prefix {@code +}/{@code -} or postfix {@code %}. */
  @Visitable
  public static final class Unary extends SyntaxNode implements SyntaxNode_Unary_Visitable {
    private final boolean postfix;

    private Unary(
        String operator, List<SyntaxNode> operands, boolean postfix, Tokenizer.Span span) {
      super(operator, span, operands);
      this.postfix = postfix;
    }

    public static Unary prefix(Tokenizer.Token operator, SyntaxNode operand) {
      return new Unary(
          operator.text(),
          ImmutableList.of(operand),
          false,
          operator.span().through(operand.span()));
    }

    public static Unary postfix(SyntaxNode operand, Tokenizer.Token operator) {
      return new Unary(
          operator.text(),
          ImmutableList.of(operand),
          true,
          operand.span().through(operator.span()));
    }

    public boolean isPostfix() {
      return postfix;
    }

    public SyntaxNode operand() {
      return child(0);
    }

    @Override
    Unary shallowCopy() {
      return withChildListOf(new Unary(kind(), ImmutableList.of(), postfix, span()));
    }
  }

  /** An infix operator applied to two operands; the kind is the operator text. */
  @Visitable
  public static final class Binary extends SyntaxNode implements SyntaxNode_Binary_Visitable {
    private Binary(String operator, List<SyntaxNode> operands, Tokenizer.Span span) {
      super(operator, span, operands);
    }

    public static Binary create(String operator, SyntaxNode left, SyntaxNode right) {
      return new Binary(
          operator, ImmutableList.of(left, right), left.span().through(right.span()));
    }

    public SyntaxNode left() {
      return child(0);
    }

    public SyntaxNode right() {
      return child(1);
    }

    public boolean isRelational() {
      return RELATIONAL_OPERATORS.contains(kind());
    }

    @Override
    Binary shallowCopy() {
      return withChildListOf(new Binary(kind(), ImmutableList.of(), span()));
    }
  }

  /** {@code left:right}. */
  @Visitable
  public static final class Range extends SyntaxNode implements SyntaxNode_Range_Visitable {
    public static final String KIND = "Range";

    private Range(List<SyntaxNode> operands, Tokenizer.Span span) {
      super(KIND, span, operands);
    }

    public static Range create(SyntaxNode left, SyntaxNode right) {
      return new Range(ImmutableList.of(left, right), left.span().through(right.span()));
    }

    public SyntaxNode left() {
      return child(0);
    }

    public SyntaxNode right() {
      return child(1);
    }

    @Override
    Range shallowCopy() {
      return withChildListOf(new Range(ImmutableList.of(), span()));
    }
  }

  /** A function call; the kind is the upper-cased function name. */
  @Visitable
  public static final class Call extends SyntaxNode implements SyntaxNode_Call_Visitable {
    private final String name;

    private Call(String name, List<? extends SyntaxNode> arguments, Tokenizer.Span span) {
      super(name.toUpperCase(Locale.ROOT), span, arguments);
      this.name = name;
    }

    public static Call create(
        String name, List<? extends SyntaxNode> arguments, Tokenizer.Span span) {
      return new Call(name, arguments, span);
    }

    /** The function name as written. */
    public String name() {
      return name;
    }

    public ImmutableList<SyntaxNode> arguments() {
      return children();
    }

    @Override
    Call shallowCopy() {
      return withChildListOf(new Call(name, ImmutableList.of(), span()));
    }
  }

  /** {@code left comparator right}, produced by {@link ComparisonCollapser}. */
  @Visitable
  public static final class Comparison extends SyntaxNode
      implements SyntaxNode_Comparison_Visitable {
    public static final String KIND = "Expression";

    private Comparison(List<? extends SyntaxNode> parts, Tokenizer.Span span) {
      super(KIND, span, parts);
    }

    public static Comparison create(SyntaxNode left, SyntaxNode comparator, SyntaxNode right) {
      return new Comparison(
          ImmutableList.of(left, comparator, right), left.span().through(right.span()));
    }

    @Override
    Comparison shallowCopy() {
      return withChildListOf(new Comparison(ImmutableList.of(), span()));
    }
  }

  /** A wrapper carrying a semantic label; its kind equals the label. */
  @Visitable
  public static final class Labeled extends SyntaxNode implements SyntaxNode_Labeled_Visitable {
    private Labeled(String label, List<? extends SyntaxNode> contents, Tokenizer.Span span) {
      super(label, span, contents);
    }

    public static Labeled create(
        String label, List<? extends SyntaxNode> contents, Tokenizer.Span span) {
      return new Labeled(label, contents, span);
    }

    @Override
    public Optional<String> label() {
      return Optional.of(kind());
    }

    @Override
    Labeled shallowCopy() {
      return withChildListOf(new Labeled(kind(), ImmutableList.of(), span()));
    }
  }
}
