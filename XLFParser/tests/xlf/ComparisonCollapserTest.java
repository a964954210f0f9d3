package xlf;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ComparisonCollapserTest {

  private static SyntaxNode.Atom cell(String ref, int start) {
    return SyntaxNode.Atom.create("CELL", ref, ref, Tokenizer.Span.of(start, start + ref.length()));
  }

  private static SyntaxNode.Atom number(double value, int start, int end) {
    return SyntaxNode.Atom.create("NUMBER", "n", value, Tokenizer.Span.of(start, end));
  }

  private static SyntaxNode.Operator op(String text, int start) {
    return SyntaxNode.Operator.create(text, Tokenizer.Span.of(start, start + text.length()));
  }

  private static SyntaxNode.Call call(SyntaxNode... arguments) {
    return SyntaxNode.Call.create("SUM", ImmutableList.copyOf(arguments), Tokenizer.Span.of(0, 20));
  }

  @Test
  public void flattenedTripleIsWrapped() {
    SyntaxNode.Atom left = cell("A1", 4);
    SyntaxNode.Operator comparator = op(">", 6);
    SyntaxNode.Atom right = number(5, 7, 8);
    SyntaxNode.Call root = call(left, comparator, right);

    ComparisonCollapser.collapse(root);

    assertThat(root.children()).hasSize(1);
    SyntaxNode comparison = root.child(0);
    assertThat(comparison).isInstanceOf(SyntaxNode.Comparison.class);
    assertThat(comparison.kind()).isEqualTo("Expression");
    assertThat(comparison.span()).isEqualTo(Tokenizer.Span.of(4, 8));
    assertThat(comparison.children()).containsExactly(left, comparator, right).inOrder();
  }

  @Test
  public void runsAreScannedLeftToRight() {
    SyntaxNode.Call root =
        call(
            cell("A1", 0),
            op("<=", 2),
            number(1, 4, 5),
            cell("B1", 5),
            op("<>", 7),
            number(2, 9, 10),
            cell("C1", 10));

    ComparisonCollapser.collapse(root);

    assertThat(root.children()).hasSize(3);
    assertThat(root.child(0).kind()).isEqualTo("Expression");
    assertThat(root.child(1).kind()).isEqualTo("Expression");
    assertThat(root.child(1).child(1).kind()).isEqualTo("<>");
    assertThat(root.child(2).kind()).isEqualTo("CELL");
  }

  @Test
  public void arithmeticOperatorIsNotAComparator() {
    SyntaxNode.Call root = call(cell("A1", 0), op("+", 2), cell("B1", 3));

    ComparisonCollapser.collapse(root);

    assertThat(root.children()).hasSize(3);
    assertThat(root.child(1).kind()).isEqualTo("+");
  }

  @Test
  public void consecutiveComparators() {
    // The first comparator pairs with its neighbours even when the right one is an operator too.
    SyntaxNode.Call root = call(cell("A1", 0), op(">", 2), op(">", 3), number(5, 4, 5));

    ComparisonCollapser.collapse(root);

    assertThat(root.children()).hasSize(2);
    assertThat(root.child(0).kind()).isEqualTo("Expression");
    assertThat(root.child(0).child(2).kind()).isEqualTo(">");
    assertThat(root.child(1).kind()).isEqualTo("NUMBER");
  }

  @Test
  public void nestedSequencesAreCollapsed() {
    SyntaxNode.Call inner = call(cell("A1", 4), op("=", 6), number(1, 7, 8));
    SyntaxNode.Call root = call(inner, number(2, 10, 11));

    ComparisonCollapser.collapse(root);

    assertThat(root.children()).hasSize(2);
    assertThat(inner.children()).hasSize(1);
    assertThat(inner.child(0).kind()).isEqualTo("Expression");
  }

  @Test
  public void collapseIsIdempotent() {
    SyntaxNode.Call root = call(cell("A1", 0), op(">", 2), number(5, 3, 4));

    ComparisonCollapser.collapse(root);
    SyntaxNode comparison = root.child(0);
    ComparisonCollapser.collapse(root);

    assertThat(root.children()).containsExactly(comparison);
    assertThat(comparison.children()).hasSize(3);
    assertThat(comparison.child(0).kind()).isEqualTo("CELL");
  }

  @Test
  public void loneComparisonArgumentIsKept() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("SUM(A1>5)");

    assertThat(root.children()).hasSize(1);
    SyntaxNode comparison = root.child(0);
    assertThat(comparison.kind()).isEqualTo(">");
    assertThat(comparison.children()).hasSize(2);
    assertThat(comparison.child(0).kind()).isEqualTo("CELL");
    assertThat(comparison.child(0).literalValue()).hasValue("A1");
    assertThat(comparison.child(1).kind()).isEqualTo("NUMBER");
  }

  @Test
  public void parsedComparisonBetweenArgumentsIsWrapped() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("IF(A1,B1>2,C1)");

    assertThat(root.children()).hasSize(1);
    SyntaxNode expression = root.child(0);
    assertThat(expression).isInstanceOf(SyntaxNode.Comparison.class);
    assertThat(expression.span()).isEqualTo(Tokenizer.Span.of(3, 13));
    assertThat(expression.children()).hasSize(3);
    assertThat(expression.child(0).kind()).isEqualTo("CELL");
    assertThat(expression.child(2).kind()).isEqualTo("CELL");

    SyntaxNode comparator = expression.child(1);
    assertThat(comparator).isInstanceOf(SyntaxNode.Binary.class);
    assertThat(comparator.kind()).isEqualTo(">");
    assertThat(comparator.children()).hasSize(2);
    assertThat(comparator.child(0).literalValue()).hasValue("B1");
    assertThat(comparator.child(1).literalValue()).hasValue(2.0);
  }

  @Test
  public void wrappedParsedComparisonIsStable() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("IF(A1,B1>2,C1)");
    String before = SyntaxTreeJson.toJson(root).toString();

    ComparisonCollapser.collapse(root);

    assertThat(SyntaxTreeJson.toJson(root).toString()).isEqualTo(before);
  }

  @Test
  public void filterFallbackAfterComparisonIsWrappedFirst() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("FILTER(A1:A3,B1:B3>0,0)");

    assertThat(root.kind()).isEqualTo("FILTER");
    assertThat(root.children()).hasSize(1);
    assertThat(root.child(0).kind()).isEqualTo("Expression");
    assertThat(root.child(0).label()).isEmpty();
  }
}
