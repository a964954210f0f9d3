package xlf;

import static com.google.common.truth.Truth.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

public class FilterNormalizerTest {

  private static SyntaxNode parseRaw(String formula) throws FormulaException {
    FormulaParser parser = new FormulaParser();
    return parser.parseTokens(parser.tokenize(FormulaSource.clean(formula)));
  }

  private static SyntaxNode.Atom cell(String ref) {
    return SyntaxNode.Atom.create("CELL", ref, ref, Tokenizer.Span.of(0, ref.length()));
  }

  // Fails if any node is reachable along two parent paths.
  private static void assertStrictTree(SyntaxNode root) {
    Set<SyntaxNode> seen = Sets.newIdentityHashSet();
    new VoidSyntaxVisitor() {
      @Override
      protected void visitDefault(SyntaxNodeInterface node) {
        assertThat(seen.add((SyntaxNode) node)).isTrue();
        super.visitDefault(node);
      }
    }.visitDefault(root);
  }

  @Test
  public void filterWithProductMask() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("FILTER(A1:A10,(B1:B10=1)*(C1:C10>2))");

    assertThat(root.kind()).isEqualTo("FILTER");
    assertThat(root.children()).hasSize(2);

    SyntaxNode array = root.child(0);
    assertThat(array).isInstanceOf(SyntaxNode.Labeled.class);
    assertThat(array.kind()).isEqualTo("array");
    assertThat(array.label()).hasValue("array");
    assertThat(array.span()).isEqualTo(Tokenizer.Span.of(7, 13));
    assertThat(array.children()).hasSize(1);
    assertThat(array.child(0).kind()).isEqualTo("Range");

    SyntaxNode include = root.child(1);
    assertThat(include.label()).hasValue("include");
    assertThat(include.children()).hasSize(2);
    assertThat(include.child(0).kind()).isEqualTo("=");
    assertThat(include.child(1).kind()).isEqualTo(">");
    assertThat(include.span()).isEqualTo(include.child(0).span());
    assertThat(include.span()).isEqualTo(Tokenizer.Span.of(15, 23));
  }

  @Test
  public void ifEmptyIsWrappedWhenPresent() throws FormulaException {
    SyntaxNode root =
        new FormulaParser().parse("FILTER(A1:B5,(A1:A5>0)*(B1:B5<3),\"none\")");

    assertThat(root.children()).hasSize(3);
    assertThat(root.child(1).children()).hasSize(2);
    assertThat(root.child(1).child(0).kind()).isEqualTo(">");
    assertThat(root.child(2).label()).hasValue("ifEmpty");
    assertThat(root.child(2).child(0).literalValue()).hasValue("none");
  }

  @Test
  public void longerProductChainIsFlattened() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("FILTER(A1:A9,(B1:B9>1)*(C1:C9<2)*(D1:D9))");

    SyntaxNode include = root.child(1);
    assertThat(include.children()).hasSize(3);
    assertThat(include.child(0).kind()).isEqualTo(">");
    assertThat(include.child(1).kind()).isEqualTo("<");
    assertThat(include.child(2).kind()).isEqualTo("Range");
  }

  @Test
  public void singleArgumentFilterIsUntouched() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("FILTER(A1:A9)");

    assertThat(root.children()).hasSize(1);
    assertThat(root.child(0).kind()).isEqualTo("Range");
  }

  @Test
  public void otherCallsAreUntouched() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("SUMIF(A1:A9,B1*2)");

    assertThat(root.children()).hasSize(2);
    assertThat(root.child(0).label()).isEmpty();
    assertThat(root.child(1).kind()).isEqualTo("*");
  }

  @Test
  public void nestedFiltersAreNormalized() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("SUM(FILTER(FILTER(A1:A5,B1:B5),C1:C5))");

    SyntaxNode outer = root.child(0);
    assertThat(outer.child(0).label()).hasValue("array");
    SyntaxNode inner = outer.child(0).child(0);
    assertThat(inner.kind()).isEqualTo("FILTER");
    assertThat(inner.child(0).label()).hasValue("array");
    assertThat(inner.child(1).label()).hasValue("include");
  }

  @Test
  public void normalizationIsIdempotent() throws FormulaException {
    SyntaxNode root = new FormulaParser().parse("FILTER(A1:A10,(B1:B10=1)*(C1:C10>2),0)");
    String before = SyntaxTreeJson.toJson(root).toString();

    FilterNormalizer.normalize(root);
    FilterNormalizer.normalize(root);

    assertThat(SyntaxTreeJson.toJson(root).toString()).isEqualTo(before);
  }

  @Test
  public void wrappedContentIsCopied() throws FormulaException {
    SyntaxNode root = parseRaw("FILTER(A1:A10,B1:B10>1)");
    SyntaxNode originalArray = root.child(0);
    SyntaxNode originalMask = root.child(1);

    FilterNormalizer.normalize(root);

    SyntaxNode copiedArray = root.child(0).child(0);
    assertThat(copiedArray).isNotSameInstanceAs(originalArray);
    assertThat(copiedArray.kind()).isEqualTo(originalArray.kind());
    assertThat(copiedArray.span()).isEqualTo(originalArray.span());
    assertThat(copiedArray.child(0)).isNotSameInstanceAs(originalArray.child(0));
    assertThat(root.child(1).child(0)).isNotSameInstanceAs(originalMask);
    assertStrictTree(root);
  }

  @Test
  public void maskClausesAreCopied() {
    SyntaxNode clause = SyntaxNode.Binary.create(">", cell("B1"), cell("C1"));
    SyntaxNode.Call filter =
        SyntaxNode.Call.create(
            "FILTER",
            ImmutableList.of(cell("A1"), SyntaxNode.Binary.create("*", clause, cell("D1"))),
            Tokenizer.Span.of(0, 30));

    FilterNormalizer.normalize(filter);

    assertThat(filter.child(1).children()).hasSize(2);
    assertThat(filter.child(1).child(0)).isNotSameInstanceAs(clause);
    assertStrictTree(filter);
  }

  @Test
  public void cyclicMaskTerminates() {
    SyntaxNode.Binary mask = SyntaxNode.Binary.create("*", cell("B1"), cell("C1"));
    mask.replaceChildren(ImmutableList.of(mask, cell("C1")));

    ImmutableList<SyntaxNode> clauses = FilterNormalizer.flattenProduct(mask);

    assertThat(clauses).hasSize(1);
    assertThat(clauses.get(0).kind()).isEqualTo("CELL");
  }

  @Test
  public void selfReferentialMaskYieldsEmptyInclude() {
    SyntaxNode.Binary mask = SyntaxNode.Binary.create("*", cell("B1"), cell("C1"));
    mask.replaceChildren(ImmutableList.of(mask, mask));
    SyntaxNode.Call filter =
        SyntaxNode.Call.create(
            "FILTER", ImmutableList.of(cell("A1"), mask), Tokenizer.Span.of(0, 20));

    FilterNormalizer.normalize(filter);

    assertThat(filter.children()).hasSize(2);
    assertThat(filter.child(0).label()).hasValue("array");
    SyntaxNode include = filter.child(1);
    assertThat(include.label()).hasValue("include");
    assertThat(include.children()).isEmpty();
    assertThat(include.span()).isEqualTo(mask.span());
  }

  @Test
  public void deepCloneDropsBackEdges() {
    SyntaxNode.Atom leaf = cell("A1");
    SyntaxNode.Call node =
        SyntaxNode.Call.create("F", ImmutableList.of(leaf), Tokenizer.Span.of(0, 5));
    node.replaceChildren(ImmutableList.of(leaf, node));

    SyntaxNode copy = FilterNormalizer.deepClone(node);

    assertThat(copy).isNotSameInstanceAs(node);
    assertThat(copy.kind()).isEqualTo("F");
    assertThat(copy.children()).hasSize(1);
    assertThat(copy.child(0)).isNotSameInstanceAs(leaf);
    assertThat(copy.child(0).literalValue()).hasValue("A1");
  }

  @Test
  public void deepCloneCopiesSharedSubtreesSeparately() {
    SyntaxNode.Atom shared = cell("A1");
    SyntaxNode.Binary node = SyntaxNode.Binary.create("+", shared, shared);

    SyntaxNode copy = FilterNormalizer.deepClone(node);

    assertThat(copy.children()).hasSize(2);
    assertThat(copy.child(0)).isNotSameInstanceAs(copy.child(1));
    assertStrictTree(copy);
  }
}
