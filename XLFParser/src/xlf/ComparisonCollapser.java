package xlf;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.Sets;

/**
 * Rewrites {@code left, comparator, right} sibling runs into single {@link SyntaxNode.Comparison}
 * nodes, depth first. Any child whose kind is one of {@link SyntaxNode#RELATIONAL_OPERATORS} counts
 * as a comparator, whether it is a bare operator marker or a complete comparison built by the
 * parser.
 */
public final class ComparisonCollapser extends VoidSyntaxVisitor {
  private final Set<SyntaxNode> visited = Sets.newIdentityHashSet();

  private ComparisonCollapser() {}

  public static void collapse(SyntaxNode root) {
    root.accept(new ComparisonCollapser(), null);
  }

  @Override
  protected void visitDefault(SyntaxNodeInterface node) {
    SyntaxNode syntaxNode = (SyntaxNode) node;
    if (!visited.add(syntaxNode)) {
      return;
    }
    List<SyntaxNode> children = syntaxNode.children();
    if (children.size() >= 3) {
      syntaxNode.replaceChildren(collapseRuns(children));
    }
    super.visitDefault(node);
  }

  // The parts of a comparison are not windowed again; its middle child is always relational.
  @Override
  public void visitImpl(SyntaxNode.Comparison node) {
    if (visited.add(node)) {
      super.visitDefault(node);
    }
  }

  private static List<SyntaxNode> collapseRuns(List<SyntaxNode> children) {
    List<SyntaxNode> collapsed = new ArrayList<>();
    int i = 0;
    while (i < children.size()) {
      if (i + 2 < children.size() && isComparator(children.get(i + 1))) {
        collapsed.add(
            SyntaxNode.Comparison.create(
                children.get(i), children.get(i + 1), children.get(i + 2)));
        i += 3;
      } else {
        collapsed.add(children.get(i));
        i++;
      }
    }
    return collapsed;
  }

  private static boolean isComparator(SyntaxNode node) {
    return SyntaxNode.RELATIONAL_OPERATORS.contains(node.kind());
  }
}
