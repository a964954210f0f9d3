package xlf;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Rebuilds {@code FILTER(array, include[, ifEmpty])} calls into labeled wrappers, splitting an
 * include mask of the form {@code (a)*(b)*...} into its individual clauses. Wrapped content is
 * always a fresh deep copy, so no node ends up with two parents.
 */
public final class FilterNormalizer extends VoidSyntaxVisitor {
  public static final String FILTER = "FILTER";
  public static final String ARRAY_LABEL = "array";
  public static final String INCLUDE_LABEL = "include";
  public static final String IF_EMPTY_LABEL = "ifEmpty";

  private final Set<SyntaxNode> visited = Sets.newIdentityHashSet();

  private FilterNormalizer() {}

  public static void normalize(SyntaxNode root) {
    root.accept(new FilterNormalizer(), null);
  }

  @Override
  protected void visitDefault(SyntaxNodeInterface node) {
    if (visited.add((SyntaxNode) node)) {
      super.visitDefault(node);
    }
  }

  @Override
  public void visitImpl(SyntaxNode.Call node) {
    if (!visited.add(node)) {
      return;
    }
    if (needsRebuild(node)) {
      node.replaceChildren(rebuild(node.children()));
    }
    super.visitDefault(node);
  }

  private static boolean needsRebuild(SyntaxNode.Call call) {
    if (!call.kind().equals(FILTER) || call.children().size() < 2) {
      return false;
    }
    return !call.child(0).label().filter(ARRAY_LABEL::equals).isPresent();
  }

  private static ImmutableList<SyntaxNode> rebuild(List<SyntaxNode> arguments) {
    SyntaxNode array = arguments.get(0);
    SyntaxNode includeMask = arguments.get(1);

    ImmutableList.Builder<SyntaxNode> rebuilt = ImmutableList.builder();
    rebuilt.add(
        SyntaxNode.Labeled.create(ARRAY_LABEL, ImmutableList.of(deepClone(array)), array.span()));

    List<SyntaxNode> clauses = new ArrayList<>();
    for (SyntaxNode clause : flattenProduct(includeMask)) {
      clauses.add(deepClone(clause));
    }
    // A mask made only of back edges flattens to nothing.
    Tokenizer.Span includeSpan = clauses.isEmpty() ? includeMask.span() : clauses.get(0).span();
    rebuilt.add(SyntaxNode.Labeled.create(INCLUDE_LABEL, clauses, includeSpan));

    if (arguments.size() > 2) {
      SyntaxNode ifEmpty = arguments.get(2);
      rebuilt.add(
          SyntaxNode.Labeled.create(
              IF_EMPTY_LABEL, ImmutableList.of(deepClone(ifEmpty)), ifEmpty.span()));
    }
    return rebuilt.build();
  }

  /** The leaf operands of a chain of binary {@code *} nodes, left to right. */
  static ImmutableList<SyntaxNode> flattenProduct(SyntaxNode mask) {
    ImmutableList.Builder<SyntaxNode> leaves = ImmutableList.builder();
    flattenProduct(mask, Sets.newIdentityHashSet(), leaves);
    return leaves.build();
  }

  private static void flattenProduct(
      SyntaxNode node, Set<SyntaxNode> seen, ImmutableList.Builder<SyntaxNode> leaves) {
    if (!seen.add(node)) {
      return;
    }
    if (node.kind().equals("*") && node.children().size() == 2) {
      flattenProduct(node.child(0), seen, leaves);
      flattenProduct(node.child(1), seen, leaves);
    } else {
      leaves.add(node);
    }
  }

  /**
   * Copies {@code node} and everything below it. An edge back to a node that is already being
   * copied higher up is dropped, so a cyclic input yields a finite tree.
   */
  static SyntaxNode deepClone(SyntaxNode node) {
    return deepClone(node, Sets.newIdentityHashSet());
  }

  private static SyntaxNode deepClone(SyntaxNode node, Set<SyntaxNode> ancestors) {
    ancestors.add(node);
    SyntaxNode copy = node.shallowCopy();
    if (node.hasChildList()) {
      List<SyntaxNode> children = new ArrayList<>();
      for (SyntaxNode child : node.children()) {
        if (!ancestors.contains(child)) {
          children.add(deepClone(child, ancestors));
        }
      }
      copy.replaceChildren(children);
    }
    ancestors.remove(node);
    return copy;
  }
}
