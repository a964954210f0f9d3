package xlf;

/** Drops the child list of every childless node, post-order. */
public final class ChildrenPruner extends VoidSyntaxVisitor {
  private ChildrenPruner() {}

  public static void prune(SyntaxNode root) {
    root.accept(new ChildrenPruner(), null);
  }

  @Override
  protected void visitDefault(SyntaxNodeInterface node) {
    super.visitDefault(node);
    SyntaxNode syntaxNode = (SyntaxNode) node;
    if (syntaxNode.hasChildList() && syntaxNode.children().isEmpty()) {
      syntaxNode.pruneChildren();
    }
  }
}
