package xlf;

public interface SyntaxNodeInterface {
  <V> V accept(SyntaxVisitor<V> visitor, V value);

  <V> V visitChildren(SyntaxVisitor<V> visitor, V value);
}
