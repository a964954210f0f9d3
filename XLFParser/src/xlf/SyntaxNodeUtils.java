package xlf;

public final class SyntaxNodeUtils {
  public static <V> V accept(SyntaxNodeInterface obj, SyntaxVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends SyntaxNodeInterface> obj, SyntaxVisitor<V> visitor, V value) {
    for (SyntaxNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  private SyntaxNodeUtils() {}
}
