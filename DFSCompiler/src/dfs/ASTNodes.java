package dfs;

import java.util.Optional;

/** Child traversal helpers called from the generated {@code visitChildren} implementations. */
public final class ASTNodes {
  public static <V> V accept(ASTNodeInterface obj, ASTVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    return obj.isPresent() ? accept(obj.get(), visitor, value) : value;
  }

  private ASTNodes() {}
}
