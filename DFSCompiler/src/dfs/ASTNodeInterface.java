package dfs;

public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  <V> V visitChildren(ASTVisitor<V> visitor, V value);

  /** Where the node starts in the source, or a block position for reconstructed trees. */
  Tokenizer.Pos pos();
}
