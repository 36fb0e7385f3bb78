package wfl;

/** Common supertype of every workflow AST node; implemented through the generated interfaces. */
public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  <V> V visitChildren(ASTVisitor<V> visitor, V value);

  Tokenizer.Pos pos();
}
