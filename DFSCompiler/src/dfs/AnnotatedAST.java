package dfs;

import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** An analyzed AST: resolved variable uses, signatures, and the nodes analysis rejected. */
public final class AnnotatedAST {
  private final AST ast;
  private final SignatureRegistry signatures;
  private final ImmutableMap<Value.VariableRef, Symbol> bindings;
  private final ImmutableSet<ASTNodeInterface> rejected;
  private final ImmutableList<CompilerException> diagnostics;

  AnnotatedAST(
      AST ast,
      SignatureRegistry signatures,
      ImmutableMap<Value.VariableRef, Symbol> bindings,
      ImmutableSet<ASTNodeInterface> rejected,
      ImmutableList<CompilerException> diagnostics) {
    this.ast = ast;
    this.signatures = signatures;
    this.bindings = bindings;
    this.rejected = rejected;
    this.diagnostics = diagnostics;
  }

  public AST ast() {
    return ast;
  }

  public SignatureRegistry signatures() {
    return signatures;
  }

  /** The declaration a variable use resolved to; empty for undeclared uses. */
  public Optional<Symbol> symbol(Value.VariableRef ref) {
    return Optional.ofNullable(bindings.get(ref));
  }

  /** Whether an error makes the unit or expression unusable for code generation. */
  public boolean isRejected(ASTNodeInterface node) {
    return rejected.contains(node);
  }

  public ImmutableList<CompilerException> diagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(CompilerException::isError);
  }
}
