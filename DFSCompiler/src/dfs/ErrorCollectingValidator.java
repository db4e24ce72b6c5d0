package dfs;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Base for analysis passes. Errors are collected rather than thrown, and the node an error makes
 * unusable is marked rejected so code generation can leave it out.
 */
abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> errors = new ArrayList<>();
  private final Set<ASTNodeInterface> rejected = Sets.newIdentityHashSet();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected ImmutableSet<ASTNodeInterface> rejected() {
    return ImmutableSet.copyOf(rejected);
  }

  protected void logError(CompilerException.Kind kind, Tokenizer.Pos pos, String msg) {
    logError(new CompilerException(kind, pos, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  protected void reject(
      ASTNodeInterface node, CompilerException.Kind kind, Tokenizer.Pos pos, String msg) {
    reject(node, new CompilerException(kind, pos, msg));
  }

  protected void reject(ASTNodeInterface node, CompilerException ex) {
    logError(ex);
    rejected.add(node);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
    rejected.addAll(other.rejected);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
