package dfs;

import com.google.common.collect.ImmutableList;

/**
 * Runs the analysis passes over a parsed file. Registration completes before any body is checked;
 * every check pass runs even when an earlier one found errors.
 */
public class SemanticAnalyzer extends ErrorCollectingValidator {

  private final AST ast;
  private final ActionCatalogue catalogue;
  private final CompilerOptions options;

  public SemanticAnalyzer(AST ast, ActionCatalogue catalogue, CompilerOptions options) {
    this.ast = ast;
    this.catalogue = catalogue;
    this.options = options;
  }

  public AnnotatedAST analyze() {
    SignatureRegistry registry = new SignatureRegistry();
    accept(registry);

    ScopeValidator scopes = new ScopeValidator(options);
    accept(scopes);
    accept(new CallValidator(registry));
    accept(new CatalogueValidator(catalogue));

    ImmutableList<CompilerException> diagnostics = errors();
    return new AnnotatedAST(ast, registry, scopes.bindings(), rejected(), diagnostics);
  }

  private void accept(ErrorCollectingValidator visitor) {
    ast.accept(visitor, null);
    takeErrors(visitor);
  }
}
