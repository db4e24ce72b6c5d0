package dfs;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Checks declaration-before-use and duplicate declarations, and binds every variable use. */
final class ScopeValidator extends ErrorCollectingValidator {
  private final CompilerOptions options;
  private final SymbolTable symbols = new SymbolTable();
  private final Map<Value.VariableRef, Symbol> bindings = new IdentityHashMap<>();

  ScopeValidator(CompilerOptions options) {
    this.options = options;
  }

  ImmutableMap<Value.VariableRef, Symbol> bindings() {
    return ImmutableMap.copyOf(bindings);
  }

  @Override
  public void visitImpl(AST ast) {
    for (Expression.Declaration declaration : ast.declarations()) {
      if (!declaration.scope().isGlobal()) {
        reject(
            declaration,
            CompilerException.Kind.INVALID_DECLARATION,
            declaration.pos(),
            String.format(
                "only game and save variables may be declared at file level, found %s '%s'",
                declaration.scope().keyword(),
                declaration.name()));
      } else if (declaration.initializer().isPresent()) {
        reject(
            declaration,
            CompilerException.Kind.INVALID_DECLARATION,
            declaration.pos(),
            String.format(
                "file-level variable '%s' cannot have an initializer", declaration.name()));
      }
      declare(declaration);
    }

    ast.units().forEach(unit -> unit.accept(this, null));
  }

  @Override
  public void visitImpl(AST.Event event) {
    checkBody(event.body());
  }

  @Override
  public void visitImpl(AST.Function function) {
    symbols.push();
    for (AST.Param param : function.params()) {
      Optional<Symbol> prev = symbols.declare(Symbol.of(param));
      if (prev.isPresent()) {
        reject(
            function,
            CompilerException.Kind.DUPLICATE_DECLARATION,
            param.pos(),
            String.format("duplicate parameter '%s'", param.name()));
      }
    }
    function.body().forEach(e -> e.accept(this, null));
    symbols.pop();
  }

  @Override
  public void visitImpl(AST.Process process) {
    checkBody(process.body());
  }

  @Override
  public void visitImpl(Expression.Action action) {
    checkReferences(action, action.args());
  }

  @Override
  public void visitImpl(Expression.Conditional conditional) {
    checkReferences(conditional, conditional.condition().args());
    checkBody(conditional.thenBody());
    if (conditional.hasElse()) {
      checkBody(conditional.elseBody());
    }
  }

  @Override
  public void visitImpl(Expression.Repeat repeat) {
    checkReferences(repeat, repeat.args());
    if (repeat.condition().isPresent()) {
      checkReferences(repeat, repeat.condition().get().args());
    }
    checkBody(repeat.body());
  }

  @Override
  public void visitImpl(Expression.Call call) {
    checkReferences(call, call.args());
  }

  @Override
  public void visitImpl(Expression.Declaration declaration) {
    if (declaration.scope().isGlobal() && !options.allowUnitGlobals()) {
      reject(
          declaration,
          CompilerException.Kind.INVALID_DECLARATION,
          declaration.pos(),
          String.format(
              "%s variable '%s' must be declared at file level",
              declaration.scope().keyword(),
              declaration.name()));
    }

    // The initializer cannot see the variable it initializes.
    if (declaration.initializer().isPresent()) {
      checkInitializer(declaration, declaration.initializer().get());
    }
    declare(declaration);
  }

  @Override
  public void visitImpl(Expression.Assignment assignment) {
    checkInitializer(assignment, assignment.initializer());
    checkReferences(assignment, ImmutableList.<Value>of(assignment.target()));
  }

  private void checkInitializer(ASTNodeInterface owner, Expression initializer) {
    if (initializer.type() == Expression.Type.ACTION) {
      checkReferences(owner, initializer.<Expression.Action>cast().args());
    } else {
      checkReferences(owner, ImmutableList.of(initializer.<Expression.ValueExpr>cast().value()));
    }
  }

  private void checkBody(List<Expression> body) {
    symbols.push();
    body.forEach(e -> e.accept(this, null));
    symbols.pop();
  }

  private void declare(Expression.Declaration declaration) {
    Optional<Symbol> prev = symbols.declare(Symbol.of(declaration));
    if (prev.isPresent()) {
      reject(
          declaration,
          CompilerException.Kind.DUPLICATE_DECLARATION,
          declaration.pos(),
          String.format(
              "duplicate declaration of %s variable '%s', previous declaration at %s",
              declaration.scope().keyword(),
              declaration.name(),
              prev.get().pos()));
    }
  }

  private void checkReferences(ASTNodeInterface owner, List<Value> values) {
    for (Value value : values) {
      if (value.type() != Value.Type.VARIABLE) {
        continue;
      }

      Value.VariableRef ref = value.cast();
      Optional<Symbol> symbol = symbols.resolve(ref.name());
      if (symbol.isPresent()) {
        bindings.put(ref, symbol.get());
      } else {
        reject(
            owner,
            CompilerException.Kind.UNDECLARED_VARIABLE,
            ref.pos(),
            String.format("undeclared variable '%s'", ref.name()));
      }
    }
  }
}
