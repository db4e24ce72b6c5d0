package dfs;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * Checks events, actions, conditionals and repeats against the catalogue: names, selectors, tags,
 * positional arguments and game values.
 */
final class CatalogueValidator extends ErrorCollectingValidator {
  private final ActionCatalogue catalogue;

  CatalogueValidator(ActionCatalogue catalogue) {
    this.catalogue = catalogue;
  }

  @Override
  public void visitImpl(AST.Event event) {
    if (!catalogue.event(event.name()).isPresent()) {
      reject(
          event,
          CompilerException.Kind.UNKNOWN_ACTION,
          event.pos(),
          String.format("unknown event '%s'", event.name()));
    }
    super.visitImpl(event);
  }

  @Override
  public void visitImpl(Expression.Action action) {
    checkAction(action, action);
  }

  @Override
  public void visitImpl(Expression.Conditional conditional) {
    checkCondition(conditional, conditional.condition());
    conditional.thenBody().forEach(e -> e.accept(this, null));
    conditional.elseBody().forEach(e -> e.accept(this, null));
  }

  @Override
  public void visitImpl(Expression.Repeat repeat) {
    switch (repeat.kind()) {
      case FOREVER:
        break;
      case WHILE:
        checkCondition(repeat, repeat.condition().get());
        break;
      case NAMED:
        String name = repeat.name().get();
        Optional<ActionSchema> schema = catalogue.repeat(name);
        if (schema.isPresent()) {
          String what = "repeat " + name;
          checkTags(repeat, what, repeat.tags(), schema.get()::tag);
          checkArguments(repeat, what, schema.get(), repeat.args(), repeat.pos());
        } else {
          reject(
              repeat,
              CompilerException.Kind.UNKNOWN_ACTION,
              repeat.pos(),
              String.format("unknown repeat '%s'", name));
        }
        break;
    }
    repeat.body().forEach(e -> e.accept(this, null));
  }

  @Override
  public void visitImpl(Expression.Declaration declaration) {
    if (!declaration.initializer().isPresent()) {
      return;
    }

    Expression initializer = declaration.initializer().get();
    checkInitializer(
        declaration,
        Value.VariableRef.create(declaration.name(), declaration.pos()),
        initializer);
    if (declaration.kind().isPresent() && initializer.type() == Expression.Type.VALUE) {
      Value value = initializer.<Expression.ValueExpr>cast().value();
      ValueKind kind = declaration.kind().get();
      if (!kind.accepts(value)) {
        reject(
            declaration,
            CompilerException.Kind.INVALID_ARGUMENT,
            value.pos(),
            String.format(
                "variable '%s' is declared as %s but initialized with a %s value",
                declaration.name(),
                kind.sourceName(),
                value.type().name().toLowerCase()));
      }
    }
  }

  @Override
  public void visitImpl(Expression.Assignment assignment) {
    checkInitializer(assignment, assignment.target(), assignment.initializer());
  }

  private void checkInitializer(
      ASTNodeInterface owner, Value.VariableRef target, Expression initializer) {
    if (initializer.type() == Expression.Type.ACTION) {
      // The assigned variable is passed as the action's first argument.
      Expression.Action action = initializer.cast();
      checkAction(owner, action.withLeadingArgument(target));
    } else {
      checkValues(owner, ImmutableList.of(initializer.<Expression.ValueExpr>cast().value()));
    }
  }

  @Override
  public void visitImpl(Expression.Call call) {
    checkValues(call, call.args());
  }

  @Override
  public void visitImpl(Expression.Start start) {
    checkTags(start, "start " + start.name(), start.tags(), catalogue::startProcessTag);
  }

  private void checkAction(ASTNodeInterface owner, Expression.Action action) {
    Optional<ActionSchema> schema = catalogue.action(action.category(), action.name());
    String what = action.category().prefix() + "." + action.name();
    if (!schema.isPresent()) {
      reject(
          owner,
          CompilerException.Kind.UNKNOWN_ACTION,
          action.pos(),
          String.format("unknown action '%s'", what));
      return;
    }

    checkSelector(owner, what, action.category(), schema.get(), action.selector(), action.pos());
    checkTags(owner, what, action.tags(), schema.get()::tag);
    checkArguments(owner, what, schema.get(), action.args(), action.pos());
  }

  private void checkCondition(ASTNodeInterface owner, Expression.Condition condition) {
    String what = condition.category().conditionalKeyword().get() + " " + condition.name();
    Optional<ActionSchema> schema = catalogue.conditional(condition.category(), condition.name());
    if (!schema.isPresent()) {
      reject(
          owner,
          CompilerException.Kind.UNKNOWN_ACTION,
          condition.pos(),
          String.format("unknown condition '%s'", what));
      return;
    }

    checkSelector(
        owner, what, condition.category(), schema.get(), condition.selector(), condition.pos());
    checkTags(owner, what, condition.tags(), schema.get()::tag);
    checkArguments(owner, what, schema.get(), condition.args(), condition.pos());
  }

  private void checkSelector(
      ASTNodeInterface owner,
      String what,
      Category category,
      ActionSchema schema,
      Optional<String> selectorName,
      Tokenizer.Pos pos) {
    if (!selectorName.isPresent()) {
      return;
    }

    Optional<Selector> selector = Selector.fromSourceName(selectorName.get());
    if (!category.isTargeted()) {
      reject(
          owner,
          CompilerException.Kind.INVALID_SELECTOR,
          pos,
          String.format("'%s' does not take a selector", what));
    } else if (!selector.isPresent()) {
      reject(
          owner,
          CompilerException.Kind.INVALID_SELECTOR,
          pos,
          String.format("unknown selector '%s'", selectorName.get()));
    } else if (!schema.allowsSelector(category, selector.get())) {
      reject(
          owner,
          CompilerException.Kind.INVALID_SELECTOR,
          pos,
          String.format("selector '%s' is not allowed for '%s'", selectorName.get(), what));
    }
  }

  private void checkTags(
      ASTNodeInterface owner,
      String what,
      List<Expression.TagArg> tags,
      Function<String, Optional<TagSpec>> lookup) {
    Set<String> seen = new HashSet<>();
    for (Expression.TagArg tag : tags) {
      Optional<TagSpec> spec = lookup.apply(tag.name());
      if (!spec.isPresent()) {
        reject(
            owner,
            CompilerException.Kind.INVALID_TAG,
            tag.pos(),
            String.format("unknown tag '%s' for '%s'", tag.name(), what));
      } else if (!seen.add(tag.name())) {
        reject(
            owner,
            CompilerException.Kind.INVALID_TAG,
            tag.pos(),
            String.format("tag '%s' is given more than once", tag.name()));
      } else if (!spec.get().hasOption(tag.option())) {
        reject(
            owner,
            CompilerException.Kind.INVALID_TAG,
            tag.pos(),
            String.format(
                "invalid option '%s' for tag '%s', expected one of %s",
                tag.option(),
                tag.name(),
                spec.get().options()));
      }
    }
  }

  private void checkArguments(
      ASTNodeInterface owner,
      String what,
      ActionSchema schema,
      List<Value> args,
      Tokenizer.Pos pos) {
    try {
      ArgumentBinder.bind(what, schema.params(), args, pos);
    } catch (CompilerException ex) {
      reject(owner, ex);
    }
    checkValues(owner, args);
  }

  private void checkValues(ASTNodeInterface owner, List<Value> values) {
    for (Value value : values) {
      if (value.type() == Value.Type.GAME_VALUE) {
        checkGameValue(owner, value.cast());
      } else if (value.type() == Value.Type.PARTICLE) {
        checkParticle(owner, value.cast());
      }
    }
  }

  private void checkGameValue(ASTNodeInterface owner, Value.GameValue gameValue) {
    if (!catalogue.gameValue(gameValue.name()).isPresent()) {
      reject(
          owner,
          CompilerException.Kind.UNKNOWN_GAME_VALUE,
          gameValue.pos(),
          String.format("unknown game value '%s'", gameValue.name()));
    }
    if (gameValue.selector().isPresent()
        && !Selector.fromSourceName(gameValue.selector().get()).isPresent()) {
      reject(
          owner,
          CompilerException.Kind.INVALID_SELECTOR,
          gameValue.pos(),
          String.format("unknown selector '%s'", gameValue.selector().get()));
    }
  }

  private void checkParticle(ASTNodeInterface owner, Value.Particle particle) {
    if (!isWholeNumber(particle.amount())) {
      reject(
          owner,
          CompilerException.Kind.INVALID_ARGUMENT,
          particle.pos(),
          String.format(
              "particle amount must be a whole number, found %s",
              Numbers.format(particle.amount())));
    }
    for (Map.Entry<String, Value> field : particle.fields().entrySet()) {
      Optional<ParticleField> spec = ParticleField.fromSourceName(field.getKey());
      if (!spec.isPresent()) {
        reject(
            owner,
            CompilerException.Kind.INVALID_ARGUMENT,
            field.getValue().pos(),
            String.format("unknown particle field '%s'", field.getKey()));
      } else if (!spec.get().accepts(field.getValue())) {
        reject(
            owner,
            CompilerException.Kind.INVALID_ARGUMENT,
            field.getValue().pos(),
            String.format(
                "particle field '%s' expects a %s literal",
                field.getKey(),
                spec.get().valueType().name().toLowerCase()));
      } else if (spec.get().isIntegral()
          && !isWholeNumber(field.getValue().<Value.Number>cast().value())) {
        reject(
            owner,
            CompilerException.Kind.INVALID_ARGUMENT,
            field.getValue().pos(),
            String.format("particle field '%s' expects a whole number", field.getKey()));
      }
    }
  }

  private static boolean isWholeNumber(double value) {
    return value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
  }
}
