package dfs;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import dfs.processor.ASTChild;
import dfs.processor.ASTNode;

/** Statements that may appear in the body of an event, function or process. */
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    ACTION,
    CONDITIONAL,
    REPEAT,
    CALL,
    START,
    DECLARATION,
    ASSIGNMENT,
    VALUE;
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  protected Expression(Type type, Tokenizer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  @Override
  public Tokenizer.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  // name="option"
  @AutoValue
  public abstract static class TagArg {
    public abstract String name();

    public abstract String option();

    public abstract Tokenizer.Pos pos();

    public static TagArg create(String name, String option, Tokenizer.Pos pos) {
      return new AutoValue_Expression_TagArg(name, option, pos);
    }
  }

  // p:selection.sendMessage("Hi", alignmentMode="Centered");
  @ASTNode
  public static final class Action extends Expression implements Expression_Action_ASTNode {
    private final Category category;
    private final Optional<String> selector;
    private final String name;
    private final ImmutableList<Value> args;
    private final ImmutableList<TagArg> tags;

    private Action(
        Category category,
        Optional<String> selector,
        String name,
        ImmutableList<Value> args,
        ImmutableList<TagArg> tags,
        Tokenizer.Pos pos) {
      super(Type.ACTION, pos);
      this.category = category;
      this.selector = selector;
      this.name = name;
      this.args = args;
      this.tags = tags;
    }

    public static Action create(
        Category category,
        Optional<String> selector,
        String name,
        Iterable<? extends Value> args,
        Iterable<TagArg> tags,
        Tokenizer.Pos pos) {
      return new Action(
          category, selector, name, ImmutableList.copyOf(args), ImmutableList.copyOf(tags), pos);
    }

    public Category category() {
      return category;
    }

    public Optional<String> selector() {
      return selector;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Value> args() {
      return args;
    }

    public ImmutableList<TagArg> tags() {
      return tags;
    }

    /** The same action with {@code first} inserted before the written arguments. */
    public Action withLeadingArgument(Value first) {
      return new Action(
          category,
          selector,
          name,
          ImmutableList.<Value>builder().add(first).addAll(args).build(),
          tags,
          pos());
    }
  }

  // ifp:selection !isSneaking()
  @ASTNode
  public static final class Condition implements Expression_Condition_ASTNode {
    private final Category category;
    private final Optional<String> selector;
    private final boolean negated;
    private final String name;
    private final ImmutableList<Value> args;
    private final ImmutableList<TagArg> tags;
    private final Tokenizer.Pos pos;

    private Condition(
        Category category,
        Optional<String> selector,
        boolean negated,
        String name,
        ImmutableList<Value> args,
        ImmutableList<TagArg> tags,
        Tokenizer.Pos pos) {
      this.category = category;
      this.selector = selector;
      this.negated = negated;
      this.name = name;
      this.args = args;
      this.tags = tags;
      this.pos = pos;
    }

    public static Condition create(
        Category category,
        Optional<String> selector,
        boolean negated,
        String name,
        Iterable<? extends Value> args,
        Iterable<TagArg> tags,
        Tokenizer.Pos pos) {
      return new Condition(
          category,
          selector,
          negated,
          name,
          ImmutableList.copyOf(args),
          ImmutableList.copyOf(tags),
          pos);
    }

    public Category category() {
      return category;
    }

    public Optional<String> selector() {
      return selector;
    }

    public boolean negated() {
      return negated;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Value> args() {
      return args;
    }

    public ImmutableList<TagArg> tags() {
      return tags;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }
  }

  @ASTNode
  public static final class Conditional extends Expression
      implements Expression_Conditional_ASTNode {
    private final Condition condition;
    private final ImmutableList<Expression> thenBody;
    private final boolean hasElse;
    private final ImmutableList<Expression> elseBody;

    private Conditional(
        Condition condition,
        ImmutableList<Expression> thenBody,
        boolean hasElse,
        ImmutableList<Expression> elseBody,
        Tokenizer.Pos pos) {
      super(Type.CONDITIONAL, pos);
      this.condition = condition;
      this.thenBody = thenBody;
      this.hasElse = hasElse;
      this.elseBody = elseBody;
    }

    public static Conditional create(
        Condition condition,
        Iterable<? extends Expression> thenBody,
        Optional<? extends Iterable<? extends Expression>> elseBody) {
      return new Conditional(
          condition,
          ImmutableList.copyOf(thenBody),
          elseBody.isPresent(),
          elseBody.isPresent() ? ImmutableList.copyOf(elseBody.get()) : ImmutableList.of(),
          condition.pos());
    }

    @ASTChild
    @Override
    public Condition condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> thenBody() {
      return thenBody;
    }

    public boolean hasElse() {
      return hasElse;
    }

    // Empty when there is no else branch.
    @ASTChild
    @Override
    public ImmutableList<Expression> elseBody() {
      return elseBody;
    }
  }

  @ASTNode
  public static final class Repeat extends Expression implements Expression_Repeat_ASTNode {
    public enum Kind {
      FOREVER("Forever"),
      WHILE("While"),
      // A repeat action from the catalogue, e.g. repeat Multiple(10)
      NAMED(null);

      private final String externalName;

      Kind(String externalName) {
        this.externalName = externalName;
      }

      public Optional<String> externalName() {
        return Optional.ofNullable(externalName);
      }
    }

    private final Kind kind;
    private final Optional<String> name;
    private final ImmutableList<Value> args;
    private final ImmutableList<TagArg> tags;
    private final Optional<Condition> condition;
    private final ImmutableList<Expression> body;

    private Repeat(
        Kind kind,
        Optional<String> name,
        ImmutableList<Value> args,
        ImmutableList<TagArg> tags,
        Optional<Condition> condition,
        ImmutableList<Expression> body,
        Tokenizer.Pos pos) {
      super(Type.REPEAT, pos);
      this.kind = kind;
      this.name = name;
      this.args = args;
      this.tags = tags;
      this.condition = condition;
      this.body = body;
    }

    public static Repeat forever(Iterable<? extends Expression> body, Tokenizer.Pos pos) {
      return new Repeat(
          Kind.FOREVER,
          Optional.empty(),
          ImmutableList.of(),
          ImmutableList.of(),
          Optional.empty(),
          ImmutableList.copyOf(body),
          pos);
    }

    public static Repeat whileTrue(
        Condition condition, Iterable<? extends Expression> body, Tokenizer.Pos pos) {
      return new Repeat(
          Kind.WHILE,
          Optional.empty(),
          ImmutableList.of(),
          ImmutableList.of(),
          Optional.of(condition),
          ImmutableList.copyOf(body),
          pos);
    }

    public static Repeat named(
        String name,
        Iterable<? extends Value> args,
        Iterable<TagArg> tags,
        Iterable<? extends Expression> body,
        Tokenizer.Pos pos) {
      return new Repeat(
          Kind.NAMED,
          Optional.of(name),
          ImmutableList.copyOf(args),
          ImmutableList.copyOf(tags),
          Optional.empty(),
          ImmutableList.copyOf(body),
          pos);
    }

    public Kind kind() {
      return kind;
    }

    public Optional<String> name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Value> args() {
      return args;
    }

    public ImmutableList<TagArg> tags() {
      return tags;
    }

    @ASTChild
    @Override
    public Optional<Condition> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> body() {
      return body;
    }
  }

  // greet("Steve");
  @ASTNode
  public static final class Call extends Expression implements Expression_Call_ASTNode {
    private final String name;
    private final ImmutableList<Value> args;

    private Call(String name, ImmutableList<Value> args, Tokenizer.Pos pos) {
      super(Type.CALL, pos);
      this.name = name;
      this.args = args;
    }

    public static Call create(String name, Iterable<? extends Value> args, Tokenizer.Pos pos) {
      return new Call(name, ImmutableList.copyOf(args), pos);
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Value> args() {
      return args;
    }
  }

  // start cleanup(localVariables="Copy");
  @ASTNode
  public static final class Start extends Expression implements Expression_Start_ASTNode {
    private final String name;
    private final ImmutableList<TagArg> tags;

    private Start(String name, ImmutableList<TagArg> tags, Tokenizer.Pos pos) {
      super(Type.START, pos);
      this.name = name;
      this.tags = tags;
    }

    public static Start create(String name, Iterable<TagArg> tags, Tokenizer.Pos pos) {
      return new Start(name, ImmutableList.copyOf(tags), pos);
    }

    public String name() {
      return name;
    }

    public ImmutableList<TagArg> tags() {
      return tags;
    }
  }

  // line counter: `Counter Value`: number = v.add(1, 2);
  @ASTNode
  public static final class Declaration extends Expression
      implements Expression_Declaration_ASTNode {
    private final VariableScope scope;
    private final String name;
    private final Optional<String> overrideName;
    private final Optional<ValueKind> kind;
    private final Optional<Expression> initializer;

    private Declaration(
        VariableScope scope,
        String name,
        Optional<String> overrideName,
        Optional<ValueKind> kind,
        Optional<Expression> initializer,
        Tokenizer.Pos pos) {
      super(Type.DECLARATION, pos);
      this.scope = scope;
      this.name = name;
      this.overrideName = overrideName;
      this.kind = kind;
      this.initializer = initializer;
    }

    public static Declaration create(
        VariableScope scope,
        String name,
        Optional<String> overrideName,
        Optional<? extends Expression> initializer,
        Tokenizer.Pos pos) {
      return create(scope, name, overrideName, Optional.empty(), initializer, pos);
    }

    public static Declaration create(
        VariableScope scope,
        String name,
        Optional<String> overrideName,
        Optional<ValueKind> kind,
        Optional<? extends Expression> initializer,
        Tokenizer.Pos pos) {
      return new Declaration(
          scope, name, overrideName, kind, initializer.map(Expression.class::cast), pos);
    }

    public VariableScope scope() {
      return scope;
    }

    public String name() {
      return name;
    }

    public Optional<String> overrideName() {
      return overrideName;
    }

    /** The annotated kind, checked against a value initializer. Never encoded. */
    public Optional<ValueKind> kind() {
      return kind;
    }

    /** The variable name used in the encoded blocks. */
    public String externalName() {
      return overrideName.orElse(name);
    }

    // Either an Action or a ValueExpr.
    @ASTChild
    @Override
    public Optional<Expression> initializer() {
      return initializer;
    }
  }

  // counter = v.add(counter, 1);
  @ASTNode
  public static final class Assignment extends Expression
      implements Expression_Assignment_ASTNode {
    private final Value.VariableRef target;
    private final Expression initializer;

    private Assignment(Value.VariableRef target, Expression initializer) {
      super(Type.ASSIGNMENT, target.pos());
      this.target = target;
      this.initializer = initializer;
    }

    public static Assignment create(Value.VariableRef target, Expression initializer) {
      return new Assignment(target, initializer);
    }

    @ASTChild
    @Override
    public Value.VariableRef target() {
      return target;
    }

    // Either an Action or a ValueExpr.
    @ASTChild
    @Override
    public Expression initializer() {
      return initializer;
    }
  }

  @ASTNode
  public static final class ValueExpr extends Expression implements Expression_ValueExpr_ASTNode {
    private final Value value;

    private ValueExpr(Value value) {
      super(Type.VALUE, value.pos());
      this.value = value;
    }

    public static ValueExpr create(Value value) {
      return new ValueExpr(value);
    }

    @ASTChild
    @Override
    public Value value() {
      return value;
    }
  }
}
