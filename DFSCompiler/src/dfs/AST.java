package dfs;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import dfs.processor.ASTChild;
import dfs.processor.ASTNode;

/** A parsed source file: file-level declarations followed by events, functions and processes. */
@ASTNode
public class AST implements AST_ASTNode {

  // use "lib/common.dfrs";
  @AutoValue
  public abstract static class Use {
    public abstract String path();

    public abstract Tokenizer.Pos pos();

    public static Use create(String path, Tokenizer.Pos pos) {
      return new AutoValue_AST_Use(path, pos);
    }
  }

  private final ImmutableList<Use> uses;
  private final ImmutableList<Expression.Declaration> declarations;
  private final ImmutableList<Unit> units;
  private final Tokenizer.Pos pos;

  private AST(
      ImmutableList<Use> uses,
      ImmutableList<Expression.Declaration> declarations,
      ImmutableList<Unit> units,
      Tokenizer.Pos pos) {
    this.uses = uses;
    this.declarations = declarations;
    this.units = units;
    this.pos = pos;
  }

  public static AST create(
      Iterable<Expression.Declaration> declarations,
      Iterable<? extends Unit> units,
      Tokenizer.Pos pos) {
    return create(ImmutableList.of(), declarations, units, pos);
  }

  public static AST create(
      Iterable<Use> uses,
      Iterable<Expression.Declaration> declarations,
      Iterable<? extends Unit> units,
      Tokenizer.Pos pos) {
    return new AST(
        ImmutableList.copyOf(uses),
        ImmutableList.copyOf(declarations),
        ImmutableList.copyOf(units),
        pos);
  }

  /** Other source files this one imports. They are recorded in order, not loaded. */
  public ImmutableList<Use> uses() {
    return uses;
  }

  @ASTChild
  @Override
  public ImmutableList<Expression.Declaration> declarations() {
    return declarations;
  }

  @ASTChild
  @Override
  public ImmutableList<Unit> units() {
    return units;
  }

  @Override
  public Tokenizer.Pos pos() {
    return pos;
  }

  /** A top-level code line: one header block followed by its body. */
  public abstract static class Unit implements ASTNodeInterface {
    public enum Type {
      EVENT,
      FUNCTION,
      PROCESS;
    }

    private final Type type;
    private final String name;
    private final ImmutableList<Expression> body;
    private final Tokenizer.Pos pos;

    protected Unit(Type type, String name, ImmutableList<Expression> body, Tokenizer.Pos pos) {
      this.type = type;
      this.name = name;
      this.body = body;
      this.pos = pos;
    }

    public Type type() {
      return type;
    }

    public String name() {
      return name;
    }

    /** The name used in the encoded header block. */
    public abstract String externalName();

    public ImmutableList<Expression> body() {
      return body;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    @SuppressWarnings("unchecked")
    public <T extends Unit> T cast() {
      return (T) this;
    }
  }

  // @join! { ... }
  @ASTNode
  public static final class Event extends Unit implements AST_Event_ASTNode {
    private final boolean cancelled;

    private Event(
        String name, boolean cancelled, ImmutableList<Expression> body, Tokenizer.Pos pos) {
      super(Type.EVENT, name, body, pos);
      this.cancelled = cancelled;
    }

    public static Event create(
        String name,
        boolean cancelled,
        Iterable<? extends Expression> body,
        Tokenizer.Pos pos) {
      return new Event(name, cancelled, ImmutableList.copyOf(body), pos);
    }

    public boolean cancelled() {
      return cancelled;
    }

    // Resolved through the catalogue.
    @Override
    public String externalName() {
      return name();
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> body() {
      return super.body();
    }
  }

  @AutoValue
  public abstract static class Param {
    public abstract String name();

    public abstract ValueKind kind();

    public abstract boolean optional();

    // Accepts one or more trailing values, or none when also optional.
    public abstract boolean variadic();

    // A literal used when an optional argument is left out.
    public abstract Optional<Value> defaultValue();

    public abstract Tokenizer.Pos pos();

    public boolean required() {
      return !optional();
    }

    public static Param create(
        String name, ValueKind kind, boolean optional, boolean variadic, Tokenizer.Pos pos) {
      return create(name, kind, optional, variadic, Optional.empty(), pos);
    }

    public static Param create(
        String name,
        ValueKind kind,
        boolean optional,
        boolean variadic,
        Optional<Value> defaultValue,
        Tokenizer.Pos pos) {
      return new AutoValue_AST_Param(name, kind, optional, variadic, defaultValue, pos);
    }
  }

  // fn greet: `Greet Player`(name: text, extra?) { ... }
  @ASTNode
  public static final class Function extends Unit implements AST_Function_ASTNode {
    private final Optional<String> overrideName;
    private final ImmutableList<Param> params;

    private Function(
        String name,
        Optional<String> overrideName,
        ImmutableList<Param> params,
        ImmutableList<Expression> body,
        Tokenizer.Pos pos) {
      super(Type.FUNCTION, name, body, pos);
      this.overrideName = overrideName;
      this.params = params;
    }

    public static Function create(
        String name,
        Optional<String> overrideName,
        Iterable<Param> params,
        Iterable<? extends Expression> body,
        Tokenizer.Pos pos) {
      return new Function(
          name, overrideName, ImmutableList.copyOf(params), ImmutableList.copyOf(body), pos);
    }

    public Optional<String> overrideName() {
      return overrideName;
    }

    @Override
    public String externalName() {
      return overrideName.orElse(name());
    }

    public ImmutableList<Param> params() {
      return params;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> body() {
      return super.body();
    }
  }

  @ASTNode
  public static final class Process extends Unit implements AST_Process_ASTNode {
    private final Optional<String> overrideName;

    private Process(
        String name,
        Optional<String> overrideName,
        ImmutableList<Expression> body,
        Tokenizer.Pos pos) {
      super(Type.PROCESS, name, body, pos);
      this.overrideName = overrideName;
    }

    public static Process create(
        String name,
        Optional<String> overrideName,
        Iterable<? extends Expression> body,
        Tokenizer.Pos pos) {
      return new Process(name, overrideName, ImmutableList.copyOf(body), pos);
    }

    public Optional<String> overrideName() {
      return overrideName;
    }

    @Override
    public String externalName() {
      return overrideName.orElse(name());
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> body() {
      return super.body();
    }
  }
}
