package dfs;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The callable shape of a function or process. Processes never take parameters. */
@AutoValue
public abstract class Signature {
  public enum Type {
    FUNCTION,
    PROCESS;
  }

  public abstract Type type();

  public abstract String name();

  public abstract String externalName();

  public abstract ImmutableList<AST.Param> params();

  public abstract Tokenizer.Pos pos();

  public int requiredCount() {
    return (int) params().stream().filter(AST.Param::required).count();
  }

  public boolean isVariadic() {
    return !params().isEmpty() && params().get(params().size() - 1).variadic();
  }

  public boolean acceptsArgumentCount(int count) {
    if (count < requiredCount()) {
      return false;
    }
    return isVariadic() || count <= params().size();
  }

  /** The parameter a positional argument binds to; trailing arguments bind to a variadic one. */
  public AST.Param paramFor(int index) {
    return params().get(Math.min(index, params().size() - 1));
  }

  public String describeArity() {
    int required = requiredCount();
    if (isVariadic()) {
      return String.format("at least %d", required);
    } else if (required == params().size()) {
      return String.valueOf(required);
    }
    return String.format("%d to %d", required, params().size());
  }

  public static Signature of(AST.Function function) {
    return new AutoValue_Signature(
        Type.FUNCTION,
        function.name(),
        function.externalName(),
        function.params(),
        function.pos());
  }

  public static Signature of(AST.Process process) {
    return new AutoValue_Signature(
        Type.PROCESS, process.name(), process.externalName(), ImmutableList.of(), process.pos());
  }
}
