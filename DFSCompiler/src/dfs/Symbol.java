package dfs;

import com.google.auto.value.AutoValue;

/** A declared variable, as resolved for one reference. */
@AutoValue
public abstract class Symbol {
  public abstract String name();

  public abstract VariableScope scope();

  public abstract String externalName();

  public abstract Tokenizer.Pos pos();

  public static Symbol create(
      String name, VariableScope scope, String externalName, Tokenizer.Pos pos) {
    return new AutoValue_Symbol(name, scope, externalName, pos);
  }

  public static Symbol of(Expression.Declaration declaration) {
    return create(
        declaration.name(), declaration.scope(), declaration.externalName(), declaration.pos());
  }

  public static Symbol of(AST.Param param) {
    return create(param.name(), VariableScope.LINE, param.name(), param.pos());
  }
}
